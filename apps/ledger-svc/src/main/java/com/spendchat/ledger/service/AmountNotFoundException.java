package com.spendchat.ledger.service;

/**
 * No numeric amount could be resolved for an expense; nothing is recorded.
 */
public class AmountNotFoundException extends RuntimeException {

    public AmountNotFoundException(String message) {
        super(message);
    }
}
