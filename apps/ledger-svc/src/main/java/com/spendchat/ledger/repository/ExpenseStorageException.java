package com.spendchat.ledger.repository;

public class ExpenseStorageException extends RuntimeException {

    public ExpenseStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
