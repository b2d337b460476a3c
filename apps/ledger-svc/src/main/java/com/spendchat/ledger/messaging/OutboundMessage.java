package com.spendchat.ledger.messaging;

public record OutboundMessage(String recipient, String text) {
}
