package com.spendchat.ledger.messaging;

public record InboundMessage(String sender, String text) {
    public InboundMessage {
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("sender must be provided");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must be provided");
        }
    }
}
