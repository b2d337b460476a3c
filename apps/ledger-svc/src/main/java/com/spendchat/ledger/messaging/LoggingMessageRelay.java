package com.spendchat.ledger.messaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no messaging provider credentials are configured; replies only go to the log.
 */
public class LoggingMessageRelay implements MessageRelay {
    private static final Logger log = LoggerFactory.getLogger(LoggingMessageRelay.class);

    @Override
    public String send(OutboundMessage message) {
        log.info("Reply to {} (not delivered, relay disabled): {}", mask(message.recipient()), message.text());
        return "logged";
    }

    @Override
    public String name() {
        return "logging";
    }

    static String mask(String recipient) {
        if (recipient == null || recipient.length() <= 4) {
            return "****";
        }
        return "****" + recipient.substring(recipient.length() - 4);
    }
}
