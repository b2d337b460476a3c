package com.spendchat.ledger.messaging;

/**
 * Delivers replies back to the chat user.
 */
public interface MessageRelay {

    /**
     * @return provider message id, or a local marker when nothing was sent remotely
     * @throws MessageDeliveryException when the provider rejects or cannot be reached
     */
    String send(OutboundMessage message);

    String name();
}
