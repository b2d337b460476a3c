package com.spendchat.ledger.dialogue;

import com.spendchat.ledger.messaging.InboundMessage;

/**
 * Decides whether a message adds or queries expenses and extracts the hints the ledger needs.
 */
public interface DialogueOrchestrator {

    DialogueTurn interpret(InboundMessage message);
}
