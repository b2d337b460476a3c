package com.spendchat.ledger.dialogue;

public enum Intent {
    ADD_EXPENSE,
    QUERY_EXPENSE,
    UNKNOWN
}
