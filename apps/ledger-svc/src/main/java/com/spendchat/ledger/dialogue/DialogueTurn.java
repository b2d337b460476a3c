package com.spendchat.ledger.dialogue;

import com.spendchat.ledger.model.ExpenseFilter;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * What the orchestrator understood from one inbound message.
 *
 * @param amount      amount hint for {@link Intent#ADD_EXPENSE}, empty when none was found
 * @param expenseDate date to attribute a new expense to
 * @param filter      query filter for {@link Intent#QUERY_EXPENSE}
 */
public record DialogueTurn(Intent intent, Optional<BigDecimal> amount, LocalDate expenseDate, ExpenseFilter filter) {

    public static DialogueTurn addExpense(Optional<BigDecimal> amount, LocalDate expenseDate) {
        return new DialogueTurn(Intent.ADD_EXPENSE, amount, expenseDate, ExpenseFilter.none());
    }

    public static DialogueTurn queryExpense(ExpenseFilter filter) {
        return new DialogueTurn(Intent.QUERY_EXPENSE, Optional.empty(), null, filter);
    }

    public static DialogueTurn unknown() {
        return new DialogueTurn(Intent.UNKNOWN, Optional.empty(), null, ExpenseFilter.none());
    }
}
