package com.spendchat.ledger.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a filtered query: matching records in insertion order and the sum of their amounts.
 */
public record ExpenseAggregate(List<ExpenseRecord> records, BigDecimal total, ExpenseFilter filter) {

    public ExpenseAggregate {
        records = List.copyOf(records);
    }

    public static ExpenseAggregate of(List<ExpenseRecord> records, ExpenseFilter filter) {
        BigDecimal total = records.stream()
                .map(ExpenseRecord::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new ExpenseAggregate(records, total, filter);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
