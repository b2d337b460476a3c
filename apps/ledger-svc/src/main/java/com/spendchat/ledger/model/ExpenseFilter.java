package com.spendchat.ledger.model;

import com.spendchat.ledger.categorization.Category;
import java.time.LocalDate;
import java.util.Optional;

public record ExpenseFilter(Optional<Category> category, Optional<LocalDate> date) {

    public ExpenseFilter {
        category = category == null ? Optional.empty() : category;
        date = date == null ? Optional.empty() : date;
    }

    public static ExpenseFilter none() {
        return new ExpenseFilter(Optional.empty(), Optional.empty());
    }

    public static ExpenseFilter of(Category category, LocalDate date) {
        return new ExpenseFilter(Optional.ofNullable(category), Optional.ofNullable(date));
    }

    public boolean matches(ExpenseRecord record) {
        return category.map(record::hasCategory).orElse(true)
                && date.map(value -> value.equals(record.date())).orElse(true);
    }

    public boolean isEmpty() {
        return category.isEmpty() && date.isEmpty();
    }
}
