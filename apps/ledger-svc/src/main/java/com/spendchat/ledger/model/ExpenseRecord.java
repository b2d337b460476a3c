package com.spendchat.ledger.model;

import com.spendchat.ledger.categorization.Category;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A persisted expense. {@code id} and {@code recordedAt} are null only on a draft that has not
 * reached the store yet.
 */
public record ExpenseRecord(
        Long id,
        String description,
        BigDecimal amount,
        List<Category> categories,
        LocalDate date,
        Instant recordedAt
) {
    public ExpenseRecord {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must be provided");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("categories must not be empty");
        }
        if (date == null) {
            throw new IllegalArgumentException("date must be provided");
        }
        categories = List.copyOf(categories);
    }

    public static ExpenseRecord draft(String description, BigDecimal amount, List<Category> categories, LocalDate date) {
        return new ExpenseRecord(null, description, amount, categories, date, null);
    }

    public ExpenseRecord withStoreAssignment(Long assignedId, Instant assignedAt) {
        return new ExpenseRecord(assignedId, description, amount, categories, date, assignedAt);
    }

    public boolean hasCategory(Category category) {
        return categories.contains(category);
    }

    public String categoryLabels() {
        return categories.stream().map(Category::label).collect(Collectors.joining(", "));
    }
}
