package com.spendchat.ledger.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.spendchat.ledger.categorization.Category;
import com.spendchat.ledger.model.ExpenseFilter;
import com.spendchat.ledger.model.ExpenseRecord;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryExpenseRepositoryTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);

    private final InMemoryExpenseRepository repository = new InMemoryExpenseRepository(
            Clock.fixed(Instant.parse("2024-03-15T09:30:00.123456789Z"), ZoneOffset.UTC));

    @Test
    void appendAssignsIdsAndMicrosecondRecordedAt() {
        ExpenseRecord first = repository.append(ExpenseRecord.draft(
                "taxi 200", new BigDecimal("200.00"), List.of(Category.TRAVEL), DAY));
        ExpenseRecord second = repository.append(ExpenseRecord.draft(
                "coffee 120", new BigDecimal("120.00"), List.of(Category.COFFEE), DAY));

        assertThat(first.id()).isEqualTo(1L);
        assertThat(second.id()).isEqualTo(2L);
        assertThat(first.recordedAt()).isEqualTo(Instant.parse("2024-03-15T09:30:00.123456Z"));
        assertThat(repository.findMatching(ExpenseFilter.none())).containsExactly(first, second);
    }

    @Test
    void findMatchingFiltersByCategory() {
        repository.append(ExpenseRecord.draft("taxi 200", new BigDecimal("200.00"), List.of(Category.TRAVEL), DAY));
        ExpenseRecord coffee = repository.append(ExpenseRecord.draft(
                "coffee 120", new BigDecimal("120.00"), List.of(Category.COFFEE), DAY));

        assertThat(repository.findMatching(ExpenseFilter.of(Category.COFFEE, null))).containsExactly(coffee);
    }
}
