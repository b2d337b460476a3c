package com.spendchat.ledger.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.spendchat.ledger.categorization.Category;
import com.spendchat.ledger.entity.ExpenseEntity;
import com.spendchat.ledger.model.ExpenseFilter;
import com.spendchat.ledger.model.ExpenseRecord;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;

class PostgreSQLExpenseRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-15T09:30:00Z");
    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);

    @Mock
    private JpaExpenseRepository jpaExpenseRepository;

    private PostgreSQLExpenseRepository repository;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        repository = new PostgreSQLExpenseRepository(jpaExpenseRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void appendStoresLabelsAndStampsRecordedAt() {
        when(jpaExpenseRepository.saveAndFlush(any(ExpenseEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ExpenseRecord stored = repository.append(ExpenseRecord.draft(
                "dinner at restaurant", new BigDecimal("450.00"), List.of(Category.FOOD, Category.DINING), DAY));

        assertThat(stored.categories()).containsExactly(Category.DINING, Category.FOOD);
        assertThat(stored.recordedAt()).isEqualTo(NOW);
        assertThat(stored.date()).isEqualTo(DAY);
    }

    @Test
    void recordedAtKeepsOnlyWhatTheColumnStores() {
        repository = new PostgreSQLExpenseRepository(jpaExpenseRepository,
                Clock.fixed(Instant.parse("2024-03-15T09:30:00.123456789Z"), ZoneOffset.UTC));
        when(jpaExpenseRepository.saveAndFlush(any(ExpenseEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ExpenseRecord stored = repository.append(ExpenseRecord.draft(
                "coffee", new BigDecimal("120.00"), List.of(Category.COFFEE), DAY));

        assertThat(stored.recordedAt()).isEqualTo(Instant.parse("2024-03-15T09:30:00.123456Z"));
    }

    @Test
    void storageFailureOnAppendIsConverted() {
        when(jpaExpenseRepository.saveAndFlush(any(ExpenseEntity.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> repository.append(ExpenseRecord.draft(
                "taxi", BigDecimal.TEN, List.of(Category.TRAVEL), DAY)))
                .isInstanceOf(ExpenseStorageException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void filterSelectsTheMatchingQuery() {
        ExpenseEntity entity = new ExpenseEntity("Uber to airport 800", new BigDecimal("800.00"), DAY, NOW,
                Set.of("travel", "transportation"));
        when(jpaExpenseRepository.findByCategory("travel")).thenReturn(List.of(entity));

        List<ExpenseRecord> records = repository.findMatching(ExpenseFilter.of(Category.TRAVEL, null));

        assertThat(records).singleElement()
                .satisfies(record -> assertThat(record.categories())
                        .containsExactly(Category.TRANSPORTATION, Category.TRAVEL));
        verify(jpaExpenseRepository, never()).findAllInInsertionOrder();
    }

    @Test
    void storageFailureOnQueryIsConverted() {
        when(jpaExpenseRepository.findByExpenseDate(DAY)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> repository.findMatching(ExpenseFilter.of(null, DAY)))
                .isInstanceOf(ExpenseStorageException.class);
    }
}
