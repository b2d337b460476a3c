package com.spendchat.ledger.repository;

import com.spendchat.ledger.categorization.Category;
import com.spendchat.ledger.entity.ExpenseEntity;
import com.spendchat.ledger.model.ExpenseFilter;
import com.spendchat.ledger.model.ExpenseRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;

@Repository
@Primary
public class PostgreSQLExpenseRepository implements ExpenseRepository {

    private static final Logger log = LoggerFactory.getLogger(PostgreSQLExpenseRepository.class);

    private final JpaExpenseRepository jpaExpenseRepository;
    private final Clock clock;

    public PostgreSQLExpenseRepository(JpaExpenseRepository jpaExpenseRepository, Clock clock) {
        this.jpaExpenseRepository = jpaExpenseRepository;
        this.clock = clock;
    }

    @Override
    public ExpenseRecord append(ExpenseRecord draft) {
        Set<String> labels = draft.categories().stream()
                .map(Category::label)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        ExpenseEntity entity = new ExpenseEntity(
                draft.description(),
                draft.amount(),
                draft.date(),
                Instant.now(clock).truncatedTo(ChronoUnit.MICROS),
                labels
        );
        try {
            // expense row and category rows commit in the repository's single transaction
            ExpenseEntity saved = jpaExpenseRepository.saveAndFlush(entity);
            return toModel(saved);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Failed to persist expense (date={}, categories={})", draft.date(), labels, ex);
            throw new ExpenseStorageException("Failed to persist expense", ex);
        }
    }

    @Override
    public List<ExpenseRecord> findMatching(ExpenseFilter filter) {
        Optional<String> category = filter.category().map(Category::label);
        Optional<LocalDate> date = filter.date();
        try {
            List<ExpenseEntity> entities;
            if (category.isPresent() && date.isPresent()) {
                entities = jpaExpenseRepository.findByCategoryAndExpenseDate(category.get(), date.get());
            } else if (category.isPresent()) {
                entities = jpaExpenseRepository.findByCategory(category.get());
            } else if (date.isPresent()) {
                entities = jpaExpenseRepository.findByExpenseDate(date.get());
            } else {
                entities = jpaExpenseRepository.findAllInInsertionOrder();
            }
            return entities.stream().map(this::toModel).toList();
        } catch (DataAccessException | TransactionException ex) {
            log.error("Failed to query expenses (category={}, date={})", category.orElse(null), date.orElse(null), ex);
            throw new ExpenseStorageException("Failed to query expenses", ex);
        }
    }

    private ExpenseRecord toModel(ExpenseEntity entity) {
        List<Category> categories = entity.getCategories().stream()
                .map(label -> Category.fromLabel(label).orElse(Category.OTHERS))
                .distinct()
                .sorted(Comparator.comparing(Category::label))
                .toList();
        return new ExpenseRecord(
                entity.getId(),
                entity.getDescription(),
                entity.getAmount(),
                categories.isEmpty() ? List.of(Category.OTHERS) : categories,
                entity.getExpenseDate(),
                entity.getRecordedAt()
        );
    }
}
