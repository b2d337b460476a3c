package com.spendchat.ledger.service;

import com.spendchat.ledger.categorization.Category;
import com.spendchat.ledger.categorization.ExpenseCategorizer;
import com.spendchat.ledger.model.ExpenseAggregate;
import com.spendchat.ledger.model.ExpenseFilter;
import com.spendchat.ledger.model.ExpenseRecord;
import com.spendchat.ledger.repository.ExpenseRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ExpenseLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ExpenseLedgerService.class);
    private static final int MAX_DESCRIPTION_LENGTH = 2000;

    private final ExpenseRepository expenseRepository;
    private final ExpenseCategorizer expenseCategorizer;
    private final Clock clock;

    public ExpenseLedgerService(ExpenseRepository expenseRepository, ExpenseCategorizer expenseCategorizer, Clock clock) {
        this.expenseRepository = expenseRepository;
        this.expenseCategorizer = expenseCategorizer;
        this.clock = clock;
    }

    /**
     * Categorizes {@code rawText} and appends a new expense.
     *
     * @param amount already resolved amount; {@code null} means none could be found
     * @param date   date the expense is attributed to, today when {@code null}
     * @throws AmountNotFoundException when {@code amount} is null
     * @throws com.spendchat.ledger.repository.ExpenseStorageException when the store rejects the write
     */
    public ExpenseRecord record(String description, BigDecimal amount, String rawText, LocalDate date) {
        if (amount == null) {
            throw new AmountNotFoundException("No expense amount could be determined");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must be provided");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        BigDecimal normalizedAmount = amount.setScale(2, RoundingMode.HALF_UP);
        if (normalizedAmount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        LocalDate expenseDate = date != null ? date : today();
        List<Category> categories = expenseCategorizer.classify(rawText != null ? rawText : description);

        ExpenseRecord saved = expenseRepository.append(
                ExpenseRecord.draft(description.trim(), normalizedAmount, categories, expenseDate));
        log.info("Expense recorded: id={} amount={} categories={} date={}",
                saved.id(), saved.amount(), saved.categoryLabels(), saved.date());
        return saved;
    }

    public ExpenseAggregate query(ExpenseFilter filter) {
        ExpenseFilter effective = filter != null ? filter : ExpenseFilter.none();
        List<ExpenseRecord> records = expenseRepository.findMatching(effective);
        ExpenseAggregate aggregate = ExpenseAggregate.of(records, effective);
        log.info("Expense query: category={} date={} -> {} records, total={}",
                effective.category().map(Category::label).orElse(null),
                effective.date().orElse(null),
                records.size(),
                aggregate.total());
        return aggregate;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
