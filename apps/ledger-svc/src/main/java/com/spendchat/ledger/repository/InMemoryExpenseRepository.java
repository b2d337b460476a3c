package com.spendchat.ledger.repository;

import com.spendchat.ledger.model.ExpenseFilter;
import com.spendchat.ledger.model.ExpenseRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryExpenseRepository implements ExpenseRepository {

    private final List<ExpenseRecord> storage = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryExpenseRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ExpenseRecord append(ExpenseRecord draft) {
        ExpenseRecord stored = draft.withStoreAssignment(sequence.incrementAndGet(),
                Instant.now(clock).truncatedTo(ChronoUnit.MICROS));
        storage.add(stored);
        return stored;
    }

    @Override
    public List<ExpenseRecord> findMatching(ExpenseFilter filter) {
        return storage.stream()
                .filter(filter::matches)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
