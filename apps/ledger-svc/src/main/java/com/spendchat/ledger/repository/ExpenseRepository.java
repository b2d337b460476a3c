package com.spendchat.ledger.repository;

import com.spendchat.ledger.model.ExpenseFilter;
import com.spendchat.ledger.model.ExpenseRecord;
import java.util.List;

/**
 * Append-only expense store. Implementations assign {@code id} and {@code recordedAt}, and
 * signal any persistence failure with {@link ExpenseStorageException}.
 */
public interface ExpenseRepository {

    /**
     * Persists a draft atomically and returns it with its store-assigned id and timestamp.
     */
    ExpenseRecord append(ExpenseRecord draft);

    /**
     * Records matching {@code filter}, in insertion order.
     */
    List<ExpenseRecord> findMatching(ExpenseFilter filter);
}
