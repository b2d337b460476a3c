package com.spendchat.ledger.controller.dto;

import com.spendchat.ledger.model.ExpenseRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record ExpenseResponseDto(
        Long id,
        String description,
        BigDecimal amount,
        List<String> categories,
        LocalDate date,
        Instant recordedAt
) {
    public static ExpenseResponseDto fromModel(ExpenseRecord record) {
        return new ExpenseResponseDto(
                record.id(),
                record.description(),
                record.amount(),
                record.categories().stream().map(c -> c.label()).toList(),
                record.date(),
                record.recordedAt()
        );
    }
}
