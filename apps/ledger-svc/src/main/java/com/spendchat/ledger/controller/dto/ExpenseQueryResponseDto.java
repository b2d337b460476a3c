package com.spendchat.ledger.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record ExpenseQueryResponseDto(
        List<ExpenseResponseDto> records,
        BigDecimal total,
        String category,
        LocalDate date,
        String summary,
        String traceId
) {
}
