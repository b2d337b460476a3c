package com.spendchat.ledger.controller;

import com.spendchat.ledger.categorization.Category;
import com.spendchat.ledger.categorization.ExpenseCategorizer;
import com.spendchat.ledger.controller.dto.ClassifyRequestDto;
import com.spendchat.ledger.controller.dto.ClassifyResponseDto;
import com.spendchat.ledger.controller.dto.ExpenseQueryResponseDto;
import com.spendchat.ledger.controller.dto.ExpenseRecordRequestDto;
import com.spendchat.ledger.controller.dto.ExpenseResponseDto;
import com.spendchat.ledger.dialogue.ExpenseSummaryFormatter;
import com.spendchat.ledger.model.ExpenseAggregate;
import com.spendchat.ledger.model.ExpenseFilter;
import com.spendchat.ledger.model.ExpenseRecord;
import com.spendchat.ledger.security.RequestContextHolder;
import com.spendchat.ledger.service.ExpenseLedgerService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/expenses")
public class ExpensesController {

    private final ExpenseLedgerService ledgerService;
    private final ExpenseCategorizer categorizer;
    private final ExpenseSummaryFormatter formatter;

    public ExpensesController(
            ExpenseLedgerService ledgerService,
            ExpenseCategorizer categorizer,
            ExpenseSummaryFormatter formatter
    ) {
        this.ledgerService = ledgerService;
        this.categorizer = categorizer;
        this.formatter = formatter;
    }

    @PostMapping
    public ResponseEntity<ExpenseResponseDto> recordExpense(@Valid @RequestBody ExpenseRecordRequestDto request) {
        ExpenseRecord record = ledgerService.record(
                request.description(), request.amount(), request.description(), request.date());
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponseDto.fromModel(record));
    }

    @GetMapping
    public ResponseEntity<ExpenseQueryResponseDto> queryExpenses(
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "date", required = false) String date
    ) {
        ExpenseFilter filter = ExpenseFilter.of(parseCategory(category), parseDate(date));
        ExpenseAggregate aggregate = ledgerService.query(filter);
        String traceId = RequestContextHolder.currentTraceId().orElse(null);
        return ResponseEntity.ok(new ExpenseQueryResponseDto(
                aggregate.records().stream().map(ExpenseResponseDto::fromModel).toList(),
                aggregate.total(),
                filter.category().map(Category::label).orElse(null),
                filter.date().orElse(null),
                formatter.formatAggregate(aggregate),
                traceId
        ));
    }

    @PostMapping("/classify")
    public ResponseEntity<ClassifyResponseDto> classify(@Valid @RequestBody ClassifyRequestDto request) {
        var labels = categorizer.classify(request.text()).stream().map(Category::label).toList();
        return ResponseEntity.ok(new ClassifyResponseDto(labels));
    }

    private static Category parseCategory(String category) {
        if (category == null || category.isBlank()) {
            return null;
        }
        return Category.fromLabel(category)
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + category));
    }

    private static LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("date must be formatted as YYYY-MM-DD");
        }
    }
}
