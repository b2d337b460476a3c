package com.spendchat.ledger.dialogue;

import com.spendchat.ledger.categorization.Category;
import com.spendchat.ledger.config.SpendchatProperties;
import com.spendchat.ledger.model.ExpenseAggregate;
import com.spendchat.ledger.model.ExpenseRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Renders ledger results as chat text (WhatsApp flavoured markdown).
 */
@Component
public class ExpenseSummaryFormatter {

    static final String NO_RESULTS = "❗ *No expenses found for the given criteria.*";
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.ENGLISH);

    private final String currencySymbol;

    public ExpenseSummaryFormatter(SpendchatProperties properties) {
        this.currencySymbol = properties.format().currencySymbol();
    }

    public String formatAggregate(ExpenseAggregate aggregate) {
        if (aggregate.isEmpty()) {
            return NO_RESULTS;
        }
        List<String> lines = new ArrayList<>();
        lines.add(header(aggregate));
        for (ExpenseRecord record : aggregate.records()) {
            lines.add("- **" + record.description() + "** – " + money(record.amount())
                    + " on " + formatDate(record.date())
                    + " _(Categories: " + record.categoryLabels() + ")_");
        }
        return String.join("\n", lines);
    }

    public String formatConfirmation(ExpenseRecord record) {
        return "✅ *Expense Recorded Successfully!*\n"
                + money(record.amount()) + " on " + formatDate(record.date())
                + " _(Categories: " + record.categoryLabels() + ")_";
    }

    private String header(ExpenseAggregate aggregate) {
        Optional<Category> category = aggregate.filter().category();
        Optional<LocalDate> date = aggregate.filter().date();
        if (category.isPresent() && date.isEmpty()) {
            return "**Your total " + category.get().displayName() + " expenditure " + category.get().glyph()
                    + " is " + money(aggregate.total()) + ", which includes:**";
        }
        if (date.isPresent() && category.isEmpty()) {
            return "**Expenses on " + formatDate(date.get()) + ":**";
        }
        if (date.isPresent()) {
            return "**Your " + category.get().displayName() + " expenses " + category.get().glyph()
                    + " on " + formatDate(date.get()) + ":**";
        }
        return "**Your Total Expenses are " + money(aggregate.total()) + ":**";
    }

    String money(BigDecimal amount) {
        return currencySymbol + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    static String formatDate(LocalDate date) {
        return DISPLAY_DATE.format(date);
    }
}
