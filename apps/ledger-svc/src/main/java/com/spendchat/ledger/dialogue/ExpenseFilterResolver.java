package com.spendchat.ledger.dialogue;

import com.spendchat.ledger.categorization.Category;
import com.spendchat.ledger.model.ExpenseFilter;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Derives a query filter from free text. Category rules are evaluated top to bottom and the
 * first rule with a matching keyword wins, unlike categorization which unions every hit.
 */
@Component
public class ExpenseFilterResolver {

    public record FilterRule(List<String> keywords, Category category) {
        public FilterRule {
            keywords = List.copyOf(keywords);
        }

        boolean matches(String lowerText) {
            return keywords.stream().anyMatch(lowerText::contains);
        }
    }

    private static final List<FilterRule> RULES = List.of(
            new FilterRule(List.of("coffee"), Category.COFFEE),
            new FilterRule(List.of("online", "swiggy", "blinkit"), Category.ONLINE_FOOD),
            new FilterRule(List.of("grocery", "groceries", "bigbasket", "zepto"), Category.GROCERIES),
            new FilterRule(List.of("dinner", "lunch", "restaurant", "dining"), Category.DINING),
            new FilterRule(List.of("travel", "ola", "uber", "taxi", "train", "flight"), Category.TRAVEL),
            new FilterRule(List.of("shopping", "clothes", "fashion"), Category.SHOPPING),
            new FilterRule(List.of("book", "books", "novel", "magazine"), Category.BOOKS),
            new FilterRule(List.of("food", "snack", "alcohol"), Category.FOOD),
            new FilterRule(List.of("entertainment", "netflix", "disney", "prime"), Category.ENTERTAINMENT),
            new FilterRule(List.of("utilities", "electricity", "water", "internet", "gas"), Category.UTILITIES),
            new FilterRule(List.of("health", "doctor", "pharmacy", "medicine"), Category.HEALTH),
            new FilterRule(List.of("education", "tuition", "school", "college", "course"), Category.EDUCATION),
            new FilterRule(List.of("personal care", "salon", "spa", "beauty"), Category.PERSONAL_CARE),
            new FilterRule(List.of("rent", "apartment"), Category.RENT),
            new FilterRule(List.of("fuel", "petrol", "diesel"), Category.FUEL),
            new FilterRule(List.of("repair", "maintenance", "service"), Category.MAINTENANCE),
            // invest / donation / charity resolve to subscriptions, not to their own categories
            new FilterRule(List.of("subscription", "invest", "donation", "charity"), Category.SUBSCRIPTIONS)
    );

    public List<FilterRule> rules() {
        return RULES;
    }

    public Optional<Category> resolveCategory(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return RULES.stream()
                .filter(rule -> rule.matches(lower))
                .map(FilterRule::category)
                .findFirst();
    }

    public ExpenseFilter resolve(String text, LocalDate today) {
        return new ExpenseFilter(resolveCategory(text), DateHints.resolve(text, today));
    }
}
