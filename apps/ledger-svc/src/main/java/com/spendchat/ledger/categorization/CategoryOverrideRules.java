package com.spendchat.ledger.categorization;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Precedence rules for keywords that overlap between coffee, dining and generic food.
 * A coffee term suppresses the chai and dining branches but never its own coffee branch.
 */
public final class CategoryOverrideRules {

    private static final Logger log = LoggerFactory.getLogger(CategoryOverrideRules.class);

    static final List<String> COFFEE_TERMS = List.of("coffee", "cappuccino", "filter coffee", "cold coffee");
    static final List<String> DINING_TERMS = List.of("dinner", "lunch", "breakfast", "restaurant");
    private static final String CHAI = "chai";

    private CategoryOverrideRules() {
    }

    /**
     * @param normalizedText lowercased expense text
     */
    public static Set<Category> apply(String normalizedText) {
        EnumSet<Category> labels = EnumSet.noneOf(Category.class);
        if (normalizedText == null || normalizedText.isBlank()) {
            return labels;
        }
        boolean hasCoffeeTerm = containsAny(normalizedText, COFFEE_TERMS);

        if (normalizedText.contains(CHAI) && !hasCoffeeTerm) {
            log.debug("Override: '{}' without coffee terms -> food", CHAI);
            labels.add(Category.FOOD);
        }
        if (containsAny(normalizedText, DINING_TERMS) && !hasCoffeeTerm) {
            log.debug("Override: dining terms -> dining, food");
            labels.add(Category.DINING);
            labels.add(Category.FOOD);
        }
        if (hasCoffeeTerm) {
            log.debug("Override: coffee terms -> coffee, food");
            labels.add(Category.COFFEE);
            labels.add(Category.FOOD);
        }
        return labels;
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
