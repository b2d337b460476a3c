package com.spendchat.ledger.categorization;

import static com.spendchat.ledger.categorization.Category.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered trigger phrase to category table. Every trigger found as a substring of the
 * lowercased text contributes its categories; nothing short-circuits.
 */
public final class KeywordMappingTable {

    private static final Logger log = LoggerFactory.getLogger(KeywordMappingTable.class);

    public record MappingRule(String trigger, Set<Category> categories) {
        public MappingRule {
            if (trigger == null || trigger.isBlank()) {
                throw new IllegalArgumentException("trigger must be provided");
            }
            if (categories == null || categories.isEmpty()) {
                throw new IllegalArgumentException("categories must not be empty");
            }
            trigger = trigger.toLowerCase(Locale.ROOT);
            categories = Set.copyOf(categories);
        }
    }

    private static final KeywordMappingTable STANDARD = new KeywordMappingTable(List.of(
            rule("starbucks", COFFEE, FOOD),
            rule("cappuccino", COFFEE, FOOD),
            rule("filter coffee", COFFEE, FOOD),
            rule("cold coffee", COFFEE, FOOD),
            rule("chai", FOOD),
            rule("dinner", DINING, FOOD),
            rule("lunch", DINING, FOOD),
            rule("restaurant", DINING, FOOD),
            rule("snack", SNACKS, FOOD),
            rule("alcohol", ALCOHOL, FOOD),
            rule("swiggy", ONLINE_FOOD, FOOD),
            rule("blinkit", ONLINE_FOOD, FOOD),
            rule("uber", TRAVEL, TRANSPORTATION),
            rule("ola", TRAVEL, TRANSPORTATION),
            rule("taxi", TRAVEL, TRANSPORTATION),
            rule("train", TRAVEL, TRANSPORTATION),
            rule("flight", TRAVEL, TRANSPORTATION),
            rule("hotel", LODGING, TRAVEL),
            rule("airbnb", LODGING, TRAVEL),
            rule("bigbasket", GROCERIES),
            rule("zepto", GROCERIES),
            rule("amazon", SHOPPING),
            rule("ebay", SHOPPING),
            rule("netflix", ENTERTAINMENT, SUBSCRIPTIONS),
            rule("disney", ENTERTAINMENT, SUBSCRIPTIONS),
            rule("prime", ENTERTAINMENT, SUBSCRIPTIONS),
            rule("electricity", UTILITIES),
            rule("water", UTILITIES),
            rule("gas bill", UTILITIES),
            rule("internet", UTILITIES, COMMUNICATION),
            rule("doctor", HEALTH),
            rule("pharmacy", HEALTH),
            rule("medicine", HEALTH),
            rule("tuition", EDUCATION),
            rule("school", EDUCATION),
            rule("college", EDUCATION),
            rule("course", EDUCATION),
            rule("book", BOOKS),
            rule("novel", BOOKS),
            rule("magazine", BOOKS),
            rule("salon", PERSONAL_CARE),
            rule("spa", PERSONAL_CARE),
            rule("rent", RENT),
            rule("apartment", RENT),
            rule("fuel", FUEL),
            rule("petrol", FUEL),
            rule("diesel", FUEL),
            rule("repair", MAINTENANCE),
            rule("service", MAINTENANCE),
            rule("subscription", SUBSCRIPTIONS),
            rule("investment", INVESTMENTS),
            rule("stock", INVESTMENTS),
            rule("bond", INVESTMENTS),
            rule("donation", CHARITY),
            rule("zakat", CHARITY),
            rule("pet", PET_CARE),
            rule("veterinary", PET_CARE),
            rule("office", OFFICE_SUPPLIES),
            rule("stationery", STATIONERY),
            rule("clothes", CLOTHING, SHOPPING),
            rule("fashion", CLOTHING, SHOPPING),
            rule("gadget", ELECTRONICS, SHOPPING),
            rule("furniture", FURNITURE, SHOPPING),
            rule("beauty", BEAUTY, PERSONAL_CARE),
            rule("gym", FITNESS),
            rule("workout", FITNESS),
            rule("misc", MISCELLANEOUS)
    ));

    private final List<MappingRule> rules;

    public KeywordMappingTable(List<MappingRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static KeywordMappingTable standard() {
        return STANDARD;
    }

    public List<MappingRule> rules() {
        return rules;
    }

    /**
     * Union of the categories of every trigger contained in {@code text}.
     */
    public Set<Category> match(String text) {
        EnumSet<Category> matched = EnumSet.noneOf(Category.class);
        if (text == null || text.isBlank()) {
            return matched;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        List<String> fired = new ArrayList<>();
        for (MappingRule rule : rules) {
            if (normalized.contains(rule.trigger())) {
                matched.addAll(rule.categories());
                fired.add(rule.trigger());
            }
        }
        if (!fired.isEmpty()) {
            log.debug("Mapping triggers {} matched -> {}", fired, matched);
        }
        return matched;
    }

    private static MappingRule rule(String trigger, Category first, Category... rest) {
        return new MappingRule(trigger, EnumSet.of(first, rest));
    }
}
