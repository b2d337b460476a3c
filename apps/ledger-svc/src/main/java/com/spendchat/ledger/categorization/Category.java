package com.spendchat.ledger.categorization;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed set of expense categories. Declaration order is the canonical order offered to the
 * zero-shot model as candidate labels.
 */
public enum Category {
    FOOD("food", "🍽️"),
    COFFEE("coffee", "☕️"),
    ONLINE_FOOD("online_food", "🍔"),
    GROCERIES("groceries", "🛒"),
    DINING("dining", "🍴"),
    SNACKS("snacks", "🍟"),
    ALCOHOL("alcohol", "🍺"),
    TRAVEL("travel", "✈️"),
    LODGING("lodging", "🏨"),
    TRANSPORTATION("transportation", "🚖"),
    SHOPPING("shopping", "🛍️"),
    CLOTHING("clothing", "👗"),
    ELECTRONICS("electronics", "📱"),
    FURNITURE("furniture", "🛋️"),
    ENTERTAINMENT("entertainment", "🎬"),
    UTILITIES("utilities", "💡"),
    HEALTH("health", "🏥"),
    INSURANCE("insurance", "🛡️"),
    EDUCATION("education", "📚"),
    BOOKS("books", "📖"),
    PERSONAL_CARE("personal_care", "💅"),
    RENT("rent", "🏠"),
    FUEL("fuel", "⛽️"),
    MAINTENANCE("maintenance", "🔧"),
    SUBSCRIPTIONS("subscriptions", "🔔"),
    INVESTMENTS("investments", "💹"),
    CHARITY("charity", "❤️"),
    PET_CARE("pet_care", "🐾"),
    OFFICE_SUPPLIES("office_supplies", "🖊️"),
    COMMUNICATION("communication", "📞"),
    FITNESS("fitness", "🏋️"),
    BEAUTY("beauty", "💄"),
    STATIONERY("stationery", "✏️"),
    MISCELLANEOUS("miscellaneous", "🗃️"),
    OTHERS("others", "❓");

    private static final List<String> LABELS = Arrays.stream(values()).map(Category::label).toList();

    private final String label;
    private final String glyph;

    Category(String label, String glyph) {
        this.label = label;
        this.glyph = glyph;
    }

    public String label() {
        return label;
    }

    public String glyph() {
        return glyph;
    }

    /**
     * Human readable form of the label, e.g. {@code personal_care} becomes {@code Personal Care}.
     */
    public String displayName() {
        return Arrays.stream(label.split("_"))
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    public static List<String> labels() {
        return LABELS;
    }

    public static Optional<Category> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        return Arrays.stream(values())
                .filter(category -> category.label.equals(normalized))
                .findFirst();
    }
}
