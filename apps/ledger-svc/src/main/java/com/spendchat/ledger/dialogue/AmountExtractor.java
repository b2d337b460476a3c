package com.spendchat.ledger.dialogue;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class AmountExtractor {

    private static final Pattern AMOUNT_PATTERN = Pattern.compile("[₹$]?(\\d+(?:\\.\\d{1,2})?)");

    private AmountExtractor() {
    }

    /**
     * First number in the text, optionally prefixed by a currency sign. ISO dates are skipped so
     * "2024-03-15" is never read as an amount.
     */
    public static Optional<BigDecimal> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String withoutDates = DateHints.ISO_DATE.matcher(text).replaceAll(" ");
        Matcher matcher = AMOUNT_PATTERN.matcher(withoutDates);
        if (!matcher.find()) {
            return Optional.empty();
        }
        BigDecimal amount = new BigDecimal(matcher.group(1));
        return amount.signum() > 0 ? Optional.of(amount) : Optional.empty();
    }

    /**
     * Parses an amount produced by an entity extractor, tolerating currency signs and separators.
     */
    public static Optional<BigDecimal> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String cleaned = value.replace(",", "").replace("₹", "").replace("$", "").trim();
        try {
            BigDecimal amount = new BigDecimal(cleaned);
            return amount.signum() > 0 ? Optional.of(amount) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
