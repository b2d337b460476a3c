package com.spendchat.ledger.dialogue;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the date words a message may carry: "yesterday", "today" or an ISO date.
 */
public final class DateHints {

    static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");

    private DateHints() {
    }

    public static Optional<LocalDate> resolve(String text, LocalDate today) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("yesterday")) {
            return Optional.of(today.minusDays(1));
        }
        Matcher matcher = ISO_DATE.matcher(lower);
        if (matcher.find()) {
            try {
                return Optional.of(LocalDate.parse(matcher.group(1)));
            } catch (DateTimeParseException ex) {
                return Optional.empty();
            }
        }
        if (lower.contains("today")) {
            return Optional.of(today);
        }
        return Optional.empty();
    }
}
