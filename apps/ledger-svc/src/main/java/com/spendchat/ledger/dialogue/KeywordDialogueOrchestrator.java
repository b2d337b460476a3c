package com.spendchat.ledger.dialogue;

import com.spendchat.ledger.messaging.InboundMessage;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule based intent detection. Query cues win over amounts so "how much did I spend on 2 coffees"
 * is a query, not a new expense, unless the message also says it was paid, spent or bought.
 * A bare date hint such as "yesterday" is a query for that day.
 */
public class KeywordDialogueOrchestrator implements DialogueOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(KeywordDialogueOrchestrator.class);

    private static final Pattern QUERY_CUES = Pattern.compile(
            "\\b(how much|show|list|total|summary|expenses|spending|what did i spend)\\b");
    private static final Pattern PURCHASE_CUES = Pattern.compile("\\b(paid|spent|bought)\\b");
    private static final Pattern EXPENSE_CUES = Pattern.compile("\\b(paid|spent|bought|expense)\\b");

    private final ExpenseFilterResolver filterResolver;
    private final Clock clock;

    public KeywordDialogueOrchestrator(ExpenseFilterResolver filterResolver, Clock clock) {
        this.filterResolver = filterResolver;
        this.clock = clock;
    }

    @Override
    public DialogueTurn interpret(InboundMessage message) {
        String lower = message.text().toLowerCase(Locale.ROOT).trim();
        LocalDate today = LocalDate.now(clock);

        Optional<BigDecimal> amount = AmountExtractor.extract(message.text());
        boolean purchase = amount.isPresent() && PURCHASE_CUES.matcher(lower).find();
        if (!purchase && isQuery(lower)) {
            DialogueTurn turn = query(lower, today);
            log.info("Interpreted message as query: filter={}", turn.filter());
            return turn;
        }
        if (amount.isPresent() || EXPENSE_CUES.matcher(lower).find()) {
            return addExpense(amount, lower, today);
        }
        if (DateHints.resolve(lower, today).isPresent()) {
            DialogueTurn turn = query(lower, today);
            log.info("Interpreted bare date as query: filter={}", turn.filter());
            return turn;
        }
        log.info("Message not understood as add or query");
        return DialogueTurn.unknown();
    }

    DialogueTurn addExpense(Optional<BigDecimal> amount, String lowerText, LocalDate today) {
        LocalDate expenseDate = DateHints.resolve(lowerText, today).orElse(today);
        log.info("Interpreted message as new expense: amountPresent={} date={}", amount.isPresent(), expenseDate);
        return DialogueTurn.addExpense(amount, expenseDate);
    }

    DialogueTurn query(String lowerText, LocalDate today) {
        return DialogueTurn.queryExpense(filterResolver.resolve(lowerText, today));
    }

    private static boolean isQuery(String lower) {
        return lower.endsWith("?") || QUERY_CUES.matcher(lower).find();
    }
}
