package com.spendchat.ledger.dialogue;

import com.spendchat.ledger.messaging.InboundMessage;
import com.spendchat.ledger.messaging.OutboundMessage;
import com.spendchat.ledger.model.ExpenseAggregate;
import com.spendchat.ledger.model.ExpenseRecord;
import com.spendchat.ledger.repository.ExpenseStorageException;
import com.spendchat.ledger.service.AmountNotFoundException;
import com.spendchat.ledger.service.ExpenseLedgerService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handles one chat message end to end and produces the replies for the sender. Failures are
 * turned into fixed user-facing texts; internal error details stay in the logs.
 */
@Service
public class ExpenseConversationService {

    private static final Logger log = LoggerFactory.getLogger(ExpenseConversationService.class);

    static final String AMOUNT_NOT_FOUND_REPLY = "❗ I couldn't detect an expense amount. Please include one in your message.";
    static final String RECORD_FAILED_REPLY = "❗ There was an error recording your expense.";
    static final String QUERY_FAILED_REPLY = "❗ There was an error retrieving your expenses.";
    static final String HELP_REPLY = """
            👋 Send an expense like *Paid 250 for lunch at restaurant* to record it,
            or ask *How much did I spend on coffee yesterday?* to see your expenses.""";

    private final DialogueOrchestrator orchestrator;
    private final ExpenseLedgerService ledgerService;
    private final ExpenseSummaryFormatter formatter;

    public ExpenseConversationService(
            DialogueOrchestrator orchestrator,
            ExpenseLedgerService ledgerService,
            ExpenseSummaryFormatter formatter
    ) {
        this.orchestrator = orchestrator;
        this.ledgerService = ledgerService;
        this.formatter = formatter;
    }

    public List<OutboundMessage> handle(InboundMessage message) {
        DialogueTurn turn = orchestrator.interpret(message);
        String reply = switch (turn.intent()) {
            case ADD_EXPENSE -> addExpense(message, turn);
            case QUERY_EXPENSE -> queryExpenses(turn);
            case UNKNOWN -> HELP_REPLY;
        };
        return List.of(new OutboundMessage(message.sender(), reply));
    }

    private String addExpense(InboundMessage message, DialogueTurn turn) {
        try {
            ExpenseRecord record = ledgerService.record(
                    message.text(),
                    turn.amount().orElse(null),
                    message.text(),
                    turn.expenseDate()
            );
            return formatter.formatConfirmation(record);
        } catch (AmountNotFoundException ex) {
            log.info("Rejected expense without amount");
            return AMOUNT_NOT_FOUND_REPLY;
        } catch (ExpenseStorageException ex) {
            log.error("Recording expense failed: {}", ex.getMessage());
            return RECORD_FAILED_REPLY;
        } catch (IllegalArgumentException ex) {
            log.warn("Rejected expense: {}", ex.getMessage());
            return RECORD_FAILED_REPLY;
        }
    }

    private String queryExpenses(DialogueTurn turn) {
        try {
            ExpenseAggregate aggregate = ledgerService.query(turn.filter());
            return formatter.formatAggregate(aggregate);
        } catch (ExpenseStorageException ex) {
            log.error("Expense query failed: {}", ex.getMessage());
            return QUERY_FAILED_REPLY;
        }
    }
}
