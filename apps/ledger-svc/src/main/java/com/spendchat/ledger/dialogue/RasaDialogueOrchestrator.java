package com.spendchat.ledger.dialogue;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.spendchat.ledger.messaging.InboundMessage;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Uses a Rasa NLU server ({@code POST /model/parse}) for intent and amount entity extraction.
 * Any transport failure or unknown intent is handed to the keyword orchestrator.
 */
public class RasaDialogueOrchestrator implements DialogueOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RasaDialogueOrchestrator.class);

    static final String ADD_EXPENSE_INTENT = "add_expense";
    static final String QUERY_EXPENSE_INTENT = "query_expense";

    private final WebClient webClient;
    private final Duration timeout;
    private final KeywordDialogueOrchestrator fallback;
    private final Clock clock;

    public RasaDialogueOrchestrator(String rasaUrl, Duration timeout, KeywordDialogueOrchestrator fallback, Clock clock) {
        this.webClient = WebClient.builder()
                .baseUrl(rasaUrl)
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.timeout = timeout;
        this.fallback = fallback;
        this.clock = clock;
    }

    @Override
    public DialogueTurn interpret(InboundMessage message) {
        ParseResponse parsed;
        try {
            parsed = parse(message.text());
        } catch (OrchestratorUnavailableException ex) {
            log.warn("Rasa unavailable, using keyword rules: {}", ex.getMessage());
            return fallback.interpret(message);
        }
        String intent = parsed.intentName().orElse("");
        String lower = message.text().toLowerCase(Locale.ROOT);
        LocalDate today = LocalDate.now(clock);
        log.info("Rasa intent='{}' entities={}", intent, parsed.entities() == null ? 0 : parsed.entities().size());

        return switch (intent) {
            case ADD_EXPENSE_INTENT -> fallback.addExpense(resolveAmount(parsed, message.text()), lower, today);
            case QUERY_EXPENSE_INTENT -> fallback.query(lower, today);
            default -> fallback.interpret(message);
        };
    }

    ParseResponse parse(String text) {
        try {
            ParseResponse response = webClient.post().uri("/model/parse")
                    .bodyValue(Map.of("text", text))
                    .retrieve()
                    .bodyToMono(ParseResponse.class)
                    .block(timeout);
            if (response == null) {
                throw new OrchestratorUnavailableException("Empty response from Rasa", null);
            }
            return response;
        } catch (OrchestratorUnavailableException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new OrchestratorUnavailableException("Rasa parse failed: " + ex.getMessage(), ex);
        }
    }

    private Optional<BigDecimal> resolveAmount(ParseResponse parsed, String text) {
        if (parsed.entities() != null) {
            for (Entity entity : parsed.entities()) {
                if ("amount".equals(entity.entity())) {
                    Optional<BigDecimal> amount = AmountExtractor.parse(entity.value());
                    if (amount.isPresent()) {
                        return amount;
                    }
                    log.warn("Could not parse amount entity value '{}'", entity.value());
                }
            }
        }
        return AmountExtractor.extract(text);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParseResponse(
            @JsonProperty("intent") IntentRanking intent,
            @JsonProperty("entities") List<Entity> entities
    ) {
        Optional<String> intentName() {
            return Optional.ofNullable(intent).map(IntentRanking::name);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IntentRanking(@JsonProperty("name") String name, @JsonProperty("confidence") Double confidence) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entity(@JsonProperty("entity") String entity, @JsonProperty("value") String value) {
    }
}
