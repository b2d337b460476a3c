package com.spendchat.ledger.dialogue;

import com.spendchat.ledger.config.SpendchatProperties;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DialogueConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DialogueConfiguration.class);

    @Bean
    DialogueOrchestrator dialogueOrchestrator(SpendchatProperties properties, ExpenseFilterResolver filterResolver, Clock clock) {
        KeywordDialogueOrchestrator keyword = new KeywordDialogueOrchestrator(filterResolver, clock);
        SpendchatProperties.Orchestrator orchestrator = properties.orchestrator();
        if (!orchestrator.hasRasaUrl()) {
            log.info("Dialogue orchestration: keyword rules");
            return keyword;
        }
        log.info("Dialogue orchestration: Rasa at {} with keyword fallback", orchestrator.rasaUrl());
        return new RasaDialogueOrchestrator(
                orchestrator.rasaUrl(),
                Duration.ofMillis(orchestrator.timeoutMsOrDefault()),
                keyword,
                clock
        );
    }
}
