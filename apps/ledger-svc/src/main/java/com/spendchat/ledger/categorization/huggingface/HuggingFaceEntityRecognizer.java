package com.spendchat.ledger.categorization.huggingface;

import com.fasterxml.jackson.databind.JsonNode;
import com.spendchat.ledger.categorization.EntityRecognizer;
import com.spendchat.ledger.categorization.ExternalServiceException;
import com.spendchat.ledger.config.SpendchatProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class HuggingFaceEntityRecognizer implements EntityRecognizer {

    private static final Logger log = LoggerFactory.getLogger(HuggingFaceEntityRecognizer.class);

    private final SpendchatProperties properties;
    private volatile HuggingFaceInferenceClient client;

    public HuggingFaceEntityRecognizer(SpendchatProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void initialize() {
        SpendchatProperties.Ai ai = properties.ai();
        if (!ai.ner().enabledFlag()) {
            log.info("Entity recognizer disabled (spendchat.ai.ner.enabled=false)");
            return;
        }
        if (!ai.hasApiKey()) {
            log.warn("Entity recognizer unavailable: no inference API key configured");
            return;
        }
        client = new HuggingFaceInferenceClient(ai.endpoint(), ai.apiKey(), ai.ner().timeoutMsOrDefault());
        log.info("Entity recognizer ready with model {}", ai.ner().model());
    }

    @PreDestroy
    public void shutdown() {
        client = null;
    }

    @Override
    public boolean isAvailable() {
        return client != null;
    }

    @Override
    public List<RecognizedEntity> recognize(String text) {
        HuggingFaceInferenceClient current = client;
        if (current == null) {
            throw new ExternalServiceException("entity recognizer is not available");
        }
        Map<String, Object> payload = Map.of(
                "inputs", text,
                "parameters", Map.of("aggregation_strategy", "simple")
        );
        JsonNode response = current.infer(properties.ai().ner().model(), payload);
        if (!response.isArray()) {
            throw new ExternalServiceException("Unexpected entity recognition response shape");
        }
        List<RecognizedEntity> entities = new ArrayList<>();
        for (JsonNode node : response) {
            String word = node.path("word").asText("");
            if (word.isBlank()) {
                continue;
            }
            String group = node.hasNonNull("entity_group")
                    ? node.get("entity_group").asText()
                    : node.path("entity").asText(null);
            entities.add(new RecognizedEntity(word, group, node.path("score").asDouble()));
        }
        return entities;
    }
}
