package com.spendchat.ledger.categorization.huggingface;

import com.fasterxml.jackson.databind.JsonNode;
import com.spendchat.ledger.categorization.ExternalServiceException;
import com.spendchat.ledger.categorization.ZeroShotClassifier;
import com.spendchat.ledger.config.SpendchatProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class HuggingFaceZeroShotClassifier implements ZeroShotClassifier {

    private static final Logger log = LoggerFactory.getLogger(HuggingFaceZeroShotClassifier.class);

    private final SpendchatProperties properties;
    private volatile HuggingFaceInferenceClient client;

    public HuggingFaceZeroShotClassifier(SpendchatProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void initialize() {
        SpendchatProperties.Ai ai = properties.ai();
        if (!ai.zeroShot().enabledFlag()) {
            log.info("Zero-shot classifier disabled (spendchat.ai.zero-shot.enabled=false)");
            return;
        }
        if (!ai.hasApiKey()) {
            log.warn("Zero-shot classifier unavailable: no inference API key configured");
            return;
        }
        client = new HuggingFaceInferenceClient(ai.endpoint(), ai.apiKey(), ai.zeroShot().timeoutMsOrDefault());
        log.info("Zero-shot classifier ready with model {}", ai.zeroShot().model());
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
    public ZeroShotResult classify(String text, List<String> candidateLabels) {
        HuggingFaceInferenceClient current = client;
        if (current == null) {
            throw new ExternalServiceException("zero-shot classifier is not available");
        }
        Map<String, Object> payload = Map.of(
                "inputs", text,
                "parameters", Map.of("candidate_labels", candidateLabels, "multi_label", false)
        );
        JsonNode response = current.infer(properties.ai().zeroShot().model(), payload);
        return parse(response);
    }

    // The API answers either {"sequence", "labels", "scores"} or a list of {"label", "score"}.
    private ZeroShotResult parse(JsonNode response) {
        JsonNode root = response.isArray() && response.size() > 0 && response.get(0).has("labels")
                ? response.get(0)
                : response;
        if (root.has("labels")) {
            List<String> labels = new ArrayList<>();
            List<Double> scores = new ArrayList<>();
            root.get("labels").forEach(label -> labels.add(label.asText()));
            JsonNode scoreNode = root.get("scores");
            if (scoreNode != null && scoreNode.isArray()) {
                scoreNode.forEach(score -> scores.add(score.asDouble()));
            }
            return new ZeroShotResult(labels, scores);
        }
        if (root.isArray()) {
            List<JsonNode> entries = new ArrayList<>();
            root.forEach(entries::add);
            entries.sort(Comparator.comparingDouble((JsonNode node) -> node.path("score").asDouble()).reversed());
            return new ZeroShotResult(
                    entries.stream().map(node -> node.path("label").asText()).toList(),
                    entries.stream().map(node -> node.path("score").asDouble()).toList()
            );
        }
        throw new ExternalServiceException("Unexpected zero-shot response shape");
    }
}
