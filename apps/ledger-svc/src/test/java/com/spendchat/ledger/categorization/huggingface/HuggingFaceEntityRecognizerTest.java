package com.spendchat.ledger.categorization.huggingface;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.spendchat.ledger.categorization.EntityRecognizer.RecognizedEntity;
import com.spendchat.ledger.categorization.ExternalServiceException;
import com.spendchat.ledger.config.SpendchatProperties;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class HuggingFaceEntityRecognizerTest {

    static HttpServer server;
    static int port;

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        server.createContext("/models/ner", exchange -> respond(exchange, 200, """
                [{"entity_group":"ORG","word":"Starbucks","score":0.99},
                 {"entity":"B-LOC","word":"Mumbai","score":0.81},
                 {"entity_group":"MISC","word":"","score":0.5}]"""));
        server.createContext("/models/broken", exchange ->
                respond(exchange, 200, "{\"error\":\"Model dslim/bert-base-NER is currently loading\"}"));
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private HuggingFaceEntityRecognizer newRecognizer(boolean enabled, String model) {
        var props = new SpendchatProperties(
                new SpendchatProperties.Ai("hf-test-key", "http://localhost:" + port + "/models/",
                        new SpendchatProperties.ZeroShot(false, null, null),
                        new SpendchatProperties.Ner(enabled, model, 2000)),
                null, null, null);
        HuggingFaceEntityRecognizer recognizer = new HuggingFaceEntityRecognizer(props);
        recognizer.initialize();
        return recognizer;
    }

    @Test
    void recognizeReadsGroupedAndTokenEntities() {
        List<RecognizedEntity> entities = newRecognizer(true, "ner").recognize("Coffee at Starbucks Mumbai");

        assertThat(entities).extracting(RecognizedEntity::spanText).containsExactly("Starbucks", "Mumbai");
        assertThat(entities).extracting(RecognizedEntity::entityGroup).containsExactly("ORG", "B-LOC");
    }

    @Test
    void errorPayloadBecomesExternalServiceException() {
        var recognizer = newRecognizer(true, "broken");

        assertThatThrownBy(() -> recognizer.recognize("anything"))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("loading");
    }

    @Test
    void disabledRecognizerIsUnavailable() {
        assertThat(newRecognizer(false, "ner").isAvailable()).isFalse();
    }
}
