package com.spendchat.ledger.dialogue;

import static org.assertj.core.api.Assertions.assertThat;

import com.spendchat.ledger.categorization.Category;
import com.spendchat.ledger.messaging.InboundMessage;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RasaDialogueOrchestratorTest {

    private static final String SENDER = "whatsapp:+919800000001";

    static HttpServer server;
    static int port;
    static volatile String nextResponse;
    static volatile String lastRequest;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T09:30:00Z"), ZoneOffset.UTC);
    private final KeywordDialogueOrchestrator keyword = new KeywordDialogueOrchestrator(new ExpenseFilterResolver(), clock);

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        server.createContext("/model/parse", exchange -> {
            lastRequest = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            byte[] bytes = nextResponse.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    @BeforeEach
    void reset() {
        lastRequest = null;
    }

    private RasaDialogueOrchestrator orchestrator(String url) {
        return new RasaDialogueOrchestrator(url, Duration.ofSeconds(2), keyword, clock);
    }

    @Test
    void addIntentUsesTheAmountEntity() {
        nextResponse = """
                {"text":"lunch with team yesterday, four fifty","intent":{"name":"add_expense","confidence":0.93},
                 "entities":[{"entity":"amount","value":"450","start":0,"end":3}]}""";

        DialogueTurn turn = orchestrator("http://localhost:" + port)
                .interpret(new InboundMessage(SENDER, "lunch with team yesterday, four fifty"));

        assertThat(lastRequest).contains("\"text\"");
        assertThat(turn.intent()).isEqualTo(Intent.ADD_EXPENSE);
        assertThat(turn.amount()).contains(new BigDecimal("450"));
        assertThat(turn.expenseDate()).isEqualTo(LocalDate.of(2024, 3, 14));
    }

    @Test
    void unparsableAmountEntityFallsBackToTheRegex() {
        nextResponse = """
                {"intent":{"name":"add_expense","confidence":0.8},"entities":[{"entity":"amount","value":"lots"}]}""";

        DialogueTurn turn = orchestrator("http://localhost:" + port)
                .interpret(new InboundMessage(SENDER, "taxi 340"));

        assertThat(turn.amount()).contains(new BigDecimal("340"));
    }

    @Test
    void queryIntentResolvesTheFilter() {
        nextResponse = "{\"intent\":{\"name\":\"query_expense\",\"confidence\":0.88},\"entities\":[]}";

        DialogueTurn turn = orchestrator("http://localhost:" + port)
                .interpret(new InboundMessage(SENDER, "coffee this week"));

        assertThat(turn.intent()).isEqualTo(Intent.QUERY_EXPENSE);
        assertThat(turn.filter().category()).contains(Category.COFFEE);
    }

    @Test
    void otherIntentsUseKeywordRules() {
        nextResponse = "{\"intent\":{\"name\":\"greet\",\"confidence\":0.99},\"entities\":[]}";

        DialogueTurn turn = orchestrator("http://localhost:" + port)
                .interpret(new InboundMessage(SENDER, "hello"));

        assertThat(turn.intent()).isEqualTo(Intent.UNKNOWN);
    }

    @Test
    void unreachableServerFallsBackToKeywordRules() throws IOException {
        int closedPort;
        try (var socket = new java.net.ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        DialogueTurn turn = orchestrator("http://localhost:" + closedPort)
                .interpret(new InboundMessage(SENDER, "Uber to airport 800"));

        assertThat(turn.intent()).isEqualTo(Intent.ADD_EXPENSE);
        assertThat(turn.amount()).contains(new BigDecimal("800"));
    }
}
