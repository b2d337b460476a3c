package com.spendchat.ledger.health;

import com.spendchat.ledger.categorization.EntityRecognizer;
import com.spendchat.ledger.categorization.ZeroShotClassifier;
import com.spendchat.ledger.messaging.MessageRelay;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight public health endpoint. Reports which optional classification capabilities are live
 * alongside the overall status; Actuator stays the internal view.
 */
@RestController
public class HealthzController {

    private final ZeroShotClassifier zeroShotClassifier;
    private final EntityRecognizer entityRecognizer;
    private final MessageRelay messageRelay;

    public HealthzController(
            ZeroShotClassifier zeroShotClassifier,
            EntityRecognizer entityRecognizer,
            MessageRelay messageRelay
    ) {
        this.zeroShotClassifier = zeroShotClassifier;
        this.entityRecognizer = entityRecognizer;
        this.messageRelay = messageRelay;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("zeroShot", availability(zeroShotClassifier.isAvailable()));
        body.put("ner", availability(entityRecognizer.isAvailable()));
        body.put("relay", messageRelay.name());
        return body;
    }

    private static String availability(boolean available) {
        return available ? "available" : "unavailable";
    }
}
