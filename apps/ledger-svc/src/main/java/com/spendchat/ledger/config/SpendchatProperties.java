package com.spendchat.ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "spendchat")
public record SpendchatProperties(
        Ai ai,
        Relay relay,
        Orchestrator orchestrator,
        Format format
) {

    @ConstructorBinding
    public SpendchatProperties {
        // every section is optional; absent sections fall back to defaults
        if (ai == null) {
            ai = new Ai(null, null, null, null);
        }
        if (relay == null) {
            relay = new Relay(null, null, null, null, null, null);
        }
        if (orchestrator == null) {
            orchestrator = new Orchestrator(null, null);
        }
        if (format == null) {
            format = new Format(null, null);
        }
    }

    public record Ai(String apiKey, String endpoint, ZeroShot zeroShot, Ner ner) {
        static final String DEFAULT_ENDPOINT = "https://api-inference.huggingface.co/models";

        public Ai {
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = DEFAULT_ENDPOINT;
            }
            if (zeroShot == null) {
                zeroShot = new ZeroShot(null, null, null);
            }
            if (ner == null) {
                ner = new Ner(null, null, null);
            }
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public record ZeroShot(Boolean enabled, String model, Integer timeoutMs) {
        public ZeroShot {
            if (model == null || model.isBlank()) {
                model = "valhalla/distilbart-mnli-12-1";
            }
            if (timeoutMs != null && timeoutMs <= 0) {
                throw new IllegalArgumentException("zero-shot timeoutMs must be positive");
            }
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }

        public int timeoutMsOrDefault() {
            return timeoutMs != null ? timeoutMs : 10_000;
        }
    }

    public record Ner(Boolean enabled, String model, Integer timeoutMs) {
        public Ner {
            if (model == null || model.isBlank()) {
                model = "dslim/bert-base-NER";
            }
            if (timeoutMs != null && timeoutMs <= 0) {
                throw new IllegalArgumentException("ner timeoutMs must be positive");
            }
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }

        public int timeoutMsOrDefault() {
            return timeoutMs != null ? timeoutMs : 5_000;
        }
    }

    public record Relay(
            String accountSid,
            String authToken,
            String fromNumber,
            String baseUrl,
            Integer timeoutMs,
            Boolean validateSignature
    ) {
        public Relay {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://api.twilio.com";
            }
            if (timeoutMs != null && timeoutMs <= 0) {
                throw new IllegalArgumentException("relay timeoutMs must be positive");
            }
        }

        public boolean hasCredentials() {
            return notBlank(accountSid) && notBlank(authToken) && notBlank(fromNumber);
        }

        public boolean hasAuthToken() {
            return notBlank(authToken);
        }

        public boolean validateSignatureFlag() {
            return validateSignature != null && validateSignature;
        }

        public int timeoutMsOrDefault() {
            return timeoutMs != null ? timeoutMs : 5_000;
        }
    }

    public record Orchestrator(String rasaUrl, Integer timeoutMs) {
        public Orchestrator {
            if (timeoutMs != null && timeoutMs <= 0) {
                throw new IllegalArgumentException("orchestrator timeoutMs must be positive");
            }
        }

        public boolean hasRasaUrl() {
            return notBlank(rasaUrl);
        }

        public int timeoutMsOrDefault() {
            return timeoutMs != null ? timeoutMs : 5_000;
        }
    }

    public record Format(String currencySymbol, String zone) {
        public Format {
            // presentation only, amounts are never converted
            if (currencySymbol == null) {
                currencySymbol = "₹";
            }
            if (zone == null || zone.isBlank()) {
                zone = "Asia/Kolkata";
            }
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
