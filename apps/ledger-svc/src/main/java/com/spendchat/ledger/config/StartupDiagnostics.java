package com.spendchat.ledger.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final SpendchatProperties props;

    public StartupDiagnostics(SpendchatProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        // structural info only, never secrets
        var ai = props.ai();
        log.info("AI config: endpoint='{}', apiKeyPresent={}, zeroShot(enabled={}, model='{}'), ner(enabled={}, model='{}')",
                ai.endpoint(), ai.hasApiKey(),
                ai.zeroShot().enabledFlag(), ai.zeroShot().model(),
                ai.ner().enabledFlag(), ai.ner().model());

        var relay = props.relay();
        log.info("Relay config: baseUrl='{}', accountSid='***{}', credentialsPresent={}, validateSignature={}",
                relay.baseUrl(), tail(relay.accountSid()), relay.hasCredentials(), relay.validateSignatureFlag());

        var orchestrator = props.orchestrator();
        log.info("Orchestrator config: mode='{}', rasaUrl='{}'",
                orchestrator.hasRasaUrl() ? "rasa" : "keyword", orchestrator.rasaUrl());

        log.info("Format config: currencySymbol='{}', zone='{}'", props.format().currencySymbol(), props.format().zone());
    }

    private static String tail(String value) {
        return value != null && value.length() > 4 ? value.substring(value.length() - 4) : "";
    }
}
