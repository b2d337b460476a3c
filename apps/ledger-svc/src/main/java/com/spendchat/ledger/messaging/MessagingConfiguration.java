package com.spendchat.ledger.messaging;

import com.spendchat.ledger.config.SpendchatProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MessagingConfiguration {
    private static final Logger log = LoggerFactory.getLogger(MessagingConfiguration.class);

    @Bean
    public MessageRelay messageRelay(SpendchatProperties properties) {
        SpendchatProperties.Relay relay = properties.relay();
        if (relay.hasCredentials()) {
            return new TwilioMessageRelay(relay);
        }
        log.warn("Twilio credentials not configured; replies will only be logged");
        return new LoggingMessageRelay();
    }
}
