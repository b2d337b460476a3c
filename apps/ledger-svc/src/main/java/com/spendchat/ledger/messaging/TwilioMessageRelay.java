package com.spendchat.ledger.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.spendchat.ledger.config.SpendchatProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Sends replies through the Twilio Messages API (SMS / WhatsApp).
 */
public class TwilioMessageRelay implements MessageRelay {
    private static final Logger log = LoggerFactory.getLogger(TwilioMessageRelay.class);

    private final WebClient webClient;
    private final String accountSid;
    private final String fromNumber;
    private final Duration timeout;

    public TwilioMessageRelay(SpendchatProperties.Relay relay) {
        if (!relay.hasCredentials()) {
            throw new IllegalStateException("Twilio relay requires account sid, auth token and from number");
        }
        this.accountSid = relay.accountSid();
        this.fromNumber = relay.fromNumber();
        this.timeout = Duration.ofMillis(relay.timeoutMsOrDefault());
        this.webClient = WebClient.builder()
                .baseUrl(relay.baseUrl())
                .defaultHeaders(headers -> headers.setBasicAuth(relay.accountSid(), relay.authToken()))
                .build();
    }

    @Override
    public String send(OutboundMessage message) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", fromNumber);
        form.add("To", message.recipient());
        form.add("Body", message.text());
        try {
            MessageResource resource = webClient.post()
                    .uri("/2010-04-01/Accounts/{sid}/Messages.json", accountSid)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .bodyToMono(MessageResource.class)
                    .block(timeout);
            if (resource == null || resource.sid() == null) {
                throw new MessageDeliveryException("Twilio returned no message sid");
            }
            log.debug("Twilio accepted message sid={} status={}", resource.sid(), resource.status());
            return resource.sid();
        } catch (WebClientResponseException ex) {
            throw new MessageDeliveryException("Twilio rejected message with status " + ex.getStatusCode().value(), ex);
        } catch (MessageDeliveryException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new MessageDeliveryException("Twilio request failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public String name() {
        return "twilio";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessageResource(String sid, String status) {
    }
}
