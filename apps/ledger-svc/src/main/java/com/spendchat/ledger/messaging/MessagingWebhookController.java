package com.spendchat.ledger.messaging;

import com.spendchat.ledger.dialogue.ExpenseConversationService;
import com.spendchat.ledger.security.TwilioSignatureValidator;
import jakarta.servlet.http.HttpServletRequest;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound chat webhook. Every message is processed synchronously; replies are pushed through the
 * {@link MessageRelay} and the webhook itself answers with an empty TwiML document.
 */
@RestController
public class MessagingWebhookController {
    private static final Logger log = LoggerFactory.getLogger(MessagingWebhookController.class);
    static final String EMPTY_TWIML = "<Response></Response>";

    private final ExpenseConversationService conversationService;
    private final MessageRelay messageRelay;
    private final TwilioSignatureValidator signatureValidator;

    public MessagingWebhookController(
            ExpenseConversationService conversationService,
            MessageRelay messageRelay,
            TwilioSignatureValidator signatureValidator
    ) {
        this.conversationService = conversationService;
        this.messageRelay = messageRelay;
        this.signatureValidator = signatureValidator;
    }

    @PostMapping(path = "/webhook", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<String> receive(
            HttpServletRequest request,
            @RequestHeader(name = "X-Twilio-Signature", required = false) String signature
    ) {
        String from = request.getParameter("From");
        String body = request.getParameter("Body");
        if (from == null || from.isBlank() || body == null || body.isBlank()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Invalid request");
        }
        if (signatureValidator.isEnabled()
                && !signatureValidator.verify(requestUrl(request), formParameters(request), signature)) {
            log.warn("Rejected webhook with invalid signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Invalid signature");
        }

        List<OutboundMessage> replies = conversationService.handle(new InboundMessage(from, body.trim()));
        for (OutboundMessage reply : replies) {
            try {
                String id = messageRelay.send(reply);
                log.debug("Reply dispatched via {} id={}", messageRelay.name(), id);
            } catch (MessageDeliveryException ex) {
                log.error("Reply delivery failed via {}: {}", messageRelay.name(), ex.getMessage());
            }
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_XML)
                .body(EMPTY_TWIML);
    }

    private static String requestUrl(HttpServletRequest request) {
        StringBuilder url = new StringBuilder(request.getRequestURL());
        if (request.getQueryString() != null) {
            url.append('?').append(request.getQueryString());
        }
        return url.toString();
    }

    private static Map<String, String> formParameters(HttpServletRequest request) {
        Map<String, String> params = new HashMap<>();
        request.getParameterMap().forEach((name, values) -> {
            if (values.length > 0) {
                params.put(name, values[0]);
            }
        });
        return params;
    }
}
