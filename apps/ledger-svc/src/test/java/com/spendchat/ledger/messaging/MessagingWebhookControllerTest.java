package com.spendchat.ledger.messaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.spendchat.ledger.config.SpendchatProperties;
import com.spendchat.ledger.dialogue.ExpenseConversationService;
import com.spendchat.ledger.security.TwilioSignatureValidator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class MessagingWebhookControllerTest {

    private static final String SENDER = "whatsapp:+919800000001";
    private static final String TOKEN = "twilio-auth-token";

    @Mock
    private ExpenseConversationService conversationService;

    @Mock
    private MessageRelay messageRelay;

    private MessagingWebhookController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        TwilioSignatureValidator validator = new TwilioSignatureValidator(new SpendchatProperties(null,
                new SpendchatProperties.Relay("AC123", TOKEN, "whatsapp:+14155238886", null, null, true),
                null, null));
        controller = new MessagingWebhookController(conversationService, messageRelay, validator);
    }

    private static MockHttpServletRequest webhook(String from, String body) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/webhook");
        if (from != null) {
            request.addParameter("From", from);
        }
        if (body != null) {
            request.addParameter("Body", body);
        }
        return request;
    }

    @Test
    void signedMessageIsHandledAndRepliesAreRelayed() {
        MockHttpServletRequest request = webhook(SENDER, "Uber to airport 800");
        String signature = TwilioSignatureValidator.sign(request.getRequestURL().toString(),
                Map.of("From", SENDER, "Body", "Uber to airport 800"), TOKEN);
        OutboundMessage reply = new OutboundMessage(SENDER, "✅ *Expense Recorded Successfully!*");
        when(conversationService.handle(new InboundMessage(SENDER, "Uber to airport 800"))).thenReturn(List.of(reply));

        ResponseEntity<String> response = controller.receive(request, signature);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo("<Response></Response>");
        verify(messageRelay).send(reply);
    }

    @Test
    void missingFieldsAreRejected() {
        ResponseEntity<String> response = controller.receive(webhook(SENDER, null), null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isEqualTo("Invalid request");
        verifyNoInteractions(conversationService);
    }

    @Test
    void invalidSignatureIsUnauthorized() {
        ResponseEntity<String> response = controller.receive(webhook(SENDER, "taxi 200"), "bm90LWEtc2lnbmF0dXJl");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        verifyNoInteractions(conversationService, messageRelay);
    }

    @Test
    void deliveryFailureStillAcknowledgesTheWebhook() {
        MockHttpServletRequest request = webhook(SENDER, "hello");
        String signature = TwilioSignatureValidator.sign(request.getRequestURL().toString(),
                Map.of("From", SENDER, "Body", "hello"), TOKEN);
        when(conversationService.handle(any())).thenReturn(List.of(new OutboundMessage(SENDER, "help")));
        when(messageRelay.send(any())).thenThrow(new MessageDeliveryException("twilio down"));

        assertThat(controller.receive(request, signature).getStatusCode()).isEqualTo(HttpStatus.OK);
    }
}
