package com.spendchat.ledger.security;

import com.spendchat.ledger.config.SpendchatProperties;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Map;
import java.util.TreeMap;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Verifies the {@code X-Twilio-Signature} header of inbound webhooks: Base64(HMAC-SHA1(authToken,
 * url + sorted(name + value)...)).
 */
@Component
public class TwilioSignatureValidator {
    private static final Logger log = LoggerFactory.getLogger(TwilioSignatureValidator.class);
    private static final String HMAC_ALGORITHM = "HmacSHA1";

    private final boolean enabled;
    private final String authToken;

    public TwilioSignatureValidator(SpendchatProperties properties) {
        this.enabled = properties.relay().validateSignatureFlag();
        this.authToken = properties.relay().authToken();
        if (enabled && !properties.relay().hasAuthToken()) {
            log.warn("Webhook signature validation enabled without an auth token; all webhooks will be rejected");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return true when validation is disabled or the signature matches
     */
    public boolean verify(String url, Map<String, String> params, String signature) {
        if (!enabled) {
            return true;
        }
        if (authToken == null || authToken.isBlank() || signature == null || signature.isBlank()) {
            return false;
        }
        String expected = sign(url, params, authToken);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.trim().getBytes(StandardCharsets.UTF_8));
    }

    public static String sign(String url, Map<String, String> params, String authToken) {
        StringBuilder data = new StringBuilder(url);
        new TreeMap<>(params).forEach((name, value) -> data.append(name).append(value != null ? value : ""));
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(authToken.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(data.toString().getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Unable to compute webhook signature", e);
        }
    }
}
