package com.spendchat.ledger.categorization.huggingface;

import com.fasterxml.jackson.databind.JsonNode;
import com.spendchat.ledger.categorization.ExternalServiceException;
import java.time.Duration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Thin blocking client for the Hugging Face Inference API ({@code POST {endpoint}/{model}}).
 * Every call is bounded by the configured read timeout.
 */
public class HuggingFaceInferenceClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(3);

    private final RestClient restClient;
    private final String endpoint;
    private final String apiKey;

    public HuggingFaceInferenceClient(String endpoint, String apiKey, int readTimeoutMs) {
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.apiKey = apiKey;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
    }

    public JsonNode infer(String model, Object payload) {
        try {
            JsonNode response = restClient.post()
                    .uri(endpoint + "/" + model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(apiKey))
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                throw new ExternalServiceException("Empty inference response from model " + model);
            }
            JsonNode error = response.get("error");
            if (error != null && error.isTextual()) {
                // model still loading or rejected the input
                throw new ExternalServiceException("Inference error from model " + model + ": " + error.asText());
            }
            return response;
        } catch (RestClientResponseException ex) {
            throw new ExternalServiceException(
                    "Inference call to " + model + " failed (status " + ex.getStatusCode().value() + ")", ex);
        } catch (RestClientException ex) {
            throw new ExternalServiceException("Inference call to " + model + " failed: " + ex.getMessage(), ex);
        }
    }
}
