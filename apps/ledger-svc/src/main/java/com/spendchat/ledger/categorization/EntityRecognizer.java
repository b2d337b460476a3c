package com.spendchat.ledger.categorization;

import java.util.List;

/**
 * Named-entity recognizer used to recover keyword hits that plain substring matching misses.
 */
public interface EntityRecognizer {

    boolean isAvailable();

    /**
     * @throws ExternalServiceException when the backing service is unavailable or fails
     */
    List<RecognizedEntity> recognize(String text);

    record RecognizedEntity(String spanText, String entityGroup, double score) {
    }

    static EntityRecognizer unavailable() {
        return new EntityRecognizer() {
            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public List<RecognizedEntity> recognize(String text) {
                throw new ExternalServiceException("entity recognizer is not configured");
            }
        };
    }
}
