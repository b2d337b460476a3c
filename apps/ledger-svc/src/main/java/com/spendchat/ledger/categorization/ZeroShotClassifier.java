package com.spendchat.ledger.categorization;

import java.util.List;
import java.util.Optional;

/**
 * Generic text classifier that ranks a caller supplied set of candidate labels.
 * Implementations may be unavailable at runtime; callers check {@link #isAvailable()} first.
 */
public interface ZeroShotClassifier {

    boolean isAvailable();

    /**
     * @throws ExternalServiceException when the backing service is unavailable or fails
     */
    ZeroShotResult classify(String text, List<String> candidateLabels);

    record ZeroShotResult(List<String> labels, List<Double> scores) {
        public ZeroShotResult {
            labels = labels == null ? List.of() : List.copyOf(labels);
            scores = scores == null ? List.of() : List.copyOf(scores);
        }

        public Optional<String> topLabel() {
            return labels.isEmpty() ? Optional.empty() : Optional.of(labels.get(0));
        }
    }

    static ZeroShotClassifier unavailable() {
        return new ZeroShotClassifier() {
            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public ZeroShotResult classify(String text, List<String> candidateLabels) {
                throw new ExternalServiceException("zero-shot classifier is not configured");
            }
        };
    }
}
