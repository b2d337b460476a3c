package com.spendchat.ledger.categorization;

/**
 * Raised by an inference capability that is missing, timed out or answered with an error.
 * The categorizer recovers from it by skipping the tier that made the call.
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
