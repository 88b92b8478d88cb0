package com.ledgerwise.records;

/**
 * Thrown when a message could not be handed over for delivery.
 */
public class MailDeliveryException extends Exception {

    private final boolean possiblySubmitted;

    public MailDeliveryException(String message, boolean possiblySubmitted) {
        super(message);
        this.possiblySubmitted = possiblySubmitted;
    }

    /** True when the gateway may have accepted the message before failing. */
    public boolean possiblySubmitted() {
        return possiblySubmitted;
    }
}
