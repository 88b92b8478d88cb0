package com.ledgerwise.records;

/**
 * Outbound mail.
 */
public interface MailGateway {

    /**
     * Submits a message for delivery.
     *
     * @return the gateway's message id
     * @throws MailDeliveryException if the message could not be submitted
     */
    String send(OutgoingMail mail) throws MailDeliveryException;
}
