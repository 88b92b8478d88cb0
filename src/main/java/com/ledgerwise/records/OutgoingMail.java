package com.ledgerwise.records;

/**
 * A message handed to the {@link MailGateway}.
 *
 * @param to      recipient address
 * @param cc      carbon-copy address; nullable
 * @param subject subject line
 * @param body    message body
 */
public record OutgoingMail(String to, String cc, String subject, String body) {}
