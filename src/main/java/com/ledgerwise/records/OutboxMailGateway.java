package com.ledgerwise.records;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mail gateway that records messages in an in-memory outbox instead of
 * talking to a mail server.
 */
@Component
public class OutboxMailGateway implements MailGateway {

    private static final Logger log = LoggerFactory.getLogger(OutboxMailGateway.class);

    private final List<OutgoingMail> outbox = new CopyOnWriteArrayList<>();

    @Override
    public String send(OutgoingMail mail) {
        outbox.add(mail);
        String messageId = "MSG-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        log.info("Queued message {} to {} ({} chars)", messageId, mail.to(), mail.body().length());
        return messageId;
    }

    public List<OutgoingMail> sent() {
        return List.copyOf(outbox);
    }
}
