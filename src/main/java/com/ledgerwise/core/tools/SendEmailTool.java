package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.records.MailDeliveryException;
import com.ledgerwise.records.MailGateway;
import com.ledgerwise.records.OutgoingMail;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Sends an email. Not idempotent: a failure after the gateway may have
 * accepted the message is reported as {@link ErrorKind#EXTERNAL_MUTATION_UNCERTAIN}.
 */
@Component
public class SendEmailTool implements Tool {

    public static final String NAME = "send_email";

    private static final ToolSpec SPEC = new ToolSpec(
            NAME,
            "Email",
            "Sends an email to an employee",
            List.of("to_email", "subject", "body"),
            List.of("cc_email"),
            Map.of(),
            List.of("message_id"),
            ToolCategory.ACTION,
            SideEffect.MUTATING);

    private final MailGateway gateway;

    public SendEmailTool(MailGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolOutput invoke(Map<String, Object> arguments) throws ToolInvocationException {
        String to = ToolArguments.requireEmail(arguments, "to_email");
        String subject = ToolArguments.requireText(arguments, "subject");
        String body = ToolArguments.requireText(arguments, "body");
        String cc = ToolArguments.optionalText(arguments, "cc_email") == null
                ? null : ToolArguments.requireEmail(arguments, "cc_email");

        String messageId;
        try {
            messageId = gateway.send(new OutgoingMail(to, cc, subject, body));
        } catch (MailDeliveryException e) {
            if (e.possiblySubmitted()) {
                throw new ToolInvocationException(ErrorKind.EXTERNAL_MUTATION_UNCERTAIN,
                        "Email to " + to + " may or may not have been sent", e);
            }
            throw new ToolInvocationException(ErrorKind.TRANSIENT, "Mail gateway refused the message", e);
        }
        return new ToolOutput("Sent '" + subject + "' to " + to + (cc == null ? "" : " (cc " + cc + ")"),
                Map.of("to", to, "message_id", messageId),
                Map.of("message_id", messageId),
                "mail/" + messageId, null);
    }
}
