package com.ledgerwise.core.tools;

import com.ledgerwise.core.llm.LlmService;
import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drafts a short message body with the language model. Produces the
 * {@code body} that {@link SendEmailTool} needs.
 */
@Component
public class ComposeContentTool implements Tool {

    public static final String NAME = "compose_content";

    /** Source marker for model-generated text. */
    public static final String ORIGIN = "generated/" + NAME;

    static final Set<String> TONES = Set.of("professional", "friendly", "formal", "concise");

    private static final ToolSpec SPEC = new ToolSpec(
            NAME,
            "Drafted content",
            "Drafts a notice or message body on a subject",
            List.of("subject"),
            List.of("tone", "employee_name"),
            Map.of("tone", "professional"),
            List.of("body"),
            ToolCategory.GENERATION,
            SideEffect.READ_ONLY);

    private static final String SYSTEM_PROMPT = """
            You draft short workplace messages for a finance and HR team.
            Write only the message body: no subject line, no placeholders in brackets,
            at most 150 words, in the requested tone. Do not invent figures or dates.
            """;

    private final LlmService llmService;

    public ComposeContentTool(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolOutput invoke(Map<String, Object> arguments) throws ToolInvocationException {
        String subject = ToolArguments.requireText(arguments, "subject");
        String tone = ToolArguments.oneOf(arguments, "tone", TONES);
        String addressee = ToolArguments.optionalText(arguments, "employee_name");

        String prompt = "Subject: " + subject + "\nTone: " + (tone == null ? "professional" : tone)
                + (addressee == null ? "" : "\nAddressed to: " + addressee);
        String body;
        try {
            body = llmService.generate(SYSTEM_PROMPT, prompt);
        } catch (RuntimeException e) {
            throw new ToolInvocationException(ErrorKind.TRANSIENT, "Drafting service failed: " + e.getMessage(), e);
        }
        return new ToolOutput(body, Map.of("subject", subject), Map.of("body", body), ORIGIN, null);
    }
}
