package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.retrieval.PolicyRetriever;
import com.ledgerwise.retrieval.RetrievalProperties;
import com.ledgerwise.retrieval.RetrievedPassage;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Retrieves the policy passages most similar to a subject.
 */
@Component
public class PolicySearchTool implements Tool {

    public static final String NAME = "policy_search";

    static final int MAX_TOP_K = 10;

    private final PolicyRetriever retriever;
    private final RetrievalProperties properties;
    private final ToolSpec spec;

    public PolicySearchTool(PolicyRetriever retriever, RetrievalProperties properties) {
        this.retriever = retriever;
        this.properties = properties;
        this.spec = new ToolSpec(
                NAME,
                "Policy search",
                "Searches the company finance and HR policy documents",
                List.of("subject"),
                List.of("top_k"),
                Map.of("top_k", String.valueOf(properties.getTopK())),
                List.of("policy_excerpt"),
                ToolCategory.POLICY,
                SideEffect.READ_ONLY);
    }

    @Override
    public ToolSpec spec() {
        return spec;
    }

    @Override
    public ToolOutput invoke(Map<String, Object> arguments) throws ToolInvocationException {
        String subject = ToolArguments.requireText(arguments, "subject");
        int topK = ToolArguments.optionalInt(arguments, "top_k", properties.getTopK());
        if (topK < 1 || topK > MAX_TOP_K) {
            throw ToolInvocationException.invalid("top_k", "top_k must be between 1 and " + MAX_TOP_K);
        }

        List<RetrievedPassage> passages;
        try {
            passages = retriever.search(subject, topK, properties.getSimilarityThreshold());
        } catch (RuntimeException e) {
            throw new ToolInvocationException(ErrorKind.TRANSIENT, "Policy search is unavailable: " + e.getMessage(), e);
        }
        if (passages.isEmpty()) {
            throw ToolInvocationException.notFound("No policy passage matched '" + subject + "'");
        }

        RetrievedPassage best = passages.get(0);
        String summary = passages.stream()
                .map(p -> "[" + p.origin() + "] " + p.text().strip())
                .collect(Collectors.joining("\n\n"));
        var data = new LinkedHashMap<String, Object>();
        data.put("passages", passages.size());
        data.put("origins", passages.stream().map(RetrievedPassage::origin).collect(Collectors.joining(", ")));
        return new ToolOutput(summary, data,
                Map.of("policy_excerpt", best.text().strip()),
                best.origin(), best.score());
    }
}
