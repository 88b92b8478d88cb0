package com.ledgerwise.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link PolicyRetriever} backed by a Spring AI {@link VectorStore}.
 * Duplicate chunk texts are collapsed.
 */
@Service
public class VectorStorePolicyRetriever implements PolicyRetriever {

    private static final Logger log = LoggerFactory.getLogger(VectorStorePolicyRetriever.class);

    private final VectorStore vectorStore;

    public VectorStorePolicyRetriever(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public List<RetrievedPassage> search(String query, int topK, double similarityThreshold) {
        List<Document> docs = vectorStore.similaritySearch(
                SearchRequest.builder()
                        .query(query)
                        .topK(topK)
                        .similarityThreshold(similarityThreshold)
                        .build());
        Map<String, RetrievedPassage> deduped = new LinkedHashMap<>();
        for (Document doc : docs) {
            deduped.putIfAbsent(doc.getText(), new RetrievedPassage(doc.getText(), originOf(doc),
                    doc.getScore() == null ? 0.0 : doc.getScore()));
        }
        log.debug("Policy search '{}' returned {} passages", query, deduped.size());
        return List.copyOf(deduped.values());
    }

    static String originOf(Document doc) {
        Object policyId = doc.getMetadata().get("policyId");
        Object chunkIndex = doc.getMetadata().get("chunkIndex");
        if (policyId != null && chunkIndex != null) {
            return policyId + "#chunk" + chunkIndex;
        }
        return String.valueOf(doc.getMetadata().getOrDefault("path", "policies"));
    }
}
