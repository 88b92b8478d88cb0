package com.ledgerwise.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads policy documents into the vector store. Runs before the CLI command
 * so retrieval sees the corpus.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class PolicyIngestor implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PolicyIngestor.class);

    static final int CHUNK_SIZE = 800;
    static final int CHUNK_OVERLAP = 100;

    private final VectorStore vectorStore;
    private final RetrievalProperties properties;

    public PolicyIngestor(VectorStore vectorStore, RetrievalProperties properties) {
        this.vectorStore = vectorStore;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws IOException {
        if (!properties.isIngestOnStartup()) {
            log.info("Policy ingestion disabled");
            return;
        }
        int chunks;
        try {
            chunks = ingest(properties.getDocumentsPattern());
        } catch (RuntimeException e) {
            // Embedding provider unreachable: policy_search then reports no matching policy.
            log.error("Policy ingestion failed, policy search will return no passages: {}", e.getMessage(), e);
            return;
        }
        log.info("Ingested {} policy chunks from {}", chunks, properties.getDocumentsPattern());
    }

    /**
     * Chunks every document matching {@code pattern} and adds the chunks to
     * the vector store.
     *
     * @return number of chunks added
     */
    public int ingest(String pattern) throws IOException {
        ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
        List<Document> docs = new ArrayList<>();
        for (Resource resource : resolver.getResources(pattern)) {
            String text;
            try (InputStream in = resource.getInputStream()) {
                text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            String filename = resource.getFilename() == null ? "unknown" : resource.getFilename();
            String policyId = filename.replaceFirst("\\.[^.]+$", "");
            docs.addAll(chunk(text, Map.of(
                    "path", filename,
                    "policyId", policyId,
                    "title", titleOf(text, policyId))));
        }
        if (!docs.isEmpty()) {
            vectorStore.add(docs);
        }
        return docs.size();
    }

    static List<Document> chunk(String text, Map<String, Object> baseMeta) {
        List<Document> out = new ArrayList<>();
        int chunkIndex = 0;
        for (int start = 0; start < text.length(); start += CHUNK_SIZE - CHUNK_OVERLAP) {
            int end = Math.min(text.length(), start + CHUNK_SIZE);
            Map<String, Object> meta = new HashMap<>(baseMeta);
            meta.put("chunkIndex", chunkIndex++);
            out.add(new Document(text.substring(start, end), meta));
            if (end == text.length()) {
                break;
            }
        }
        return out;
    }

    static String titleOf(String text, String fallback) {
        String first = text.split("\\R", 2)[0].trim();
        if (first.startsWith("#")) {
            return first.replaceFirst("^#+", "").trim();
        }
        return fallback;
    }
}
