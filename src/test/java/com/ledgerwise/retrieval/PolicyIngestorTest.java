package com.ledgerwise.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.VectorStore;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class PolicyIngestorTest {

    @Nested
    @DisplayName("chunk")
    class Chunk {

        @Test
        @DisplayName("short text stays in one chunk")
        void singleChunk() {
            List<Document> chunks = PolicyIngestor.chunk("Hotel limit is 600 per night.", Map.of("policyId", "travel"));

            assertEquals(1, chunks.size());
            assertEquals(0, chunks.get(0).getMetadata().get("chunkIndex"));
            assertEquals("travel", chunks.get(0).getMetadata().get("policyId"));
        }

        @Test
        @DisplayName("long text is split into overlapping chunks")
        void overlapping() {
            String text = "x".repeat(PolicyIngestor.CHUNK_SIZE * 2);

            List<Document> chunks = PolicyIngestor.chunk(text, Map.of());

            assertEquals(3, chunks.size());
            assertEquals(PolicyIngestor.CHUNK_SIZE, chunks.get(0).getText().length());
            assertEquals(2, chunks.get(2).getMetadata().get("chunkIndex"));
            int covered = (chunks.size() - 1) * (PolicyIngestor.CHUNK_SIZE - PolicyIngestor.CHUNK_OVERLAP)
                    + chunks.get(2).getText().length();
            assertEquals(text.length(), covered);
        }
    }

    @Test
    @DisplayName("titleOf reads a leading markdown heading or falls back")
    void titleOf() {
        assertEquals("Business Travel Policy", PolicyIngestor.titleOf("## Business Travel Policy\nbody", "travel"));
        assertEquals("travel", PolicyIngestor.titleOf("No heading here", "travel"));
    }

    @Test
    @DisplayName("ingests the bundled policy documents")
    @SuppressWarnings("unchecked")
    void ingestsBundledPolicies() throws Exception {
        VectorStore vectorStore = mock(VectorStore.class);
        var ingestor = new PolicyIngestor(vectorStore, new RetrievalProperties());

        int count = ingestor.ingest("classpath:/policies/*.md");

        ArgumentCaptor<List<Document>> captor = ArgumentCaptor.forClass(List.class);
        verify(vectorStore).add(captor.capture());
        assertEquals(count, captor.getValue().size());
        assertTrue(count >= 4);
        assertTrue(captor.getValue().stream()
                .anyMatch(d -> "Business Travel Reimbursement Policy".equals(d.getMetadata().get("title"))));
    }

    @Test
    @DisplayName("startup ingestion can be switched off")
    void disabled() throws Exception {
        VectorStore vectorStore = mock(VectorStore.class);
        var properties = new RetrievalProperties();
        properties.setIngestOnStartup(false);

        new PolicyIngestor(vectorStore, properties).run();

        verify(vectorStore, never()).add(any());
    }

    @Test
    @DisplayName("an unreachable embedding provider does not abort startup")
    void embeddingFailure() {
        VectorStore vectorStore = mock(VectorStore.class);
        doThrow(new IllegalStateException("401 Unauthorized")).when(vectorStore).add(any());

        assertDoesNotThrow(() -> new PolicyIngestor(vectorStore, new RetrievalProperties()).run());
    }
}
