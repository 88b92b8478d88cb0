package com.ledgerwise.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ledgerwise.retrieval")
public class RetrievalProperties {

    private int topK = 3;
    private double similarityThreshold = 0.3;

    /** Load the policy corpus into the vector store when the application starts. */
    private boolean ingestOnStartup = true;

    private String documentsPattern = "classpath:/policies/*.md";

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public boolean isIngestOnStartup() {
        return ingestOnStartup;
    }

    public void setIngestOnStartup(boolean ingestOnStartup) {
        this.ingestOnStartup = ingestOnStartup;
    }

    public String getDocumentsPattern() {
        return documentsPattern;
    }

    public void setDocumentsPattern(String documentsPattern) {
        this.documentsPattern = documentsPattern;
    }
}
