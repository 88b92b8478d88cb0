package com.ledgerwise.retrieval;

import java.util.List;

/**
 * Similarity search over the policy document corpus.
 */
public interface PolicyRetriever {

    /**
     * @param query               natural-language query
     * @param topK                maximum passages to return
     * @param similarityThreshold minimum score a passage must reach
     * @return passages ordered by descending score
     */
    List<RetrievedPassage> search(String query, int topK, double similarityThreshold);
}
