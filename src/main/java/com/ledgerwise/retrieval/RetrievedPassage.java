package com.ledgerwise.retrieval;

/**
 * A policy passage returned by retrieval.
 *
 * @param text   passage text
 * @param origin document and chunk identifier, e.g. {@code travel-policy#chunk0}
 * @param score  similarity score in [0, 1]
 */
public record RetrievedPassage(String text, String origin, double score) {}
