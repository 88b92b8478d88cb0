package com.ledgerwise.core.llm;

/**
 * Thrown when the language model returns null or blank content.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
