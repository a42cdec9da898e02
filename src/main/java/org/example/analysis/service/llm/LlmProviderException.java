package org.example.analysis.service.llm;

/**
 * Exception thrown when an LLM provider encounters an error it cannot recover from.
 */
public class LlmProviderException extends RuntimeException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
