package org.example.analysis.service.llm;

/**
 * Provider failure that is worth retrying: timeouts, rate limiting, server overload
 * or the model running out of memory.
 */
public class LlmTransientException extends LlmProviderException {

    public LlmTransientException(String message) {
        super(message);
    }

    public LlmTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
