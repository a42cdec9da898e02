package org.example.analysis.service.analysis.task;

import org.example.analysis.service.llm.LlmOptions;
import org.example.analysis.service.llm.LlmProvider;
import org.example.analysis.service.llm.LlmProviderException;
import org.example.analysis.service.llm.LlmTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Calls the LLM provider, retrying transient failures with backoff. Fatal failures
 * and the last transient failure propagate.
 */
public class InferenceRetrier {

    private static final Logger log = LoggerFactory.getLogger(InferenceRetrier.class);

    private final LlmProvider llmProvider;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public InferenceRetrier(LlmProvider llmProvider, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.llmProvider = llmProvider;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public String generate(String prompt, LlmOptions options, String operation) {
        int maxAttempts = Math.max(1, retryPolicy.maxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                log.debug("{}: attempt {} with {} prompt chars", operation, attempt, prompt.length());
                return llmProvider.generate(prompt, options);
            } catch (LlmTransientException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{}: giving up after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                Duration backoff = retryPolicy.backoffAfter(attempt);
                log.warn("{}: transient failure on attempt {}/{} ({}), retrying in {} ms",
                        operation, attempt, maxAttempts, e.getMessage(), backoff.toMillis());
                pause(backoff, e);
            }
        }
    }

    private void pause(Duration backoff, LlmTransientException cause) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LlmProviderException interrupted = new LlmProviderException("Interrupted while waiting to retry", ie);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }
}
