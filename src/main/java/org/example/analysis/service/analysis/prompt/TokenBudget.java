package org.example.analysis.service.analysis.prompt;

/**
 * Token allowances for one prompt. Character limits use a fixed approximation of
 * four characters per token rather than a real tokenizer. Callers keep
 * {@link #totalTokens()} within the target model's context window.
 */
public record TokenBudget(int promptTokens, int inputTokens, int outputTokens) {

    public static final int CHARS_PER_TOKEN = 4;

    public int totalTokens() {
        return promptTokens + inputTokens + outputTokens;
    }

    public int maxInputChars() {
        return inputTokens * CHARS_PER_TOKEN;
    }

    public int maxOutputChars() {
        return outputTokens * CHARS_PER_TOKEN;
    }
}
