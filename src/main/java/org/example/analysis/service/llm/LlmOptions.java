package org.example.analysis.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    Double topP,           // nullable
    Integer maxTokens,     // nullable
    Integer contextTokens  // nullable, context window to request from the model
) {
    /**
     * Create options sized for one prompt: output cap plus the total context window.
     */
    public static LlmOptions forBudget(double temp, int maxTokens, int contextTokens) {
        return new LlmOptions(temp, null, maxTokens, contextTokens);
    }
}
