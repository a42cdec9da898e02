package org.example.analysis.service.llm;

/**
 * Abstraction for LLM providers (Ollama, xAI, etc.)
 */
public interface LlmProvider {

    /**
     * Generate a response from the LLM.
     *
     * @param prompt the prompt to send
     * @param options generation options (temperature, output and context budget)
     * @return the generated text response
     * @throws LlmTransientException when the call may succeed if retried (timeout, overload, memory pressure)
     * @throws LlmProviderException when the provider cannot serve the request at all
     */
    String generate(String prompt, LlmOptions options);

    /**
     * Check if this provider is available and properly configured.
     *
     * @return true if the provider can accept requests
     */
    boolean isAvailable();

    /**
     * Get the name of this provider for logging/debugging.
     *
     * @return provider name (e.g., "ollama", "xai")
     */
    String getProviderName();
}
