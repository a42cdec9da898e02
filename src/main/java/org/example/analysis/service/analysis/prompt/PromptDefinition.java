package org.example.analysis.service.analysis.prompt;

import org.example.analysis.service.llm.LlmOptions;

/**
 * One analysis prompt: shapes input to its token budget, renders the instruction
 * text and turns the model's raw answer into a typed result.
 *
 * @param <I> prepared input type
 * @param <O> parsed output type
 */
public interface PromptDefinition<I, O> {

    String promptId();

    String displayName();

    String purpose();

    TokenBudget tokenBudget();

    double temperature();

    String systemPrompt();

    /**
     * Clips the input so the text it carries fits {@code tokenBudget().maxInputChars()}.
     * Deterministic; multi-chapter inputs share the budget equally.
     */
    I prepareInput(I input);

    String buildUserPrompt(I input);

    /**
     * Never throws. Text without usable JSON yields the empty or default output.
     */
    O parseResponse(String response);

    default String buildFullPrompt(I input) {
        return systemPrompt() + "\n\n" + buildUserPrompt(input);
    }

    default LlmOptions llmOptions() {
        TokenBudget budget = tokenBudget();
        return LlmOptions.forBudget(temperature(), budget.outputTokens(), budget.totalTokens());
    }
}
