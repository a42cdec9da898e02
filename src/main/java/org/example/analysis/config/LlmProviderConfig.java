package org.example.analysis.config;

import org.example.analysis.service.llm.LlmProvider;
import org.example.analysis.service.llm.OllamaLlmProvider;
import org.example.analysis.service.llm.XaiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LLM provider used by the analysis pipeline.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Value("${ai.analysis.provider:ollama}")
    private String analysisProvider;

    @Value("${ai.analysis.timeout-seconds:600}")
    private int analysisTimeoutSeconds;

    @Value("${ai.analysis.ollama.base-url:http://localhost:11434}")
    private String analysisOllamaBaseUrl;

    @Value("${ai.analysis.ollama.model:llama3.1:latest}")
    private String analysisOllamaModel;

    @Value("${ai.analysis.xai.api-key:}")
    private String analysisXaiApiKey;

    @Value("${ai.analysis.xai.model:grok-4-1-fast-reasoning}")
    private String analysisXaiModel;

    @Bean
    @Qualifier("analysisLlmProvider")
    public LlmProvider analysisLlmProvider() {
        log.info("Configuring analysis LLM provider: {}", analysisProvider);
        return createProvider(
                analysisProvider,
                analysisOllamaBaseUrl, analysisOllamaModel,
                analysisXaiApiKey, analysisXaiModel,
                analysisTimeoutSeconds
        );
    }

    private LlmProvider createProvider(
            String providerType,
            String ollamaBaseUrl, String ollamaModel,
            String xaiApiKey, String xaiModel,
            int timeoutSeconds) {

        return switch (providerType.toLowerCase()) {
            case "ollama" -> new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            case "xai" -> {
                if (xaiApiKey == null || xaiApiKey.isBlank()) {
                    log.warn("xAI API key not configured for analysis provider, falling back to Ollama");
                    yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
                }
                yield new XaiLlmProvider(xaiApiKey, xaiModel, timeoutSeconds);
            }
            default -> {
                log.warn("Unknown provider type '{}' for analysis, falling back to Ollama", providerType);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
        };
    }
}
