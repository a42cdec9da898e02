package org.example.analysis.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * LLM provider implementation for Ollama.
 * Calls the Ollama /api/generate endpoint.
 */
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds) {
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .build();
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        log.info("Ollama LLM provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        Map<String, Object> ollamaOptions = new HashMap<>();
        ollamaOptions.put("temperature", options.temperature());
        if (options.topP() != null) {
            ollamaOptions.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            ollamaOptions.put("num_predict", options.maxTokens());
        }
        if (options.contextTokens() != null) {
            ollamaOptions.put("num_ctx", options.contextTokens());
        }

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "options", ollamaOptions
        );

        try {
            String response = webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            JsonNode responseNode = objectMapper.readTree(response);
            JsonNode text = responseNode.get("response");
            if (text == null) {
                throw new LlmProviderException("Invalid response format from Ollama");
            }
            return text.asText();

        } catch (WebClientResponseException e) {
            log.error("Ollama API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            if (isRetryableStatus(e) || e.getResponseBodyAsString().contains("out of memory")) {
                throw new LlmTransientException("Ollama API error: " + e.getStatusCode(), e);
            }
            throw new LlmProviderException("Ollama API error: " + e.getStatusCode(), e);
        } catch (WebClientRequestException e) {
            log.error("Ollama unreachable at {}: {}", e.getUri(), e.getMessage());
            throw new LlmProviderException("Ollama unreachable", e);
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                log.warn("Ollama request timed out after {}s", timeoutSeconds);
                throw new LlmTransientException("Ollama request timed out", e);
            }
            log.error("Failed to generate response from Ollama", e);
            throw new LlmProviderException("Failed to generate response from Ollama", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(2));
            return true;
        } catch (Exception e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }

    static boolean isRetryableStatus(WebClientResponseException e) {
        return e.getStatusCode().value() == 429 || e.getStatusCode().is5xxServerError();
    }
}
