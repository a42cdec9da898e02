package org.example.analysis.service.analysis.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analysis.model.Foreshadowing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects foreshadowing setups and their payoffs across sampled chapters.
 */
@Component
public class ForeshadowingPrompt implements PromptDefinition<ChapterSamplesInput, ForeshadowingOutput> {

    private static final Logger log = LoggerFactory.getLogger(ForeshadowingPrompt.class);

    private final TokenBudget tokenBudget = new TokenBudget(300, 2800, 900);

    @Override
    public String promptId() {
        return "foreshadowing_detection_v1";
    }

    @Override
    public String displayName() {
        return "Foreshadowing Detection";
    }

    @Override
    public String purpose() {
        return "Detect foreshadowing elements and their payoffs across chapters";
    }

    @Override
    public TokenBudget tokenBudget() {
        return tokenBudget;
    }

    @Override
    public double temperature() {
        return 0.2;
    }

    @Override
    public String systemPrompt() {
        return "You are a literary analyst specializing in narrative structure. "
                + "Analyze the following chapters for foreshadowing elements.";
    }

    @Override
    public ChapterSamplesInput prepareInput(ChapterSamplesInput input) {
        return input.fairlyTruncated(tokenBudget.maxInputChars());
    }

    @Override
    public String buildUserPrompt(ChapterSamplesInput input) {
        return """
                Analyze these chapters for foreshadowing elements:

                %s

                Identify foreshadowing elements where:
                1. Setup elements: hints, symbolic objects, ominous statements, recurring motifs that suggest future events
                2. Payoff elements: when the setup is revealed, resolved, or gains meaning later

                Return ONLY valid JSON in this exact format:
                {
                  "foreshadowing": [
                    {
                      "setup_chapter": 1,
                      "setup_text": "Brief quote or description of the setup",
                      "payoff_chapter": 5,
                      "payoff_text": "Brief quote or description of the payoff",
                      "theme": "one or two word theme like 'death' or 'betrayal'",
                      "confidence": 0.8
                    }
                  ]
                }

                If no foreshadowing is found, return: {"foreshadowing": []}""".formatted(input.renderChapters());
    }

    @Override
    public ForeshadowingOutput parseResponse(String response) {
        try {
            Optional<JsonNode> extracted = JsonResponseExtractor.extract(response);
            if (extracted.isEmpty() || !extracted.get().isObject()) {
                log.warn("No valid JSON object in foreshadowing response");
                return ForeshadowingOutput.empty();
            }
            JsonNode array = extracted.get().get("foreshadowing");
            if (array == null || !array.isArray()) {
                return ForeshadowingOutput.empty();
            }

            List<Foreshadowing> results = new ArrayList<>();
            for (JsonNode item : array) {
                JsonNode setup = item.get("setup_chapter");
                JsonNode payoff = item.get("payoff_chapter");
                if (setup == null || !setup.canConvertToInt() || payoff == null || !payoff.canConvertToInt()) {
                    log.debug("Skipping foreshadowing element without chapter numbers");
                    continue;
                }
                results.add(new Foreshadowing(
                        Math.max(0, setup.asInt() - 1),
                        JsonResponseExtractor.textOrDefault(item, "setup_text", ""),
                        Math.max(0, payoff.asInt() - 1),
                        JsonResponseExtractor.textOrDefault(item, "payoff_text", ""),
                        JsonResponseExtractor.textOrDefault(item, "theme", "unknown"),
                        JsonResponseExtractor.doubleOrDefault(item, "confidence", 0.7)
                ));
            }
            return new ForeshadowingOutput(results);
        } catch (RuntimeException e) {
            log.warn("Error parsing foreshadowing response: {}", e.getMessage());
            return ForeshadowingOutput.empty();
        }
    }
}
