package org.example.analysis.service.analysis.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Classifies a book's mood, genre, era and emotional tone from its opening chapter.
 */
@Component
public class ThemeAnalysisPrompt implements PromptDefinition<ThemeAnalysisInput, ThemeAnalysisOutput> {

    private static final Logger log = LoggerFactory.getLogger(ThemeAnalysisPrompt.class);

    private final TokenBudget tokenBudget = new TokenBudget(250, 3000, 200);

    @Override
    public String promptId() {
        return "theme_analysis_v1";
    }

    @Override
    public String displayName() {
        return "Theme Analysis";
    }

    @Override
    public String purpose() {
        return "Analyze book content to determine mood, genre, and UI theme";
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
        return "You are a literary analyst specializing in genre and mood classification. "
                + "Analyze the book content to determine its mood, genre, and atmosphere.";
    }

    @Override
    public ThemeAnalysisInput prepareInput(ThemeAnalysisInput input) {
        String text = input.firstChapterText() == null ? "" : input.firstChapterText();
        int limit = Math.min(input.maxSampleChars(), tokenBudget.maxInputChars());
        if (text.length() > limit) {
            text = text.substring(0, limit);
        }
        return new ThemeAnalysisInput(input.title(), text, input.maxSampleChars());
    }

    @Override
    public String buildUserPrompt(ThemeAnalysisInput input) {
        return """
                Analyze this book content and determine its mood and atmosphere:

                Title: %s
                First Chapter Sample:
                %s

                Determine:
                1. Primary mood (dark_gothic, romantic, adventure, mystery, fantasy, scifi, classic)
                2. Genre (classic_literature, modern_fiction, fantasy, scifi, romance, thriller)
                3. Era setting (historical, contemporary, futuristic)
                4. Emotional tone (somber, uplifting, tense, whimsical)

                Return ONLY valid JSON:
                {
                  "mood": "dark_gothic",
                  "genre": "thriller",
                  "era": "contemporary",
                  "emotional_tone": "tense",
                  "suggested_ambient_sound": "rain"
                }""".formatted(input.title(), input.firstChapterText());
    }

    @Override
    public ThemeAnalysisOutput parseResponse(String response) {
        try {
            Optional<JsonNode> extracted = JsonResponseExtractor.extract(response);
            if (extracted.isEmpty() || !extracted.get().isObject()) {
                log.warn("No JSON object in theme analysis response, using defaults");
                return ThemeAnalysisOutput.defaults();
            }
            JsonNode json = extracted.get();
            return new ThemeAnalysisOutput(
                    JsonResponseExtractor.textOrDefault(json, "mood", ThemeAnalysisOutput.DEFAULT_MOOD),
                    JsonResponseExtractor.textOrDefault(json, "genre", ThemeAnalysisOutput.DEFAULT_GENRE),
                    JsonResponseExtractor.textOrDefault(json, "era", ThemeAnalysisOutput.DEFAULT_ERA),
                    JsonResponseExtractor.textOrDefault(json, "emotional_tone", ThemeAnalysisOutput.DEFAULT_EMOTIONAL_TONE),
                    JsonResponseExtractor.textOrDefault(json, "suggested_ambient_sound", null)
            );
        } catch (RuntimeException e) {
            log.warn("Theme analysis parse error: {}", e.getMessage());
            return ThemeAnalysisOutput.defaults();
        }
    }
}
