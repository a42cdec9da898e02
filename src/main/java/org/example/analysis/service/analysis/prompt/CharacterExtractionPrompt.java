package org.example.analysis.service.analysis.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analysis.model.VoiceProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts speaking characters with their quoted dialogs, traits and an inferred
 * voice profile in one call per batch.
 */
@Component
public class CharacterExtractionPrompt implements PromptDefinition<BatchTextInput, CharacterExtractionOutput> {

    private static final Logger log = LoggerFactory.getLogger(CharacterExtractionPrompt.class);

    private final TokenBudget tokenBudget = new TokenBudget(300, 3700, 1000);

    @Override
    public String promptId() {
        return "batched_analysis_v1";
    }

    @Override
    public String displayName() {
        return "Batched Chapter Analysis";
    }

    @Override
    public String purpose() {
        return "Extract characters, their dialogs in the story, their traits and their inferred voice profile";
    }

    @Override
    public TokenBudget tokenBudget() {
        return tokenBudget;
    }

    @Override
    public double temperature() {
        return 0.01;
    }

    @Override
    public String systemPrompt() {
        return "You are a JSON extraction engine. Extract ONLY characters who SPEAK dialog. "
                + "Ignore locations, objects, creatures, and non-speaking entities.";
    }

    @Override
    public BatchTextInput prepareInput(BatchTextInput input) {
        int maxChars = tokenBudget.maxInputChars();
        String text = input.text() == null ? "" : input.text();
        if (text.length() <= maxChars) {
            return input;
        }
        // Prefer cutting at a paragraph break
        int cut = text.lastIndexOf("\n\n", maxChars);
        String truncated = cut > 0 ? text.substring(0, cut) : text.substring(0, maxChars);
        return new BatchTextInput(truncated, input.batchIndex(), input.totalBatches());
    }

    @Override
    public String buildUserPrompt(BatchTextInput input) {
        return """
                Extract Character names, their Dialogs(D), their Traits(T) and their inferred Voice/Speaking Profile(V) from the story text below.
                RULES:
                1. ONLY include characters who have quoted dialogs
                2. DO NOT include locations, objects, creatures or entities that don't speak
                3. In the output json, each discovered character must appear EXACTLY ONCE
                4. Read the ENTIRE text before outputting

                FORMAT: {"<Character-Name>":{"D":["dialog1","dialog2"],"T":["trait1","trait2"],"V":"Gender,Age,Accent"}}

                KEYS:
                - D = Array of ALL quoted dialogs spoken by the keyed Character
                - T = Array of Character's physical traits and personality
                - V = Their [Gender,Age,Accent]. Options: (male|female, child|young|middle-aged|elderly, neutral|English|American|Asian...)

                Respond with ONLY the JSON object, no other text.

                TEXT:
                %s

                JSON:""".formatted(input.text());
    }

    @Override
    public CharacterExtractionOutput parseResponse(String response) {
        try {
            Optional<JsonNode> extracted = JsonResponseExtractor.extract(response);
            if (extracted.isEmpty() || !extracted.get().isObject()) {
                log.warn("No JSON object in character extraction response ({} chars)",
                        response == null ? 0 : response.length());
                return CharacterExtractionOutput.empty();
            }

            List<ExtractedCharacter> characters = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = extracted.get().fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String name = entry.getKey().trim();
                JsonNode data = entry.getValue();
                if (name.isEmpty() || !data.isObject()) {
                    log.debug("Skipping non-character entry '{}'", entry.getKey());
                    continue;
                }
                characters.add(new ExtractedCharacter(
                        name,
                        stringList(firstPresent(data, "D", "d", "dialogs")),
                        stringList(firstPresent(data, "T", "t", "traits")),
                        parseVoiceProfile(data)
                ));
            }
            log.debug("Parsed {} characters from batch response", characters.size());
            return new CharacterExtractionOutput(characters);
        } catch (RuntimeException e) {
            log.warn("Failed to parse character extraction response: {}", e.getMessage());
            return CharacterExtractionOutput.empty();
        }
    }

    private VoiceProfile parseVoiceProfile(JsonNode data) {
        JsonNode compact = firstPresent(data, "V", "v");
        if (compact != null && compact.isTextual()) {
            VoiceProfile profile = VoiceProfile.fromCompact(compact.asText());
            if (profile != null) {
                return profile;
            }
        }
        JsonNode voice = data.get("voice");
        if (voice != null && voice.isObject()) {
            return new VoiceProfile(
                    JsonResponseExtractor.textOrDefault(voice, "gender", VoiceProfile.DEFAULT_GENDER),
                    JsonResponseExtractor.textOrDefault(voice, "age", VoiceProfile.DEFAULT_AGE),
                    JsonResponseExtractor.textOrDefault(voice, "accent", VoiceProfile.DEFAULT_ACCENT),
                    JsonResponseExtractor.doubleOrDefault(voice, "pitch", 1.0),
                    JsonResponseExtractor.doubleOrDefault(voice, "speed", 1.0)
            );
        }
        return null;
    }

    private static JsonNode firstPresent(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (item.isValueNode()) {
                String text = item.asText().trim();
                if (!text.isEmpty()) {
                    values.add(text);
                }
            }
        }
        return values;
    }
}
