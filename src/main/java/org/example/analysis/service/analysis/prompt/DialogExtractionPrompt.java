package org.example.analysis.service.analysis.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Attributes dialog lines to known characters with an emotion and intensity.
 */
@Component
public class DialogExtractionPrompt implements PromptDefinition<DialogExtractionInput, DialogExtractionOutput> {

    private static final Logger log = LoggerFactory.getLogger(DialogExtractionPrompt.class);

    private static final String DEFAULT_EMOTION = "neutral";
    private static final double DEFAULT_INTENSITY = 0.5;

    private final TokenBudget tokenBudget = new TokenBudget(300, 1500, 2200);

    @Override
    public String promptId() {
        return "dialog_extraction_v1";
    }

    @Override
    public String displayName() {
        return "Dialog Extraction";
    }

    @Override
    public String purpose() {
        return "Extract dialogs and attribute them to characters";
    }

    @Override
    public TokenBudget tokenBudget() {
        return tokenBudget;
    }

    @Override
    public double temperature() {
        return 0.15;
    }

    @Override
    public String systemPrompt() {
        return "You are a dialog extraction engine. Read the text sequentially and extract all the dialogs "
                + "of the given characters in the story excerpt.";
    }

    @Override
    public DialogExtractionInput prepareInput(DialogExtractionInput input) {
        int maxChars = tokenBudget.maxInputChars();
        String text = input.text() == null ? "" : input.text();
        if (text.length() <= maxChars) {
            return input;
        }
        int cut = truncationPoint(text, maxChars);
        log.warn("Dialog extraction input of {} chars exceeds budget of {}, dropping last {} chars",
                text.length(), maxChars, text.length() - cut);
        return new DialogExtractionInput(input.characterNames(), text.substring(0, cut));
    }

    /** Last paragraph break within the budget, else the last sentence end, else the budget itself. */
    static int truncationPoint(String text, int maxChars) {
        int paragraphBreak = text.lastIndexOf("\n\n", maxChars);
        if (paragraphBreak > 0) {
            return paragraphBreak;
        }
        for (int i = maxChars - 1; i > 0; i--) {
            char c = text.charAt(i);
            if ((c == '.' || c == '!' || c == '?') && Character.isWhitespace(text.charAt(i + 1))) {
                return i + 1;
            }
        }
        return maxChars;
    }

    @Override
    public String buildUserPrompt(DialogExtractionInput input) {
        return """
                Extract all dialogs for: %s

                For every quoted line spoken by one of these characters, give the speaker, the exact text,
                the emotion (neutral, happy, sad, angry, afraid, surprised, ...) and its intensity from 0.0 to 1.0.

                Return ONLY valid JSON in this exact format:
                {"dialogs": [{"speaker": "<character_name>", "text": "<dialog_text>", "emotion": "neutral", "intensity": 0.5}]}

                If there are no dialogs, return: {"dialogs": []}

                TEXT:
                %s""".formatted(String.join(", ", input.characterNames()), input.text());
    }

    @Override
    public DialogExtractionOutput parseResponse(String response) {
        try {
            Optional<JsonNode> extracted = JsonResponseExtractor.extract(response);
            if (extracted.isEmpty()) {
                log.warn("No JSON in dialog extraction response");
                return DialogExtractionOutput.empty();
            }
            JsonNode root = extracted.get();
            List<AttributedDialog> dialogs = new ArrayList<>();

            if (root.isObject() && root.has("dialogs")) {
                for (JsonNode item : root.path("dialogs")) {
                    AttributedDialog dialog = parseDialogObject(item);
                    if (dialog != null) {
                        dialogs.add(dialog);
                    }
                }
            } else if (root.isArray()) {
                // Fallback shape: [{"Speaker": "text"}, ...]
                for (JsonNode item : root) {
                    AttributedDialog dialog = item.has("speaker") ? parseDialogObject(item) : parseSingleEntry(item);
                    if (dialog != null) {
                        dialogs.add(dialog);
                    }
                }
            }
            return new DialogExtractionOutput(dialogs);
        } catch (RuntimeException e) {
            log.warn("Failed to parse dialog extraction response: {}", e.getMessage());
            return DialogExtractionOutput.empty();
        }
    }

    private AttributedDialog parseDialogObject(JsonNode item) {
        if (item == null || !item.isObject()) {
            return null;
        }
        String speaker = JsonResponseExtractor.textOrDefault(item, "speaker", null);
        String text = JsonResponseExtractor.textOrDefault(item, "text", null);
        if (speaker == null || text == null) {
            return null;
        }
        String emotion = JsonResponseExtractor.textOrDefault(item, "emotion", DEFAULT_EMOTION).toLowerCase(Locale.ROOT);
        double intensity = JsonResponseExtractor.doubleOrDefault(item, "intensity", DEFAULT_INTENSITY);
        return new AttributedDialog(speaker, text, emotion, Math.max(0.0, Math.min(1.0, intensity)));
    }

    private AttributedDialog parseSingleEntry(JsonNode item) {
        if (item == null || !item.isObject() || item.size() != 1) {
            return null;
        }
        Map.Entry<String, JsonNode> entry = item.fields().next();
        if (!entry.getValue().isValueNode()) {
            return null;
        }
        String text = entry.getValue().asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        return new AttributedDialog(entry.getKey().trim(), text, DEFAULT_EMOTION, DEFAULT_INTENSITY);
    }
}
