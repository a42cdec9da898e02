package org.example.analysis.service.analysis.prompt;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CharacterExtractionPromptTest {

    private final CharacterExtractionPrompt prompt = new CharacterExtractionPrompt();

    @Test
    void parseResponse_compactFormat() {
        String response = """
                {"Elizabeth": {"D": ["I am perfectly serious."], "T": ["witty", "proud"], "V": "female,young,English"},
                 "Mr. Darcy": {"D": ["She is tolerable."], "T": ["reserved"]}}
                """;

        CharacterExtractionOutput output = prompt.parseResponse(response);

        assertEquals(2, output.characters().size());
        ExtractedCharacter elizabeth = output.characters().get(0);
        assertEquals("Elizabeth", elizabeth.name());
        assertEquals(1, elizabeth.dialogs().size());
        assertEquals(2, elizabeth.traits().size());
        assertNotNull(elizabeth.voiceProfile());
        assertEquals("female", elizabeth.voiceProfile().gender());
        assertEquals("English", elizabeth.voiceProfile().accent());
        assertNull(output.characters().get(1).voiceProfile());
    }

    @Test
    void parseResponse_legacyVoiceObject() {
        String response = "{\"Ahab\": {\"dialogs\": [\"Death to Moby Dick!\"], \"traits\": [\"obsessed\"], "
                + "\"voice\": {\"gender\": \"male\", \"age\": \"elderly\", \"pitch\": 0.8}}}";

        CharacterExtractionOutput output = prompt.parseResponse(response);

        assertEquals(1, output.characters().size());
        assertEquals("elderly", output.characters().get(0).voiceProfile().age());
        assertEquals("neutral", output.characters().get(0).voiceProfile().accent());
        assertEquals(0.8, output.characters().get(0).voiceProfile().pitch(), 0.0001);
    }

    @Test
    void parseResponse_garbage_returnsEmpty() {
        assertTrue(prompt.parseResponse("I could not find any characters.").characters().isEmpty());
        assertTrue(prompt.parseResponse("[1, 2, 3]").characters().isEmpty());
    }

    @Test
    void prepareInput_truncatesAtParagraphBoundary() {
        int max = prompt.tokenBudget().maxInputChars();
        String first = "a".repeat(max - 100);
        String text = first + "\n\n" + "b".repeat(500);

        BatchTextInput prepared = prompt.prepareInput(new BatchTextInput(text, 0, 1));

        assertEquals(first, prepared.text());
    }

    @Test
    void buildUserPrompt_embedsTextAndJsonDirective() {
        String userPrompt = prompt.buildUserPrompt(new BatchTextInput("\"Hello,\" said Jane.", 0, 1));

        assertTrue(userPrompt.contains("\"Hello,\" said Jane."));
        assertTrue(userPrompt.contains("ONLY the JSON"));
    }
}
