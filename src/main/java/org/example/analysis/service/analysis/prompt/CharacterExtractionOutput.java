package org.example.analysis.service.analysis.prompt;

import java.util.List;

public record CharacterExtractionOutput(List<ExtractedCharacter> characters) {

    public static CharacterExtractionOutput empty() {
        return new CharacterExtractionOutput(List.of());
    }
}
