package org.example.analysis.service.analysis.prompt;

import java.util.List;

public record DialogExtractionOutput(List<AttributedDialog> dialogs) {

    public static DialogExtractionOutput empty() {
        return new DialogExtractionOutput(List.of());
    }
}
