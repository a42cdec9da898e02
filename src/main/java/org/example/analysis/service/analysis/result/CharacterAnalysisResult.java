package org.example.analysis.service.analysis.result;

import org.example.analysis.model.AccumulatedCharacterData;

import java.util.List;

public record CharacterAnalysisResult(
    String bookId,
    String chapterId,
    List<AccumulatedCharacterData> characters
) implements AnalysisResult {

    @Override
    public TaskKind kind() {
        return TaskKind.CHARACTERS;
    }

    @Override
    public int itemCount() {
        return characters.size();
    }
}
