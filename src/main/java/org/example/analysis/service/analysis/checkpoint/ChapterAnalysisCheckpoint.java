package org.example.analysis.service.analysis.checkpoint;

import org.example.analysis.model.AccumulatedCharacterData;

import java.util.List;

/**
 * Progress of a batched chapter analysis. {@code lastProcessedParagraphIndex} is the
 * position of the last paragraph of the last completed batch, -1 before the first one.
 */
public record ChapterAnalysisCheckpoint(
    String bookId,
    String chapterId,
    String contentHash,
    long timestamp,
    int lastProcessedParagraphIndex,
    int totalParagraphs,
    int batchesCompleted,
    List<AccumulatedCharacterData> accumulatedCharacters
) implements AnalysisCheckpoint {

    public ChapterAnalysisCheckpoint {
        accumulatedCharacters = accumulatedCharacters == null ? List.of() : List.copyOf(accumulatedCharacters);
    }
}
