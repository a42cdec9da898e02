package org.example.analysis.service.analysis.task;

import org.example.analysis.model.AccumulatedCharacterData;

import java.util.List;

/**
 * Reported after each batch of a chapter analysis has been merged and checkpointed.
 * Paragraph indexes are the stored {@code paragraphIndex} values of the batch's first
 * and last paragraph; {@code characters} is everything accumulated so far.
 */
public record BatchCompletion(
    String bookId,
    String chapterId,
    int batchNumber,
    int totalBatches,
    int firstParagraphIndex,
    int lastParagraphIndex,
    List<AccumulatedCharacterData> characters
) {
    public BatchCompletion {
        characters = List.copyOf(characters);
    }
}
