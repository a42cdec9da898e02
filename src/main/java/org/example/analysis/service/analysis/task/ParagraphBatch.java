package org.example.analysis.service.analysis.task;

import java.util.List;

/**
 * Consecutive paragraphs sent in one inference call. Indexes are positions in the
 * chapter's paragraph list; {@code endParagraphIndex} is inclusive.
 */
public record ParagraphBatch(int batchIndex, int startParagraphIndex, int endParagraphIndex, List<String> paragraphs) {

    public String text() {
        return String.join("\n\n", paragraphs);
    }

    public int paragraphCount() {
        return paragraphs.size();
    }
}
