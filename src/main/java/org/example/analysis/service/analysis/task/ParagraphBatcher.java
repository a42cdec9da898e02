package org.example.analysis.service.analysis.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups paragraphs into batches of at most {@code maxChars} characters, joined with
 * blank lines. A paragraph is never split; one longer than the limit gets a batch of
 * its own.
 */
public final class ParagraphBatcher {

    private static final Logger log = LoggerFactory.getLogger(ParagraphBatcher.class);

    private static final int SEPARATOR_CHARS = 2;

    private ParagraphBatcher() {}

    public static List<ParagraphBatch> partition(List<String> paragraphs, int maxChars) {
        return partition(paragraphs, maxChars, 0);
    }

    /**
     * Batches the paragraphs from {@code startIndex} on. Batch indexes restart at 0,
     * paragraph indexes stay relative to the full list.
     */
    public static List<ParagraphBatch> partition(List<String> paragraphs, int maxChars, int startIndex) {
        List<ParagraphBatch> batches = new ArrayList<>();
        if (startIndex >= paragraphs.size()) {
            return batches;
        }

        List<String> current = new ArrayList<>();
        int currentStart = startIndex;
        int currentLength = 0;

        for (int i = startIndex; i < paragraphs.size(); i++) {
            String paragraph = paragraphs.get(i);
            int added = current.isEmpty() ? paragraph.length() : currentLength + SEPARATOR_CHARS + paragraph.length();
            if (added > maxChars && !current.isEmpty()) {
                batches.add(new ParagraphBatch(batches.size(), currentStart, i - 1, List.copyOf(current)));
                current.clear();
                currentStart = i;
                added = paragraph.length();
            }
            current.add(paragraph);
            currentLength = added;
        }
        batches.add(new ParagraphBatch(batches.size(), currentStart, paragraphs.size() - 1, List.copyOf(current)));

        log.debug("Created {} batches from paragraphs {}..{} (maxChars={})",
                batches.size(), startIndex, paragraphs.size() - 1, maxChars);
        return batches;
    }
}
