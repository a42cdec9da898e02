package org.example.analysis.service.analysis.task;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParagraphBatcherTest {

    @Test
    void partition_countsSeparatorAgainstLimit() {
        List<ParagraphBatch> batches = ParagraphBatcher.partition(List.of("aaaa", "bbbb", "cc"), 10);

        assertEquals(2, batches.size());
        assertEquals(0, batches.get(0).startParagraphIndex());
        assertEquals(1, batches.get(0).endParagraphIndex());
        assertEquals("aaaa\n\nbbbb", batches.get(0).text());
        assertEquals(2, batches.get(1).startParagraphIndex());
        assertEquals(2, batches.get(1).endParagraphIndex());
        assertEquals(1, batches.get(1).batchIndex());
    }

    @Test
    void partition_oversizedParagraphGetsOwnBatch() {
        List<ParagraphBatch> batches = ParagraphBatcher.partition(List.of("x".repeat(20), "y"), 10);

        assertEquals(2, batches.size());
        assertEquals(1, batches.get(0).paragraphCount());
        assertEquals(20, batches.get(0).text().length());
        assertEquals("y", batches.get(1).text());
    }

    @Test
    void partition_fromStartIndex_keepsAbsoluteParagraphIndexes() {
        List<ParagraphBatch> batches = ParagraphBatcher.partition(List.of("a", "b", "c", "d"), 4, 2);

        assertEquals(1, batches.size());
        assertEquals(0, batches.get(0).batchIndex());
        assertEquals(2, batches.get(0).startParagraphIndex());
        assertEquals(3, batches.get(0).endParagraphIndex());
        assertEquals("c\n\nd", batches.get(0).text());
    }

    @Test
    void partition_startBeyondEnd_returnsNoBatches() {
        assertTrue(ParagraphBatcher.partition(List.of("a", "b"), 10, 2).isEmpty());
        assertTrue(ParagraphBatcher.partition(List.of(), 10).isEmpty());
    }

    @Test
    void partition_coversEveryParagraphExactlyOnce() {
        List<String> paragraphs = List.of("one", "two two", "three three three", "four", "five five");

        List<ParagraphBatch> batches = ParagraphBatcher.partition(paragraphs, 12);

        int expectedStart = 0;
        for (ParagraphBatch batch : batches) {
            assertEquals(expectedStart, batch.startParagraphIndex());
            assertTrue(batch.text().length() <= 12 || batch.paragraphCount() == 1);
            expectedStart = batch.endParagraphIndex() + 1;
        }
        assertEquals(paragraphs.size(), expectedStart);
    }
}
