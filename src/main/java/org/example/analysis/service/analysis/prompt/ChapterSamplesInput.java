package org.example.analysis.service.analysis.prompt;

import java.util.ArrayList;
import java.util.List;

public record ChapterSamplesInput(List<ChapterSample> chapters, int maxSampleChars) {

    public static final int DEFAULT_MAX_SAMPLE_CHARS = 1500;

    public ChapterSamplesInput(List<ChapterSample> chapters) {
        this(chapters, DEFAULT_MAX_SAMPLE_CHARS);
    }

    /**
     * Gives every chapter an equal share of {@code maxInputChars}, also capped by
     * {@code maxSampleChars}. Order is preserved and no chapter is dropped.
     */
    ChapterSamplesInput fairlyTruncated(int maxInputChars) {
        int perChapter = maxInputChars / Math.max(chapters.size(), 1);
        int limit = Math.min(maxSampleChars, perChapter);
        List<ChapterSample> sampled = new ArrayList<>(chapters.size());
        for (ChapterSample chapter : chapters) {
            String text = chapter.text() == null ? "" : chapter.text();
            if (text.length() > limit) {
                text = text.substring(0, limit);
            }
            sampled.add(new ChapterSample(chapter.chapterIndex(), text));
        }
        return new ChapterSamplesInput(sampled, maxSampleChars);
    }

    String renderChapters() {
        StringBuilder sb = new StringBuilder();
        for (ChapterSample chapter : chapters) {
            if (sb.length() > 0) {
                sb.append("\n\n---\n\n");
            }
            sb.append("CHAPTER ").append(chapter.chapterIndex() + 1).append(":\n").append(chapter.text());
        }
        return sb.toString();
    }
}
