package org.example.analysis.service.analysis.prompt;

/**
 * Text sample of one chapter; {@code chapterIndex} is 0-based.
 */
public record ChapterSample(int chapterIndex, String text) {}
