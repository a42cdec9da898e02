package org.example.analysis.model;

/**
 * A line of dialog attributed to a character. {@code pageNumber} is the paragraph
 * position inside the chapter.
 */
public record DialogEntry(
    int pageNumber,
    String text,
    String emotion,
    double intensity
) {}
