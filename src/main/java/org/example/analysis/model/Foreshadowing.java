package org.example.analysis.model;

/**
 * A setup/payoff pair. Chapter indexes are 0-based.
 */
public record Foreshadowing(
    int setupChapter,
    String setupText,
    int payoffChapter,
    String payoffText,
    String theme,
    double confidence
) {}
