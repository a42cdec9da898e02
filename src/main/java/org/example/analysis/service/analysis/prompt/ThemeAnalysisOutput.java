package org.example.analysis.service.analysis.prompt;

/**
 * Book theme. {@code parsed} is false when the model reply could not be read and
 * every field holds its default.
 */
public record ThemeAnalysisOutput(
    String mood,
    String genre,
    String era,
    String emotionalTone,
    String ambientSound,
    boolean parsed
) {
    public static final String DEFAULT_MOOD = "classic";
    public static final String DEFAULT_GENRE = "modern_fiction";
    public static final String DEFAULT_ERA = "contemporary";
    public static final String DEFAULT_EMOTIONAL_TONE = "neutral";

    public ThemeAnalysisOutput(String mood, String genre, String era, String emotionalTone, String ambientSound) {
        this(mood, genre, era, emotionalTone, ambientSound, true);
    }

    public static ThemeAnalysisOutput defaults() {
        return new ThemeAnalysisOutput(DEFAULT_MOOD, DEFAULT_GENRE, DEFAULT_ERA, DEFAULT_EMOTIONAL_TONE, null, false);
    }
}
