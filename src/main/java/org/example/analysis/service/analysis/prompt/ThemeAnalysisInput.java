package org.example.analysis.service.analysis.prompt;

public record ThemeAnalysisInput(String title, String firstChapterText, int maxSampleChars) {

    public static final int DEFAULT_MAX_SAMPLE_CHARS = 3000;
}
