package org.example.analysis.service.analysis.result;

import org.example.analysis.service.analysis.prompt.ThemeAnalysisOutput;

public record ThemeAnalysisResult(String bookId, ThemeAnalysisOutput theme) implements AnalysisResult {

    @Override
    public TaskKind kind() {
        return TaskKind.THEME;
    }

    @Override
    public int itemCount() {
        return 1;
    }
}
