package org.example.analysis.service.analysis.result;

/**
 * Finished output of one analysis task, tagged with its kind so the matching
 * persister can be selected.
 */
public sealed interface AnalysisResult
        permits CharacterAnalysisResult, ForeshadowingAnalysisResult, PlotOutlineAnalysisResult, ThemeAnalysisResult {

    TaskKind kind();

    String bookId();

    /** Number of items the persister will try to store. */
    int itemCount();
}
