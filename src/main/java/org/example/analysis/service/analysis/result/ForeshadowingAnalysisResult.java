package org.example.analysis.service.analysis.result;

import org.example.analysis.model.Foreshadowing;

import java.util.List;

public record ForeshadowingAnalysisResult(String bookId, List<Foreshadowing> foreshadowings) implements AnalysisResult {

    @Override
    public TaskKind kind() {
        return TaskKind.FORESHADOWING;
    }

    @Override
    public int itemCount() {
        return foreshadowings.size();
    }
}
