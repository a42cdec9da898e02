package org.example.analysis.service.analysis.result;

import org.example.analysis.model.PlotPoint;

import java.util.List;

public record PlotOutlineAnalysisResult(String bookId, List<PlotPoint> plotPoints) implements AnalysisResult {

    @Override
    public TaskKind kind() {
        return TaskKind.PLOT_OUTLINE;
    }

    @Override
    public int itemCount() {
        return plotPoints.size();
    }
}
