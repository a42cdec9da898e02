package org.example.analysis.service.analysis.prompt;

import org.example.analysis.model.PlotPoint;

import java.util.List;

public record PlotPointOutput(List<PlotPoint> plotPoints) {

    public static PlotPointOutput empty() {
        return new PlotPointOutput(List.of());
    }
}
