package org.example.analysis.model;

public record PlotPoint(
    PlotPointType type,
    int chapterIndex,
    String description,
    double confidence
) {}
