package org.example.analysis.service.analysis.task;

public record TaskProgress(
    TaskState state,
    String message,
    int batchesCompleted,
    int totalBatches,
    boolean resumed
) {}
