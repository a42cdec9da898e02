package org.example.analysis.service.analysis.task;

import org.example.analysis.service.analysis.persist.PersistResult;
import org.example.analysis.service.analysis.result.AnalysisResult;

/**
 * Final outcome of one task run.
 */
public record TaskResult(
    TaskState state,
    String message,
    AnalysisResult result,
    PersistResult persistResult,
    boolean resumed
) {

    public static TaskResult done(String message, AnalysisResult result, PersistResult persistResult, boolean resumed) {
        return new TaskResult(TaskState.DONE, message, result, persistResult, resumed);
    }

    public static TaskResult failed(String message, boolean resumed) {
        return new TaskResult(TaskState.FAILED, message, null, null, resumed);
    }

    public static TaskResult failed(String message, AnalysisResult result, PersistResult persistResult, boolean resumed) {
        return new TaskResult(TaskState.FAILED, message, result, persistResult, resumed);
    }

    public static TaskResult cancelled(String message, boolean resumed) {
        return new TaskResult(TaskState.CANCELLED, message, null, null, resumed);
    }

    public boolean isSuccess() {
        return state == TaskState.DONE;
    }
}
