package org.example.analysis.service.analysis.task;

import org.example.analysis.service.analysis.result.TaskKind;

import java.util.function.Consumer;

/**
 * One unit of analysis work. Only one instance per {@link #taskKey()} may run at a
 * time; callers enforce that.
 */
public interface AnalysisTask {

    TaskKind kind();

    String bookId();

    /** Exclusivity key, e.g. {@code CHARACTERS:<bookId>:<chapterId>}. */
    String taskKey();

    TaskResult execute(CancellationToken cancellationToken, Consumer<TaskProgress> progressListener);
}
