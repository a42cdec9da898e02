package org.example.analysis.service.analysis.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Tracks batch counters for a running task and forwards snapshots to an optional listener.
 */
final class ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final Consumer<TaskProgress> listener;
    boolean resumed;
    int batchesCompleted;
    int totalBatches;

    ProgressReporter(Consumer<TaskProgress> listener) {
        this.listener = listener;
    }

    void report(TaskState state, String message) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(new TaskProgress(state, message, batchesCompleted, totalBatches, resumed));
        } catch (RuntimeException e) {
            log.debug("Progress listener failed: {}", e.getMessage());
        }
    }
}
