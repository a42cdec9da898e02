package org.example.analysis.service.analysis.task;

public enum TaskState {
    START,
    RESUME_CHECK,
    BATCH_PROCESSING,
    FINALIZE,
    PERSIST,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
