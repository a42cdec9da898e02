package org.example.analysis.service.analysis.checkpoint;

/**
 * Outcome of a best-effort checkpoint write. A failed write is never thrown; the
 * diagnostic says why it was discarded.
 */
public record CheckpointWriteResult(boolean success, String diagnostic) {

    public static CheckpointWriteResult ok() {
        return new CheckpointWriteResult(true, null);
    }

    public static CheckpointWriteResult failed(String diagnostic) {
        return new CheckpointWriteResult(false, diagnostic);
    }
}
