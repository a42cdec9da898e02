package org.example.analysis.service.analysis.checkpoint;

/**
 * Common identity and validity fields of a persisted progress snapshot.
 */
public interface AnalysisCheckpoint {

    String bookId();

    String chapterId();

    String contentHash();

    /** Epoch millis of the save. */
    long timestamp();
}
