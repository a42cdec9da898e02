package org.example.analysis.service.analysis.persist;

import org.example.analysis.service.analysis.result.AnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;

/**
 * Commits a finished analysis result to the database. Implementations update or
 * insert by an identity key within the book, so persisting the same result twice
 * leaves the same rows. A failing item is logged and skipped.
 */
public interface TaskResultPersister<R extends AnalysisResult> {

    TaskKind kind();

    Class<R> resultType();

    PersistResult persist(R result);
}
