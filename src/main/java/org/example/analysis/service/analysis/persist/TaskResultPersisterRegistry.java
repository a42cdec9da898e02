package org.example.analysis.service.analysis.persist;

import org.example.analysis.service.analysis.result.AnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class TaskResultPersisterRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskResultPersisterRegistry.class);

    private final Map<TaskKind, TaskResultPersister<?>> persisters = new EnumMap<>(TaskKind.class);

    public TaskResultPersisterRegistry(List<TaskResultPersister<?>> persisters) {
        for (TaskResultPersister<?> persister : persisters) {
            TaskResultPersister<?> previous = this.persisters.put(persister.kind(), persister);
            if (previous != null) {
                throw new IllegalStateException("Two persisters registered for " + persister.kind() + ": "
                        + previous.getClass().getSimpleName() + " and " + persister.getClass().getSimpleName());
            }
        }
        log.info("Registered result persisters for {}", this.persisters.keySet());
    }

    public boolean supports(TaskKind kind) {
        return persisters.containsKey(kind);
    }

    public PersistResult persist(AnalysisResult result) {
        TaskResultPersister<?> persister = persisters.get(result.kind());
        if (persister == null) {
            throw new IllegalStateException("No persister registered for " + result.kind());
        }
        return persistWith(persister, result);
    }

    private <R extends AnalysisResult> PersistResult persistWith(TaskResultPersister<R> persister, AnalysisResult result) {
        PersistResult outcome = persister.persist(persister.resultType().cast(result));
        log.info("Persisted {} result for book {}: {} stored, {} failed",
                result.kind(), result.bookId(), outcome.persistedCount(), outcome.failures());
        return outcome;
    }
}
