package org.example.analysis.service.analysis.persist;

import org.example.analysis.service.analysis.prompt.ThemeAnalysisOutput;
import org.example.analysis.service.analysis.result.ForeshadowingAnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.example.analysis.service.analysis.result.ThemeAnalysisResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskResultPersisterRegistryTest {

    @Mock
    private TaskResultPersister<ThemeAnalysisResult> themePersister;

    @Mock
    private TaskResultPersister<ThemeAnalysisResult> otherThemePersister;

    @Test
    void persist_dispatchesByKind() {
        when(themePersister.kind()).thenReturn(TaskKind.THEME);
        when(themePersister.resultType()).thenReturn(ThemeAnalysisResult.class);
        ThemeAnalysisResult result = new ThemeAnalysisResult("book-1", ThemeAnalysisOutput.defaults());
        when(themePersister.persist(result)).thenReturn(new PersistResult(1, 0));
        TaskResultPersisterRegistry registry = new TaskResultPersisterRegistry(List.of(themePersister));

        PersistResult outcome = registry.persist(result);

        assertEquals(1, outcome.persistedCount());
        verify(themePersister).persist(result);
        assertTrue(registry.supports(TaskKind.THEME));
        assertFalse(registry.supports(TaskKind.CHARACTERS));
    }

    @Test
    void persist_unregisteredKind_throws() {
        when(themePersister.kind()).thenReturn(TaskKind.THEME);
        TaskResultPersisterRegistry registry = new TaskResultPersisterRegistry(List.of(themePersister));

        assertThrows(IllegalStateException.class,
                () -> registry.persist(new ForeshadowingAnalysisResult("book-1", List.of())));
    }

    @Test
    void constructor_duplicateKind_throws() {
        when(themePersister.kind()).thenReturn(TaskKind.THEME);
        when(otherThemePersister.kind()).thenReturn(TaskKind.THEME);

        assertThrows(IllegalStateException.class,
                () -> new TaskResultPersisterRegistry(List.of(themePersister, otherThemePersister)));
    }

    @Test
    void persistResult_totalFailureNeedsAttemptedItems() {
        assertTrue(new PersistResult(0, 2).isTotalFailure());
        assertFalse(new PersistResult(1, 2).isTotalFailure());
        assertFalse(PersistResult.empty().isTotalFailure());
    }
}
