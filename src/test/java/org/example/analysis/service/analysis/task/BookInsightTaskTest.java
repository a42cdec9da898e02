package org.example.analysis.service.analysis.task;

import org.example.analysis.service.analysis.persist.PersistResult;
import org.example.analysis.service.analysis.persist.TaskResultPersisterRegistry;
import org.example.analysis.service.analysis.prompt.ThemeAnalysisInput;
import org.example.analysis.service.analysis.prompt.ThemeAnalysisOutput;
import org.example.analysis.service.analysis.prompt.ThemeAnalysisPrompt;
import org.example.analysis.service.analysis.result.AnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.example.analysis.service.analysis.result.ThemeAnalysisResult;
import org.example.analysis.service.llm.LlmProvider;
import org.example.analysis.service.llm.LlmProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookInsightTaskTest {

    @Mock
    private LlmProvider llmProvider;

    @Mock
    private TaskResultPersisterRegistry persisterRegistry;

    private InferenceRetrier retrier;
    private final List<TaskProgress> progress = new ArrayList<>();

    @BeforeEach
    void setUp() {
        retrier = new InferenceRetrier(llmProvider,
                new RetryPolicy(2, Duration.ofMillis(1), 2.0, Duration.ofMillis(2)), duration -> { });
    }

    @Test
    void execute_runsOneCallAndPersistsMappedResult() {
        when(llmProvider.generate(anyString(), any())).thenReturn(
                "{\"mood\": \"romantic\", \"genre\": \"romance\", \"era\": \"historical\", \"emotional_tone\": \"uplifting\"}");
        when(persisterRegistry.persist(any())).thenReturn(new PersistResult(1, 0));

        TaskResult result = themeTask(() -> new ThemeAnalysisInput("Emma", "Emma Woodhouse, handsome, clever, and rich", 3000))
                .execute(new CancellationToken(), progress::add);

        assertEquals(TaskState.DONE, result.state());
        ArgumentCaptor<AnalysisResult> captor = ArgumentCaptor.forClass(AnalysisResult.class);
        verify(persisterRegistry).persist(captor.capture());
        ThemeAnalysisResult persisted = (ThemeAnalysisResult) captor.getValue();
        assertEquals("book-1", persisted.bookId());
        assertEquals("romantic", persisted.theme().mood());
        assertEquals(TaskState.DONE, progress.get(progress.size() - 1).state());
        assertEquals(1, progress.get(progress.size() - 1).batchesCompleted());
    }

    @Test
    void execute_unparseableResponse_persistsDefaults() {
        when(llmProvider.generate(anyString(), any())).thenReturn("I am not sure about this book.");
        when(persisterRegistry.persist(any())).thenReturn(new PersistResult(1, 0));

        TaskResult result = themeTask(() -> new ThemeAnalysisInput("Emma", "text", 3000))
                .execute(new CancellationToken(), null);

        assertEquals(TaskState.DONE, result.state());
        assertEquals(ThemeAnalysisOutput.defaults(), ((ThemeAnalysisResult) result.result()).theme());
    }

    @Test
    void execute_providerFailure_failsWithoutPersisting() {
        when(llmProvider.generate(anyString(), any())).thenThrow(new LlmProviderException("no api key"));

        TaskResult result = themeTask(() -> new ThemeAnalysisInput("Emma", "text", 3000))
                .execute(new CancellationToken(), null);

        assertEquals(TaskState.FAILED, result.state());
        assertEquals("no api key", result.message());
        verify(persisterRegistry, never()).persist(any());
    }

    @Test
    void execute_cancelledBeforeCall_doesNotCallModel() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        TaskResult result = themeTask(() -> new ThemeAnalysisInput("Emma", "text", 3000)).execute(token, null);

        assertEquals(TaskState.CANCELLED, result.state());
        verifyNoInteractions(llmProvider, persisterRegistry);
    }

    @Test
    void execute_inputLoaderFailure_fails() {
        TaskResult result = themeTask(() -> {
            throw new IllegalStateException("Book book-1 has no chapters");
        }).execute(new CancellationToken(), null);

        assertEquals(TaskState.FAILED, result.state());
        assertTrue(result.message().contains("no chapters"));
        verifyNoInteractions(llmProvider);
    }

    @Test
    void execute_persistFailure_fails() {
        when(llmProvider.generate(anyString(), any())).thenReturn("{\"mood\": \"mystery\"}");
        when(persisterRegistry.persist(any())).thenReturn(new PersistResult(0, 1));

        TaskResult result = themeTask(() -> new ThemeAnalysisInput("Emma", "text", 3000))
                .execute(new CancellationToken(), null);

        assertEquals(TaskState.FAILED, result.state());
        assertEquals(1, result.persistResult().failures());
    }

    @Test
    void taskKey_isKindAndBook() {
        assertEquals("THEME:book-1", themeTask(() -> null).taskKey());
    }

    private BookInsightTask<ThemeAnalysisInput, ThemeAnalysisOutput> themeTask(Supplier<ThemeAnalysisInput> loader) {
        return new BookInsightTask<>(TaskKind.THEME, "book-1", loader, new ThemeAnalysisPrompt(),
                output -> new ThemeAnalysisResult("book-1", output), retrier, persisterRegistry);
    }
}
