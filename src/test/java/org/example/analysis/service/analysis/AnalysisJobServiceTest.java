package org.example.analysis.service.analysis;

import org.example.analysis.config.AnalysisProperties;
import org.example.analysis.entity.ChapterEntity;
import org.example.analysis.repository.BookRepository;
import org.example.analysis.repository.ChapterRepository;
import org.example.analysis.service.analysis.AnalysisJobService.AnalysisJobStatus;
import org.example.analysis.service.analysis.AnalysisJobService.JobState;
import org.example.analysis.service.analysis.persist.PersistResult;
import org.example.analysis.service.analysis.prompt.ThemeAnalysisInput;
import org.example.analysis.service.analysis.prompt.ThemeAnalysisOutput;
import org.example.analysis.service.analysis.result.TaskKind;
import org.example.analysis.service.analysis.task.AnalysisTask;
import org.example.analysis.service.analysis.task.AnalysisTaskFactory;
import org.example.analysis.service.analysis.task.BatchCompletion;
import org.example.analysis.service.analysis.task.BookInsightTask;
import org.example.analysis.service.analysis.task.CancellationToken;
import org.example.analysis.service.analysis.task.ChapterAnalysisTask;
import org.example.analysis.service.analysis.task.TaskProgress;
import org.example.analysis.service.analysis.task.TaskResult;
import org.example.analysis.service.analysis.task.TaskState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisJobServiceTest {

    @Mock
    private AnalysisTaskFactory taskFactory;
    @Mock
    private BookRepository bookRepository;
    @Mock
    private ChapterRepository chapterRepository;
    @Mock
    private ChapterAnalysisTask chapterTask;
    @Mock
    private ChapterAnalysisTask otherChapterTask;
    @Mock
    private BookInsightTask<ThemeAnalysisInput, ThemeAnalysisOutput> themeTask;

    private AnalysisJobService analysisJobService;

    @BeforeEach
    void setUp() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.getJobs().setMaxConcurrent(1);
        analysisJobService = new AnalysisJobService(taskFactory, bookRepository, chapterRepository, properties);

        describe(chapterTask, TaskKind.CHARACTERS, "CHARACTERS:book-1:chapter-1");
        describe(otherChapterTask, TaskKind.CHARACTERS, "CHARACTERS:book-1:chapter-2");
        describe(themeTask, TaskKind.THEME, "THEME:book-1");
    }

    @AfterEach
    void tearDown() {
        analysisJobService.shutdown();
    }

    @Test
    void startChapterJob_returnsImmediatelyAndEventuallyCompletes() throws Exception {
        when(taskFactory.createChapterTask(eq("chapter-1"), isNull(), any())).thenReturn(chapterTask);
        when(chapterTask.execute(any(), any())).thenAnswer(invocation -> {
            Consumer<TaskProgress> listener = invocation.getArgument(1);
            listener.accept(new TaskProgress(TaskState.BATCH_PROCESSING, "Analyzing batch 3 of 3", 2, 3, false));
            return TaskResult.done("Analyzed 2 characters in 3 batches", null, new PersistResult(2, 0), false);
        });

        AnalysisJobStatus started = analysisJobService.startChapterJob("chapter-1", null);

        assertNotNull(started.jobId());
        assertEquals("chapter-1", started.chapterId());
        assertEquals(TaskKind.CHARACTERS, started.kind());

        AnalysisJobStatus completed = waitForTerminalState(started.jobId(), 3_000L);
        assertEquals(JobState.COMPLETED, completed.state());
        assertEquals("Analyzed 2 characters in 3 batches", completed.message());
        assertEquals(2, completed.persistResult().persistedCount());
        assertEquals(3, completed.progress().totalBatches());
        assertNotNull(completed.startedAt());
        assertNotNull(completed.completedAt());
        assertEquals(1, analysisJobService.countJobs(JobState.COMPLETED));
    }

    @Test
    void startChapterJob_withParagraphLimit_reportsLastAnalyzedParagraph() throws Exception {
        AtomicReference<Consumer<BatchCompletion>> batchListener = new AtomicReference<>();
        when(taskFactory.createChapterTask(eq("chapter-1"), eq(40), any())).thenAnswer(invocation -> {
            batchListener.set(invocation.getArgument(2));
            return chapterTask;
        });
        when(chapterTask.execute(any(), any())).thenAnswer(invocation -> {
            batchListener.get().accept(new BatchCompletion("book-1", "chapter-1", 1, 2, 0, 17, List.of()));
            batchListener.get().accept(new BatchCompletion("book-1", "chapter-1", 2, 2, 18, 39, List.of()));
            return TaskResult.done("Analyzed 0 characters in 2 batches from the first 40 of 90 paragraphs",
                    null, PersistResult.empty(), false);
        });

        AnalysisJobStatus started = analysisJobService.startChapterJob("chapter-1", 40);

        AnalysisJobStatus completed = waitForTerminalState(started.jobId(), 3_000L);
        assertEquals(JobState.COMPLETED, completed.state());
        assertEquals(39, completed.analyzedThroughParagraph().intValue());
    }

    @Test
    void startChapterJob_sameChapterWhileActive_returnsExistingJob() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(taskFactory.createChapterTask(eq("chapter-1"), isNull(), any())).thenReturn(chapterTask);
        when(chapterTask.execute(any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return TaskResult.done("done", null, PersistResult.empty(), false);
        });

        AnalysisJobStatus first = analysisJobService.startChapterJob("chapter-1", null);
        AnalysisJobStatus second = analysisJobService.startChapterJob("chapter-1", null);

        assertEquals(first.jobId(), second.jobId());
        release.countDown();
        assertEquals(JobState.COMPLETED, waitForTerminalState(first.jobId(), 3_000L).state());
        verify(chapterTask).execute(any(), any());
    }

    @Test
    void cancelJob_runningJob_stopsCooperatively() throws Exception {
        when(taskFactory.createChapterTask(eq("chapter-1"), isNull(), any())).thenReturn(chapterTask);
        when(chapterTask.execute(any(), any())).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(0);
            long deadline = System.currentTimeMillis() + 5_000L;
            while (!token.isCancelled() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            return TaskResult.cancelled("Cancelled after 1 batches", false);
        });

        AnalysisJobStatus started = analysisJobService.startChapterJob("chapter-1", null);
        waitForRunning(started.jobId(), 2_000L);

        Optional<AnalysisJobStatus> cancelled = analysisJobService.cancelJob(started.jobId());
        assertTrue(cancelled.isPresent());
        assertTrue(cancelled.get().cancelRequested());

        AnalysisJobStatus terminal = waitForTerminalState(started.jobId(), 3_000L);
        assertEquals(JobState.CANCELLED, terminal.state());
        assertEquals("Cancelled after 1 batches", terminal.message());
    }

    @Test
    void cancelJob_queuedJob_neverRuns() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(taskFactory.createChapterTask(eq("chapter-1"), isNull(), any())).thenReturn(chapterTask);
        when(taskFactory.createChapterTask(eq("chapter-2"), isNull(), any())).thenReturn(otherChapterTask);
        when(chapterTask.execute(any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return TaskResult.done("done", null, PersistResult.empty(), false);
        });

        AnalysisJobStatus running = analysisJobService.startChapterJob("chapter-1", null);
        waitForRunning(running.jobId(), 2_000L);
        AnalysisJobStatus queued = analysisJobService.startChapterJob("chapter-2", null);
        assertEquals(JobState.QUEUED, queued.state());

        AnalysisJobStatus cancelled = analysisJobService.cancelJob(queued.jobId()).orElseThrow();
        assertEquals(JobState.CANCELLED, cancelled.state());

        release.countDown();
        waitForTerminalState(running.jobId(), 3_000L);
        assertEquals(JobState.CANCELLED, analysisJobService.getJobStatus(queued.jobId()).orElseThrow().state());
        verify(otherChapterTask, never()).execute(any(), any());
    }

    @Test
    void failedTask_reportsLastProgressMessageAndError() throws Exception {
        when(taskFactory.createChapterTask(eq("chapter-1"), isNull(), any())).thenReturn(chapterTask);
        when(chapterTask.execute(any(), any())).thenAnswer(invocation -> {
            Consumer<TaskProgress> listener = invocation.getArgument(1);
            listener.accept(new TaskProgress(TaskState.FAILED, "Analysis paused; will resume from checkpoint", 1, 3, false));
            return TaskResult.failed("Ollama request timed out", false);
        });

        AnalysisJobStatus started = analysisJobService.startChapterJob("chapter-1", null);

        AnalysisJobStatus failed = waitForTerminalState(started.jobId(), 3_000L);
        assertEquals(JobState.FAILED, failed.state());
        assertEquals("Ollama request timed out", failed.error());
        assertEquals("Analysis paused; will resume from checkpoint", failed.message());
    }

    @Test
    void taskThrowing_marksJobFailed() throws Exception {
        when(taskFactory.createChapterTask(eq("chapter-1"), isNull(), any())).thenReturn(chapterTask);
        when(chapterTask.execute(any(), any())).thenThrow(new IllegalStateException("boom"));

        AnalysisJobStatus started = analysisJobService.startChapterJob("chapter-1", null);

        AnalysisJobStatus failed = waitForTerminalState(started.jobId(), 3_000L);
        assertEquals(JobState.FAILED, failed.state());
        assertEquals("boom", failed.error());
        assertEquals("Analysis failed", failed.message());
    }

    @Test
    void startBookChapterJobs_startsOneJobPerChapter() throws Exception {
        ChapterEntity first = chapter("chapter-1", 0);
        ChapterEntity second = chapter("chapter-2", 1);
        when(bookRepository.existsById("book-1")).thenReturn(true);
        when(chapterRepository.findByBookIdOrderByChapterIndex("book-1")).thenReturn(List.of(first, second));
        when(taskFactory.createChapterTask(eq("chapter-1"), isNull(), any())).thenReturn(chapterTask);
        when(taskFactory.createChapterTask(eq("chapter-2"), isNull(), any())).thenReturn(otherChapterTask);
        when(chapterTask.execute(any(), any())).thenReturn(TaskResult.done("done", null, PersistResult.empty(), false));
        when(otherChapterTask.execute(any(), any())).thenReturn(TaskResult.done("done", null, PersistResult.empty(), false));

        List<AnalysisJobStatus> started = analysisJobService.startBookChapterJobs("book-1");

        assertEquals(2, started.size());
        assertEquals("chapter-1", started.get(0).chapterId());
        assertEquals("chapter-2", started.get(1).chapterId());
        for (AnalysisJobStatus status : started) {
            assertEquals(JobState.COMPLETED, waitForTerminalState(status.jobId(), 3_000L).state());
        }
    }

    @Test
    void startBookChapterJobs_unknownBook_throws() {
        when(bookRepository.existsById("missing")).thenReturn(false);

        assertThrows(IllegalArgumentException.class, () -> analysisJobService.startBookChapterJobs("missing"));
    }

    @Test
    void startInsightJob_runsBookLevelTask() throws Exception {
        doReturn(themeTask).when(taskFactory).createInsightTask("book-1", TaskKind.THEME);
        when(themeTask.execute(any(), any()))
                .thenReturn(TaskResult.done("Theme Analysis: 1 items saved", null, new PersistResult(1, 0), false));

        AnalysisJobStatus started = analysisJobService.startInsightJob("book-1", TaskKind.THEME);

        assertEquals(TaskKind.THEME, started.kind());
        assertNull(started.chapterId());
        assertEquals(JobState.COMPLETED, waitForTerminalState(started.jobId(), 3_000L).state());
    }

    @Test
    void startChapterJob_unknownChapter_propagates() {
        when(taskFactory.createChapterTask(eq("missing"), isNull(), any()))
                .thenThrow(new IllegalArgumentException("Chapter not found: missing"));

        assertThrows(IllegalArgumentException.class, () -> analysisJobService.startChapterJob("missing", null));
    }

    @Test
    void unknownJob_returnsEmpty() {
        assertTrue(analysisJobService.getJobStatus("missing-job").isEmpty());
        assertTrue(analysisJobService.cancelJob("missing-job").isEmpty());
    }

    private static void describe(AnalysisTask task, TaskKind kind, String taskKey) {
        lenient().when(task.kind()).thenReturn(kind);
        lenient().when(task.bookId()).thenReturn("book-1");
        lenient().when(task.taskKey()).thenReturn(taskKey);
    }

    private static ChapterEntity chapter(String id, int index) {
        ChapterEntity chapter = new ChapterEntity(index, "Chapter " + (index + 1));
        chapter.setId(id);
        return chapter;
    }

    private void waitForRunning(String jobId, long timeoutMillis) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            AnalysisJobStatus status = analysisJobService.getJobStatus(jobId).orElseThrow();
            if (status.state() != JobState.QUEUED) {
                return;
            }
            Thread.sleep(20L);
        }
        fail("Timed out waiting for job to start running");
    }

    private AnalysisJobStatus waitForTerminalState(String jobId, long timeoutMillis) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        AnalysisJobStatus latest = null;
        while (System.currentTimeMillis() < deadline) {
            latest = analysisJobService.getJobStatus(jobId).orElseThrow();
            if (latest.state() == JobState.COMPLETED
                    || latest.state() == JobState.FAILED
                    || latest.state() == JobState.CANCELLED) {
                return latest;
            }
            Thread.sleep(20L);
        }
        fail("Timed out waiting for job to complete, last state=" + (latest != null ? latest.state() : "none"));
        return latest;
    }
}
