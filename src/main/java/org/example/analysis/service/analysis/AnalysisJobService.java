package org.example.analysis.service.analysis;

import org.example.analysis.config.AnalysisProperties;
import org.example.analysis.entity.ChapterEntity;
import org.example.analysis.repository.BookRepository;
import org.example.analysis.repository.ChapterRepository;
import org.example.analysis.service.analysis.persist.PersistResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.example.analysis.service.analysis.task.AnalysisTask;
import org.example.analysis.service.analysis.task.AnalysisTaskFactory;
import org.example.analysis.service.analysis.task.BatchCompletion;
import org.example.analysis.service.analysis.task.CancellationToken;
import org.example.analysis.service.analysis.task.ChapterAnalysisTask;
import org.example.analysis.service.analysis.task.TaskProgress;
import org.example.analysis.service.analysis.task.TaskResult;
import org.example.analysis.service.analysis.task.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs analysis tasks on a fixed pool. At most one job per task key (kind, book,
 * chapter) is queued or running; submitting the same key again returns the existing
 * job. Cancellation is cooperative and never interrupts an inference call.
 */
@Service
public class AnalysisJobService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisJobService.class);

    public enum JobState {
        QUEUED,
        RUNNING,
        CANCELLING,
        CANCELLED,
        COMPLETED,
        FAILED
    }

    public record AnalysisJobStatus(
            String jobId,
            TaskKind kind,
            JobState state,
            String bookId,
            String chapterId,
            boolean cancelRequested,
            LocalDateTime createdAt,
            LocalDateTime startedAt,
            LocalDateTime completedAt,
            String message,
            String error,
            TaskProgress progress,
            PersistResult persistResult,
            Integer analyzedThroughParagraph
    ) {
    }

    private final AnalysisTaskFactory taskFactory;
    private final BookRepository bookRepository;
    private final ChapterRepository chapterRepository;
    private final Duration retention;
    private final ConcurrentHashMap<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AnalysisJob> activeJobsByKey = new ConcurrentHashMap<>();
    private final ExecutorService executorService;

    public AnalysisJobService(AnalysisTaskFactory taskFactory,
                              BookRepository bookRepository,
                              ChapterRepository chapterRepository,
                              AnalysisProperties properties) {
        this.taskFactory = taskFactory;
        this.bookRepository = bookRepository;
        this.chapterRepository = chapterRepository;
        this.retention = properties.getJobs().getRetention();
        this.executorService = Executors.newFixedThreadPool(
                Math.max(1, properties.getJobs().getMaxConcurrent()),
                new AnalysisJobThreadFactory());
    }

    /**
     * @param maxParagraphs analyze only this many leading paragraphs, or the whole chapter when null
     * @throws IllegalArgumentException if the chapter does not exist
     */
    public AnalysisJobStatus startChapterJob(String chapterId, Integer maxParagraphs) {
        AnalysisTask task = taskFactory.createChapterTask(chapterId, maxParagraphs, this::onBatchComplete);
        return submit(task, chapterId);
    }

    /**
     * Starts one character analysis job per chapter of the book, in chapter order.
     *
     * @throws IllegalArgumentException if the book does not exist
     */
    public List<AnalysisJobStatus> startBookChapterJobs(String bookId) {
        if (!bookRepository.existsById(bookId)) {
            throw new IllegalArgumentException("Book not found: " + bookId);
        }
        List<AnalysisJobStatus> statuses = new ArrayList<>();
        for (ChapterEntity chapter : chapterRepository.findByBookIdOrderByChapterIndex(bookId)) {
            statuses.add(startChapterJob(chapter.getId(), null));
        }
        return statuses;
    }

    /**
     * @throws IllegalArgumentException if the book does not exist or the kind is not book-level
     */
    public AnalysisJobStatus startInsightJob(String bookId, TaskKind kind) {
        AnalysisTask task = taskFactory.createInsightTask(bookId, kind);
        return submit(task, null);
    }

    public Optional<AnalysisJobStatus> getJobStatus(String jobId) {
        AnalysisJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        return Optional.of(toStatus(job));
    }

    public Optional<AnalysisJobStatus> cancelJob(String jobId) {
        AnalysisJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }

        job.cancellationToken.cancel();
        synchronized (job) {
            JobState currentState = job.state;
            if (isTerminalState(currentState)) {
                return Optional.of(toStatus(job));
            }
            if (currentState == JobState.QUEUED) {
                markCancelled(job, "Job cancelled");
                activeJobsByKey.remove(job.task.taskKey(), job);
            } else {
                job.state = JobState.CANCELLING;
                job.message = "Cancellation requested; stopping after the current batch";
            }
        }
        return Optional.of(toStatus(job));
    }

    public long countJobs(JobState state) {
        return jobs.values().stream().filter(job -> job.state == state).count();
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }

    private AnalysisJobStatus submit(AnalysisTask task, String chapterId) {
        pruneFinishedJobs();

        AnalysisJob candidate = new AnalysisJob(UUID.randomUUID().toString(), task, chapterId);
        AnalysisJob existing = activeJobsByKey.putIfAbsent(task.taskKey(), candidate);
        if (existing != null) {
            log.info("Job {} already active for {}, not starting another", existing.jobId, task.taskKey());
            return toStatus(existing);
        }

        jobs.put(candidate.jobId, candidate);
        executorService.submit(() -> runJob(candidate));
        log.info("Queued analysis job {} for {}", candidate.jobId, task.taskKey());
        return toStatus(candidate);
    }

    private void runJob(AnalysisJob job) {
        try {
            synchronized (job) {
                if (job.cancellationToken.isCancelled() || isTerminalState(job.state)) {
                    markCancelled(job, "Job cancelled before execution");
                    return;
                }
                job.state = JobState.RUNNING;
                job.startedAt = LocalDateTime.now();
                job.message = "Job running";
            }

            TaskResult result = job.task.execute(job.cancellationToken, progress -> onProgress(job, progress));
            job.persistResult = result.persistResult();

            synchronized (job) {
                switch (result.state()) {
                    case DONE -> {
                        job.state = JobState.COMPLETED;
                        job.completedAt = LocalDateTime.now();
                        job.message = firstNonBlank(result.message(), "Analysis completed");
                    }
                    case CANCELLED -> markCancelled(job, firstNonBlank(result.message(), "Job cancelled"));
                    default -> markFailed(job, result.message());
                }
            }
        } catch (Exception ex) {
            log.error("Analysis job {} failed", job.jobId, ex);
            synchronized (job) {
                markFailed(job, safeErrorMessage(ex));
            }
        } finally {
            activeJobsByKey.remove(job.task.taskKey(), job);
        }
    }

    private void onProgress(AnalysisJob job, TaskProgress progress) {
        job.progress = progress;
        if (job.state == JobState.RUNNING && !progress.state().isTerminal()) {
            job.message = progress.message();
        }
    }

    private void onBatchComplete(BatchCompletion completion) {
        AnalysisJob job = activeJobsByKey.get(ChapterAnalysisTask.taskKey(completion.bookId(), completion.chapterId()));
        if (job != null) {
            job.analyzedThroughParagraph = completion.lastParagraphIndex();
        }
    }

    private void markCancelled(AnalysisJob job, String message) {
        if (isTerminalState(job.state)) {
            return;
        }
        job.state = JobState.CANCELLED;
        job.completedAt = LocalDateTime.now();
        job.message = message;
    }

    private void markFailed(AnalysisJob job, String errorMessage) {
        job.state = JobState.FAILED;
        job.completedAt = LocalDateTime.now();
        job.error = firstNonBlank(errorMessage, "Analysis failed");
        TaskProgress last = job.progress;
        job.message = last != null && last.state() == TaskState.FAILED ? last.message() : "Analysis failed";
    }

    private void pruneFinishedJobs() {
        LocalDateTime cutoff = LocalDateTime.now().minus(retention);
        jobs.values().removeIf(job -> isTerminalState(job.state)
                && job.completedAt != null
                && job.completedAt.isBefore(cutoff));
    }

    private boolean isTerminalState(JobState state) {
        return state == JobState.COMPLETED || state == JobState.FAILED || state == JobState.CANCELLED;
    }

    private String safeErrorMessage(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    private String firstNonBlank(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private AnalysisJobStatus toStatus(AnalysisJob job) {
        return new AnalysisJobStatus(
                job.jobId,
                job.task.kind(),
                job.state,
                job.task.bookId(),
                job.chapterId,
                job.cancellationToken.isCancelled(),
                job.createdAt,
                job.startedAt,
                job.completedAt,
                job.message,
                job.error,
                job.progress,
                job.persistResult,
                job.analyzedThroughParagraph
        );
    }

    private static final class AnalysisJob {
        private final String jobId;
        private final AnalysisTask task;
        private final String chapterId;
        private final LocalDateTime createdAt;
        private final CancellationToken cancellationToken = new CancellationToken();

        private volatile JobState state;
        private volatile LocalDateTime startedAt;
        private volatile LocalDateTime completedAt;
        private volatile String message;
        private volatile String error;
        private volatile TaskProgress progress;
        private volatile PersistResult persistResult;
        private volatile Integer analyzedThroughParagraph;

        private AnalysisJob(String jobId, AnalysisTask task, String chapterId) {
            this.jobId = jobId;
            this.task = task;
            this.chapterId = chapterId;
            this.createdAt = LocalDateTime.now();
            this.state = JobState.QUEUED;
            this.message = "Job queued";
        }
    }

    private static final class AnalysisJobThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "analysis-job-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
