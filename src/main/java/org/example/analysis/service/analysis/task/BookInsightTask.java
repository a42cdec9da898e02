package org.example.analysis.service.analysis.task;

import org.example.analysis.service.analysis.persist.PersistResult;
import org.example.analysis.service.analysis.persist.TaskResultPersisterRegistry;
import org.example.analysis.service.analysis.prompt.PromptDefinition;
import org.example.analysis.service.analysis.result.AnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Book-level analysis made of a single budgeted call (foreshadowing, plot outline,
 * theme). No checkpoint is kept; a failed run simply starts over.
 *
 * @param <I> prompt input type
 * @param <O> prompt output type
 */
public class BookInsightTask<I, O> implements AnalysisTask {

    private static final Logger log = LoggerFactory.getLogger(BookInsightTask.class);

    private final TaskKind kind;
    private final String bookId;
    private final Supplier<I> inputLoader;
    private final PromptDefinition<I, O> prompt;
    private final Function<O, AnalysisResult> resultMapper;
    private final InferenceRetrier inferenceRetrier;
    private final TaskResultPersisterRegistry persisterRegistry;

    public BookInsightTask(TaskKind kind,
                           String bookId,
                           Supplier<I> inputLoader,
                           PromptDefinition<I, O> prompt,
                           Function<O, AnalysisResult> resultMapper,
                           InferenceRetrier inferenceRetrier,
                           TaskResultPersisterRegistry persisterRegistry) {
        this.kind = kind;
        this.bookId = bookId;
        this.inputLoader = inputLoader;
        this.prompt = prompt;
        this.resultMapper = resultMapper;
        this.inferenceRetrier = inferenceRetrier;
        this.persisterRegistry = persisterRegistry;
    }

    @Override
    public TaskKind kind() {
        return kind;
    }

    @Override
    public String bookId() {
        return bookId;
    }

    @Override
    public String taskKey() {
        return kind + ":" + bookId;
    }

    @Override
    public TaskResult execute(CancellationToken cancellationToken, Consumer<TaskProgress> progressListener) {
        ProgressReporter progress = new ProgressReporter(progressListener);
        progress.totalBatches = 1;
        progress.report(TaskState.START, "Starting " + prompt.displayName());

        AnalysisResult result;
        try {
            I input = prompt.prepareInput(inputLoader.get());
            if (cancellationToken.isCancelled()) {
                progress.report(TaskState.CANCELLED, "Cancelled");
                return TaskResult.cancelled("Cancelled before analysis", false);
            }

            progress.report(TaskState.BATCH_PROCESSING, "Running " + prompt.displayName());
            String response = inferenceRetrier.generate(
                    prompt.buildFullPrompt(input), prompt.llmOptions(), prompt.displayName() + " for book " + bookId);
            O output = prompt.parseResponse(response);
            progress.batchesCompleted = 1;

            progress.report(TaskState.FINALIZE, "Finalizing " + prompt.displayName());
            result = resultMapper.apply(output);
        } catch (RuntimeException e) {
            log.error("{} failed for book {}", prompt.displayName(), bookId, e);
            progress.report(TaskState.FAILED, prompt.displayName() + " failed");
            return TaskResult.failed(e.getMessage(), false);
        }

        progress.report(TaskState.PERSIST, "Saving " + prompt.displayName());
        PersistResult persistResult;
        try {
            persistResult = persisterRegistry.persist(result);
        } catch (RuntimeException e) {
            log.error("Persisting {} failed for book {}", kind, bookId, e);
            progress.report(TaskState.FAILED, "Saving failed");
            return TaskResult.failed(e.getMessage(), result, null, false);
        }
        if (persistResult.isTotalFailure()) {
            progress.report(TaskState.FAILED, "Saving failed");
            return TaskResult.failed("All " + persistResult.failures() + " items failed to persist",
                    result, persistResult, false);
        }

        String message = prompt.displayName() + ": " + persistResult.persistedCount() + " items saved";
        progress.report(TaskState.DONE, message);
        log.info("Book {}: {}", bookId, message);
        return TaskResult.done(message, result, persistResult, false);
    }
}
