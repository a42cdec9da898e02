package org.example.analysis.service.analysis.task;

import org.example.analysis.entity.ParagraphEntity;
import org.example.analysis.model.AccumulatedCharacterData;
import org.example.analysis.model.DialogEntry;
import org.example.analysis.repository.ParagraphRepository;
import org.example.analysis.service.analysis.checkpoint.ChapterAnalysisCheckpoint;
import org.example.analysis.service.analysis.checkpoint.CheckpointManager;
import org.example.analysis.service.analysis.checkpoint.CheckpointWriteResult;
import org.example.analysis.service.analysis.persist.PersistResult;
import org.example.analysis.service.analysis.persist.TaskResultPersisterRegistry;
import org.example.analysis.service.analysis.prompt.AttributedDialog;
import org.example.analysis.service.analysis.prompt.BatchTextInput;
import org.example.analysis.service.analysis.prompt.CharacterExtractionOutput;
import org.example.analysis.service.analysis.prompt.CharacterExtractionPrompt;
import org.example.analysis.service.analysis.prompt.DialogExtractionInput;
import org.example.analysis.service.analysis.prompt.DialogExtractionOutput;
import org.example.analysis.service.analysis.prompt.DialogExtractionPrompt;
import org.example.analysis.service.analysis.prompt.ExtractedCharacter;
import org.example.analysis.service.analysis.result.CharacterAnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.example.analysis.service.llm.LlmProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Batched, checkpointed character and dialog analysis of one chapter.
 *
 * <p>Each batch gets a character extraction call followed by a dialog attribution
 * call that lists every character known so far. After each batch the accumulated
 * characters are checkpointed, so a failed or cancelled run resumes where it stopped.
 * The checkpoint is removed only after the result has been persisted.
 *
 * <p>With a paragraph limit only the leading paragraphs are analyzed and persisted.
 * The checkpoint is then kept, so a later run without a limit continues after them.
 */
public class ChapterAnalysisTask implements AnalysisTask {

    private static final Logger log = LoggerFactory.getLogger(ChapterAnalysisTask.class);

    static final String DEFAULT_EMOTION = "neutral";
    static final double DEFAULT_INTENSITY = 0.5;

    private final String bookId;
    private final String chapterId;
    private final ParagraphRepository paragraphRepository;
    private final CharacterExtractionPrompt characterPrompt;
    private final DialogExtractionPrompt dialogPrompt;
    private final InferenceRetrier inferenceRetrier;
    private final CheckpointManager<ChapterAnalysisCheckpoint> checkpointManager;
    private final TaskResultPersisterRegistry persisterRegistry;
    private final Clock clock;
    private final Integer maxParagraphs;
    private final Consumer<BatchCompletion> batchListener;

    public ChapterAnalysisTask(String bookId,
                               String chapterId,
                               ParagraphRepository paragraphRepository,
                               CharacterExtractionPrompt characterPrompt,
                               DialogExtractionPrompt dialogPrompt,
                               InferenceRetrier inferenceRetrier,
                               CheckpointManager<ChapterAnalysisCheckpoint> checkpointManager,
                               TaskResultPersisterRegistry persisterRegistry,
                               Clock clock,
                               Integer maxParagraphs,
                               Consumer<BatchCompletion> batchListener) {
        this.bookId = bookId;
        this.chapterId = chapterId;
        this.paragraphRepository = paragraphRepository;
        this.characterPrompt = characterPrompt;
        this.dialogPrompt = dialogPrompt;
        this.inferenceRetrier = inferenceRetrier;
        this.checkpointManager = checkpointManager;
        this.persisterRegistry = persisterRegistry;
        this.clock = clock;
        this.maxParagraphs = maxParagraphs;
        this.batchListener = batchListener == null ? completion -> { } : batchListener;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CHARACTERS;
    }

    @Override
    public String bookId() {
        return bookId;
    }

    public String chapterId() {
        return chapterId;
    }

    @Override
    public String taskKey() {
        return taskKey(bookId, chapterId);
    }

    public static String taskKey(String bookId, String chapterId) {
        return TaskKind.CHARACTERS + ":" + bookId + ":" + chapterId;
    }

    /**
     * Both prompts receive the full batch text, so batches are sized to the smaller input budget.
     */
    int maxBatchChars() {
        return Math.min(characterPrompt.tokenBudget().maxInputChars(), dialogPrompt.tokenBudget().maxInputChars());
    }

    @Override
    public TaskResult execute(CancellationToken cancellationToken, Consumer<TaskProgress> progressListener) {
        ProgressReporter progress = new ProgressReporter(progressListener);
        progress.report(TaskState.START, "Starting character analysis");

        List<ParagraphEntity> paragraphs = loadParagraphs();
        if (paragraphs.isEmpty()) {
            log.warn("Chapter {} of book {} has no paragraphs to analyze", chapterId, bookId);
            progress.report(TaskState.FAILED, "Chapter has no paragraphs");
            return TaskResult.failed("Chapter has no paragraphs", false);
        }
        List<String> texts = paragraphs.stream().map(ParagraphEntity::getContent).toList();
        int limit = maxParagraphs == null ? texts.size() : Math.min(maxParagraphs, texts.size());
        boolean partial = limit < texts.size();
        if (partial) {
            log.info("Analyzing the first {} of {} paragraphs of chapter {}", limit, texts.size(), chapterId);
        }

        progress.report(TaskState.RESUME_CHECK, "Checking for saved progress");
        String contentHash = CheckpointManager.computeContentHash(texts);
        CharacterAccumulator accumulator = new CharacterAccumulator();
        int cursor = -1;
        int batchesCompleted = 0;

        ChapterAnalysisCheckpoint checkpoint = checkpointManager.load(bookId, chapterId, contentHash);
        if (checkpoint != null) {
            accumulator.restore(checkpoint.accumulatedCharacters());
            cursor = checkpoint.lastProcessedParagraphIndex();
            batchesCompleted = checkpoint.batchesCompleted();
            progress.resumed = true;
            log.info("Resuming chapter {} of book {} after paragraph {} ({} batches done, {} characters)",
                    chapterId, bookId, cursor, batchesCompleted, accumulator.size());
        }

        List<ParagraphBatch> batches = ParagraphBatcher.partition(texts.subList(0, limit), maxBatchChars(), cursor + 1);
        progress.totalBatches = batchesCompleted + batches.size();
        progress.batchesCompleted = batchesCompleted;

        try {
            for (ParagraphBatch batch : batches) {
                if (cancellationToken.isCancelled()) {
                    log.info("Chapter {} of book {} cancelled after {} batches", chapterId, bookId, batchesCompleted);
                    progress.report(TaskState.CANCELLED, "Cancelled; progress saved");
                    return TaskResult.cancelled("Cancelled after " + batchesCompleted + " batches", progress.resumed);
                }
                progress.report(TaskState.BATCH_PROCESSING, batchMessage(progress, batchesCompleted));

                processBatch(batch, paragraphs, accumulator, progress.totalBatches, batchesCompleted);
                batchesCompleted++;
                cursor = batch.endParagraphIndex();
                progress.batchesCompleted = batchesCompleted;

                CheckpointWriteResult write = checkpointManager.save(new ChapterAnalysisCheckpoint(
                        bookId, chapterId, contentHash, clock.millis(), cursor, texts.size(),
                        batchesCompleted, accumulator.snapshot()));
                if (!write.success()) {
                    log.warn("Checkpoint for chapter {} not saved: {}", chapterId, write.diagnostic());
                }
                notifyBatchComplete(new BatchCompletion(bookId, chapterId, batchesCompleted, progress.totalBatches,
                        paragraphs.get(batch.startParagraphIndex()).getParagraphIndex(),
                        paragraphs.get(batch.endParagraphIndex()).getParagraphIndex(),
                        accumulator.snapshot()));
                log.info("Chapter {} batch {}/{} done, {} characters so far",
                        chapterId, batchesCompleted, progress.totalBatches, accumulator.size());
            }
        } catch (LlmProviderException e) {
            log.error("Inference failed for chapter {} of book {}", chapterId, bookId, e);
            progress.report(TaskState.FAILED, "Analysis paused; will resume from checkpoint");
            return TaskResult.failed(e.getMessage(), progress.resumed);
        } catch (RuntimeException e) {
            log.error("Character analysis failed for chapter {} of book {}", chapterId, bookId, e);
            progress.report(TaskState.FAILED, "Analysis failed");
            return TaskResult.failed(e.getMessage(), progress.resumed);
        }

        progress.report(TaskState.FINALIZE, "Finalizing " + accumulator.size() + " characters");
        CharacterAnalysisResult result = new CharacterAnalysisResult(bookId, chapterId, accumulator.snapshot());

        progress.report(TaskState.PERSIST, "Saving characters");
        PersistResult persistResult;
        try {
            persistResult = persisterRegistry.persist(result);
        } catch (RuntimeException e) {
            log.error("Persisting characters failed for chapter {} of book {}, keeping checkpoint", chapterId, bookId, e);
            progress.report(TaskState.FAILED, "Saving failed; will resume from checkpoint");
            return TaskResult.failed(e.getMessage(), result, null, progress.resumed);
        }
        if (persistResult.isTotalFailure()) {
            log.error("No characters persisted for chapter {} of book {} ({} failures), keeping checkpoint",
                    chapterId, bookId, persistResult.failures());
            progress.report(TaskState.FAILED, "Saving failed; will resume from checkpoint");
            return TaskResult.failed("All " + persistResult.failures() + " characters failed to persist",
                    result, persistResult, progress.resumed);
        }

        String message = "Analyzed " + result.characters().size() + " characters in " + batchesCompleted + " batches";
        if (partial) {
            message += " from the first " + limit + " of " + texts.size() + " paragraphs";
        } else {
            checkpointManager.delete(bookId, chapterId);
        }
        progress.report(TaskState.DONE, message);
        log.info("Chapter {} of book {}: {}", chapterId, bookId, message);
        return TaskResult.done(message, result, persistResult, progress.resumed);
    }

    private void notifyBatchComplete(BatchCompletion completion) {
        try {
            batchListener.accept(completion);
        } catch (RuntimeException e) {
            log.warn("Batch listener failed for chapter {} batch {}: {}",
                    chapterId, completion.batchNumber(), e.getMessage());
        }
    }

    private List<ParagraphEntity> loadParagraphs() {
        List<ParagraphEntity> paragraphs = new ArrayList<>();
        for (ParagraphEntity paragraph : paragraphRepository.findByChapterIdOrderByParagraphIndex(chapterId)) {
            if (paragraph.getContent() != null && !paragraph.getContent().isBlank()) {
                paragraphs.add(paragraph);
            }
        }
        return paragraphs;
    }

    private void processBatch(ParagraphBatch batch, List<ParagraphEntity> paragraphs,
                              CharacterAccumulator accumulator, int totalBatches, int batchNumber) {
        String text = batch.text();

        BatchTextInput characterInput = characterPrompt.prepareInput(new BatchTextInput(text, batchNumber, totalBatches));
        String characterResponse = inferenceRetrier.generate(
                characterPrompt.buildFullPrompt(characterInput),
                characterPrompt.llmOptions(),
                "Character extraction for chapter " + chapterId + " batch " + (batchNumber + 1));
        CharacterExtractionOutput extracted = characterPrompt.parseResponse(characterResponse);

        List<AccumulatedCharacterData> partials = new ArrayList<>();
        LinkedHashSet<String> knownNames = new LinkedHashSet<>(accumulator.names());
        for (ExtractedCharacter character : extracted.characters()) {
            List<DialogEntry> dialogs = new ArrayList<>();
            for (String line : character.dialogs()) {
                String cleaned = cleanDialogText(line);
                if (!cleaned.isEmpty()) {
                    dialogs.add(new DialogEntry(locateParagraph(cleaned, batch, paragraphs), cleaned,
                            DEFAULT_EMOTION, DEFAULT_INTENSITY));
                }
            }
            partials.add(new AccumulatedCharacterData(
                    character.name(), character.traits(), character.voiceProfile(), null, dialogs));
            knownNames.add(character.name());
        }

        if (!knownNames.isEmpty()) {
            DialogExtractionInput dialogInput = dialogPrompt.prepareInput(
                    new DialogExtractionInput(new ArrayList<>(knownNames), text));
            String dialogResponse = inferenceRetrier.generate(
                    dialogPrompt.buildFullPrompt(dialogInput),
                    dialogPrompt.llmOptions(),
                    "Dialog attribution for chapter " + chapterId + " batch " + (batchNumber + 1));
            DialogExtractionOutput attributed = dialogPrompt.parseResponse(dialogResponse);

            for (AttributedDialog dialog : attributed.dialogs()) {
                if (!knownNames.contains(dialog.speaker())) {
                    log.debug("Ignoring dialog attributed to unknown speaker '{}'", dialog.speaker());
                    continue;
                }
                String cleaned = cleanDialogText(dialog.text());
                if (cleaned.isEmpty()) {
                    continue;
                }
                DialogEntry entry = new DialogEntry(locateParagraph(cleaned, batch, paragraphs), cleaned,
                        dialog.emotion(), dialog.intensity());
                partials.add(new AccumulatedCharacterData(dialog.speaker(), List.of(), null, null, List.of(entry)));
            }
        }

        // Attribution entries come last so their emotion wins over extraction defaults
        accumulator.mergeAll(partials);
    }

    /**
     * Paragraph index (as stored) of the first paragraph in the batch containing the line,
     * falling back to the batch's first paragraph.
     */
    int locateParagraph(String dialog, ParagraphBatch batch, List<ParagraphEntity> paragraphs) {
        String needle = normalize(dialog);
        for (int i = batch.startParagraphIndex(); i <= batch.endParagraphIndex(); i++) {
            if (normalize(paragraphs.get(i).getContent()).contains(needle)) {
                return paragraphs.get(i).getParagraphIndex();
            }
        }
        return paragraphs.get(batch.startParagraphIndex()).getParagraphIndex();
    }

    static String cleanDialogText(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.trim();
        while (!cleaned.isEmpty() && isQuote(cleaned.charAt(0))) {
            cleaned = cleaned.substring(1).trim();
        }
        while (!cleaned.isEmpty() && isQuote(cleaned.charAt(cleaned.length() - 1))) {
            cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
        }
        return cleaned;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '\u201C' || c == '\u201D' || c == '\u2018' || c == '\u2019';
    }

    private static String normalize(String text) {
        return text.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String batchMessage(ProgressReporter progress, int batchesCompleted) {
        String prefix = progress.resumed ? "Resuming from checkpoint: " : "";
        return prefix + "Analyzing batch " + (batchesCompleted + 1) + " of " + progress.totalBatches;
    }
}
