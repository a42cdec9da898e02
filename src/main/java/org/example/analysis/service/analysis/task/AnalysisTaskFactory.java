package org.example.analysis.service.analysis.task;

import org.example.analysis.config.AnalysisProperties;
import org.example.analysis.entity.BookEntity;
import org.example.analysis.entity.ChapterEntity;
import org.example.analysis.entity.ParagraphEntity;
import org.example.analysis.repository.BookRepository;
import org.example.analysis.repository.ChapterRepository;
import org.example.analysis.repository.ParagraphRepository;
import org.example.analysis.service.analysis.checkpoint.ChapterAnalysisCheckpoint;
import org.example.analysis.service.analysis.checkpoint.CheckpointManager;
import org.example.analysis.service.analysis.persist.TaskResultPersisterRegistry;
import org.example.analysis.service.analysis.prompt.ChapterSample;
import org.example.analysis.service.analysis.prompt.ChapterSamplesInput;
import org.example.analysis.service.analysis.prompt.CharacterExtractionPrompt;
import org.example.analysis.service.analysis.prompt.DialogExtractionPrompt;
import org.example.analysis.service.analysis.prompt.ForeshadowingOutput;
import org.example.analysis.service.analysis.prompt.ForeshadowingPrompt;
import org.example.analysis.service.analysis.prompt.PlotPointOutput;
import org.example.analysis.service.analysis.prompt.PlotPointPrompt;
import org.example.analysis.service.analysis.prompt.ThemeAnalysisInput;
import org.example.analysis.service.analysis.prompt.ThemeAnalysisOutput;
import org.example.analysis.service.analysis.prompt.ThemeAnalysisPrompt;
import org.example.analysis.service.analysis.result.ForeshadowingAnalysisResult;
import org.example.analysis.service.analysis.result.PlotOutlineAnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.example.analysis.service.analysis.result.ThemeAnalysisResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Builds analysis tasks for chapters and books, resolving ids against the database.
 */
@Component
public class AnalysisTaskFactory {

    private final BookRepository bookRepository;
    private final ChapterRepository chapterRepository;
    private final ParagraphRepository paragraphRepository;
    private final CharacterExtractionPrompt characterPrompt;
    private final DialogExtractionPrompt dialogPrompt;
    private final ForeshadowingPrompt foreshadowingPrompt;
    private final PlotPointPrompt plotPointPrompt;
    private final ThemeAnalysisPrompt themePrompt;
    private final InferenceRetrier inferenceRetrier;
    private final CheckpointManager<ChapterAnalysisCheckpoint> checkpointManager;
    private final TaskResultPersisterRegistry persisterRegistry;
    private final AnalysisProperties properties;
    private final Clock clock;

    public AnalysisTaskFactory(BookRepository bookRepository,
                               ChapterRepository chapterRepository,
                               ParagraphRepository paragraphRepository,
                               CharacterExtractionPrompt characterPrompt,
                               DialogExtractionPrompt dialogPrompt,
                               ForeshadowingPrompt foreshadowingPrompt,
                               PlotPointPrompt plotPointPrompt,
                               ThemeAnalysisPrompt themePrompt,
                               InferenceRetrier inferenceRetrier,
                               CheckpointManager<ChapterAnalysisCheckpoint> checkpointManager,
                               TaskResultPersisterRegistry persisterRegistry,
                               AnalysisProperties properties,
                               Clock clock) {
        this.bookRepository = bookRepository;
        this.chapterRepository = chapterRepository;
        this.paragraphRepository = paragraphRepository;
        this.characterPrompt = characterPrompt;
        this.dialogPrompt = dialogPrompt;
        this.foreshadowingPrompt = foreshadowingPrompt;
        this.plotPointPrompt = plotPointPrompt;
        this.themePrompt = themePrompt;
        this.inferenceRetrier = inferenceRetrier;
        this.checkpointManager = checkpointManager;
        this.persisterRegistry = persisterRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param maxParagraphs analyze only this many leading paragraphs, or all of them when null
     * @param batchListener called after each completed batch
     * @throws IllegalArgumentException if the chapter does not exist
     */
    public ChapterAnalysisTask createChapterTask(String chapterId, Integer maxParagraphs,
                                                 Consumer<BatchCompletion> batchListener) {
        ChapterEntity chapter = chapterRepository.findByIdWithBook(chapterId)
                .orElseThrow(() -> new IllegalArgumentException("Chapter not found: " + chapterId));
        return new ChapterAnalysisTask(
                chapter.getBook().getId(),
                chapter.getId(),
                paragraphRepository,
                characterPrompt,
                dialogPrompt,
                inferenceRetrier,
                checkpointManager,
                persisterRegistry,
                clock,
                maxParagraphs,
                batchListener);
    }

    /**
     * @throws IllegalArgumentException if the book does not exist or the kind is not a book-level analysis
     */
    public BookInsightTask<?, ?> createInsightTask(String bookId, TaskKind kind) {
        BookEntity book = bookRepository.findById(bookId)
                .orElseThrow(() -> new IllegalArgumentException("Book not found: " + bookId));
        int chapterSampleChars = properties.getSampling().getChapterSampleChars();

        return switch (kind) {
            case FORESHADOWING -> new BookInsightTask<ChapterSamplesInput, ForeshadowingOutput>(
                    kind, bookId,
                    () -> new ChapterSamplesInput(loadChapterSamples(bookId, chapterSampleChars), chapterSampleChars),
                    foreshadowingPrompt,
                    output -> new ForeshadowingAnalysisResult(bookId, output.foreshadowings()),
                    inferenceRetrier, persisterRegistry);
            case PLOT_OUTLINE -> new BookInsightTask<ChapterSamplesInput, PlotPointOutput>(
                    kind, bookId,
                    () -> new ChapterSamplesInput(loadChapterSamples(bookId, chapterSampleChars), chapterSampleChars),
                    plotPointPrompt,
                    output -> new PlotOutlineAnalysisResult(bookId, output.plotPoints()),
                    inferenceRetrier, persisterRegistry);
            case THEME -> new BookInsightTask<ThemeAnalysisInput, ThemeAnalysisOutput>(
                    kind, bookId,
                    () -> loadThemeInput(book.getTitle(), bookId),
                    themePrompt,
                    output -> new ThemeAnalysisResult(bookId, output),
                    inferenceRetrier, persisterRegistry);
            case CHARACTERS -> throw new IllegalArgumentException("Character analysis runs per chapter");
        };
    }

    private List<ChapterSample> loadChapterSamples(String bookId, int maxChars) {
        List<ChapterEntity> chapters = chapterRepository.findByBookIdOrderByChapterIndex(bookId);
        if (chapters.isEmpty()) {
            throw new IllegalStateException("Book " + bookId + " has no chapters");
        }
        List<ChapterSample> samples = new ArrayList<>();
        for (ChapterEntity chapter : chapters) {
            samples.add(new ChapterSample(chapter.getChapterIndex(), chapterText(chapter.getId(), maxChars)));
        }
        return samples;
    }

    private ThemeAnalysisInput loadThemeInput(String title, String bookId) {
        int maxChars = properties.getSampling().getThemeSampleChars();
        List<ChapterEntity> chapters = chapterRepository.findByBookIdOrderByChapterIndex(bookId);
        if (chapters.isEmpty()) {
            throw new IllegalStateException("Book " + bookId + " has no chapters");
        }
        return new ThemeAnalysisInput(title, chapterText(chapters.get(0).getId(), maxChars), maxChars);
    }

    /** Joins paragraphs until at least {@code maxChars} characters are collected. */
    private String chapterText(String chapterId, int maxChars) {
        StringBuilder sb = new StringBuilder();
        for (ParagraphEntity paragraph : paragraphRepository.findByChapterIdOrderByParagraphIndex(chapterId)) {
            if (paragraph.getContent() == null || paragraph.getContent().isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(paragraph.getContent());
            if (sb.length() >= maxChars) {
                break;
            }
        }
        return sb.toString();
    }
}
