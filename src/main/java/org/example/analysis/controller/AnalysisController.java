package org.example.analysis.controller;

import org.example.analysis.entity.ChapterEntity;
import org.example.analysis.repository.ChapterRepository;
import org.example.analysis.service.analysis.AnalysisJobService;
import org.example.analysis.service.analysis.AnalysisJobService.AnalysisJobStatus;
import org.example.analysis.service.analysis.checkpoint.ChapterAnalysisCheckpoint;
import org.example.analysis.service.analysis.checkpoint.CheckpointManager;
import org.example.analysis.service.analysis.result.TaskKind;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * REST endpoints for starting, inspecting and cancelling analysis jobs.
 */
@RestController
@RequestMapping("/api/analysis")
public class AnalysisController {

    private final AnalysisJobService analysisJobService;
    private final ChapterRepository chapterRepository;
    private final CheckpointManager<ChapterAnalysisCheckpoint> checkpointManager;

    public record CheckpointStatus(String bookId, String chapterId, boolean exists) {}

    public AnalysisController(AnalysisJobService analysisJobService,
                              ChapterRepository chapterRepository,
                              CheckpointManager<ChapterAnalysisCheckpoint> checkpointManager) {
        this.analysisJobService = analysisJobService;
        this.chapterRepository = chapterRepository;
        this.checkpointManager = checkpointManager;
    }

    /**
     * Start (or resume) character analysis of one chapter. Returns the already active
     * job if the chapter is queued or running. {@code maxParagraphs} limits the run to
     * the leading paragraphs; a later run without it continues from there.
     */
    @PostMapping("/chapters/{chapterId}")
    public ResponseEntity<AnalysisJobStatus> analyzeChapter(@PathVariable String chapterId,
                                                            @RequestParam(required = false) Integer maxParagraphs) {
        if (maxParagraphs != null && maxParagraphs < 1) {
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.accepted().body(analysisJobService.startChapterJob(chapterId, maxParagraphs));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping("/books/{bookId}/chapters")
    public ResponseEntity<List<AnalysisJobStatus>> analyzeAllChapters(@PathVariable String bookId) {
        try {
            return ResponseEntity.accepted().body(analysisJobService.startBookChapterJobs(bookId));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Start a book-level analysis: {@code foreshadowing}, {@code plot-outline} or {@code theme}.
     */
    @PostMapping("/books/{bookId}/insights/{kind}")
    public ResponseEntity<AnalysisJobStatus> analyzeBook(@PathVariable String bookId, @PathVariable String kind) {
        Optional<TaskKind> taskKind = TaskKind.fromString(kind);
        if (taskKind.isEmpty() || taskKind.get() == TaskKind.CHARACTERS) {
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.accepted().body(analysisJobService.startInsightJob(bookId, taskKind.get()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AnalysisJobStatus> getJobStatus(@PathVariable String jobId) {
        return analysisJobService.getJobStatus(jobId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<AnalysisJobStatus> cancelJob(@PathVariable String jobId) {
        return analysisJobService.cancelJob(jobId)
                .map(job -> ResponseEntity.accepted().body(job))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/books/{bookId}/chapters/{chapterId}/checkpoint")
    public ResponseEntity<CheckpointStatus> getCheckpointStatus(@PathVariable String bookId,
                                                                @PathVariable String chapterId) {
        Optional<ChapterEntity> chapter = chapterRepository.findByIdWithBook(chapterId);
        if (chapter.isEmpty() || !bookId.equals(chapter.get().getBook().getId())) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(new CheckpointStatus(bookId, chapterId, checkpointManager.exists(bookId, chapterId)));
    }
}
