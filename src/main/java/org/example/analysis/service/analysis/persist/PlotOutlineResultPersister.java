package org.example.analysis.service.analysis.persist;

import org.example.analysis.entity.BookEntity;
import org.example.analysis.entity.PlotPointEntity;
import org.example.analysis.model.PlotPoint;
import org.example.analysis.repository.BookRepository;
import org.example.analysis.repository.PlotPointRepository;
import org.example.analysis.service.analysis.result.PlotOutlineAnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stores at most one plot point per type for a book.
 */
@Component
public class PlotOutlineResultPersister implements TaskResultPersister<PlotOutlineAnalysisResult> {

    private static final Logger log = LoggerFactory.getLogger(PlotOutlineResultPersister.class);

    private final BookRepository bookRepository;
    private final PlotPointRepository plotPointRepository;

    public PlotOutlineResultPersister(BookRepository bookRepository, PlotPointRepository plotPointRepository) {
        this.bookRepository = bookRepository;
        this.plotPointRepository = plotPointRepository;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.PLOT_OUTLINE;
    }

    @Override
    public Class<PlotOutlineAnalysisResult> resultType() {
        return PlotOutlineAnalysisResult.class;
    }

    @Override
    public PersistResult persist(PlotOutlineAnalysisResult result) {
        BookEntity book = bookRepository.findById(result.bookId())
                .orElseThrow(() -> new IllegalArgumentException("Book not found: " + result.bookId()));

        int persisted = 0;
        int failures = 0;
        for (PlotPoint point : result.plotPoints()) {
            try {
                PlotPointEntity entity = plotPointRepository.findByBookIdAndType(book.getId(), point.type())
                        .orElseGet(() -> new PlotPointEntity(book, point.type()));
                entity.setChapterIndex(point.chapterIndex());
                if (point.description() != null && !point.description().isBlank()) {
                    entity.setDescription(point.description());
                }
                entity.setConfidence(point.confidence());
                plotPointRepository.save(entity);
                persisted++;
            } catch (RuntimeException e) {
                failures++;
                log.warn("Failed to persist plot point {} for book {}: {}", point.type(), result.bookId(), e.getMessage());
            }
        }
        return new PersistResult(persisted, failures);
    }
}
