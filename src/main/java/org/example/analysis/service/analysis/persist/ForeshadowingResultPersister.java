package org.example.analysis.service.analysis.persist;

import org.example.analysis.entity.BookEntity;
import org.example.analysis.entity.ForeshadowingEntity;
import org.example.analysis.model.Foreshadowing;
import org.example.analysis.repository.BookRepository;
import org.example.analysis.repository.ForeshadowingRepository;
import org.example.analysis.service.analysis.result.ForeshadowingAnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stores foreshadowing links keyed by (setupChapter, payoffChapter, theme).
 */
@Component
public class ForeshadowingResultPersister implements TaskResultPersister<ForeshadowingAnalysisResult> {

    private static final Logger log = LoggerFactory.getLogger(ForeshadowingResultPersister.class);

    private final BookRepository bookRepository;
    private final ForeshadowingRepository foreshadowingRepository;

    public ForeshadowingResultPersister(BookRepository bookRepository, ForeshadowingRepository foreshadowingRepository) {
        this.bookRepository = bookRepository;
        this.foreshadowingRepository = foreshadowingRepository;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.FORESHADOWING;
    }

    @Override
    public Class<ForeshadowingAnalysisResult> resultType() {
        return ForeshadowingAnalysisResult.class;
    }

    @Override
    public PersistResult persist(ForeshadowingAnalysisResult result) {
        BookEntity book = bookRepository.findById(result.bookId())
                .orElseThrow(() -> new IllegalArgumentException("Book not found: " + result.bookId()));

        int persisted = 0;
        int failures = 0;
        for (Foreshadowing item : result.foreshadowings()) {
            try {
                ForeshadowingEntity entity = foreshadowingRepository
                        .findByBookIdAndSetupChapterAndPayoffChapterAndTheme(
                                book.getId(), item.setupChapter(), item.payoffChapter(), item.theme())
                        .orElseGet(() -> new ForeshadowingEntity(
                                book, item.setupChapter(), item.payoffChapter(), item.theme()));
                if (item.setupText() != null && !item.setupText().isBlank()) {
                    entity.setSetupText(item.setupText());
                }
                if (item.payoffText() != null && !item.payoffText().isBlank()) {
                    entity.setPayoffText(item.payoffText());
                }
                entity.setConfidence(item.confidence());
                foreshadowingRepository.save(entity);
                persisted++;
            } catch (RuntimeException e) {
                failures++;
                log.warn("Failed to persist foreshadowing {}->{} ({}) for book {}: {}",
                        item.setupChapter(), item.payoffChapter(), item.theme(), result.bookId(), e.getMessage());
            }
        }
        return new PersistResult(persisted, failures);
    }
}
