package org.example.analysis.service.analysis.persist;

import org.example.analysis.entity.BookEntity;
import org.example.analysis.repository.BookRepository;
import org.example.analysis.service.analysis.prompt.ThemeAnalysisOutput;
import org.example.analysis.service.analysis.result.TaskKind;
import org.example.analysis.service.analysis.result.ThemeAnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Writes theme fields onto the book row. A null ambient sound keeps the stored one, and
 * defaults from an unreadable reply never replace a theme that is already stored.
 */
@Component
public class ThemeResultPersister implements TaskResultPersister<ThemeAnalysisResult> {

    private static final Logger log = LoggerFactory.getLogger(ThemeResultPersister.class);

    private final BookRepository bookRepository;

    public ThemeResultPersister(BookRepository bookRepository) {
        this.bookRepository = bookRepository;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.THEME;
    }

    @Override
    public Class<ThemeAnalysisResult> resultType() {
        return ThemeAnalysisResult.class;
    }

    @Override
    public PersistResult persist(ThemeAnalysisResult result) {
        BookEntity book = bookRepository.findById(result.bookId())
                .orElseThrow(() -> new IllegalArgumentException("Book not found: " + result.bookId()));
        ThemeAnalysisOutput theme = result.theme();
        if (!theme.parsed() && book.getThemeAnalyzedAt() != null) {
            log.info("Theme reply for book {} was unreadable, keeping stored theme", result.bookId());
            return PersistResult.empty();
        }
        try {
            book.setThemeMood(theme.mood());
            book.setThemeGenre(theme.genre());
            book.setThemeEra(theme.era());
            book.setThemeEmotionalTone(theme.emotionalTone());
            if (theme.ambientSound() != null) {
                book.setThemeAmbientSound(theme.ambientSound());
            }
            book.setThemeAnalyzedAt(LocalDateTime.now());
            bookRepository.save(book);
            return new PersistResult(1, 0);
        } catch (RuntimeException e) {
            log.warn("Failed to persist theme for book {}: {}", result.bookId(), e.getMessage());
            return new PersistResult(0, 1);
        }
    }
}
