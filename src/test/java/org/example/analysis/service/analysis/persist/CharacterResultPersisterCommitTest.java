package org.example.analysis.service.analysis.persist;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.analysis.entity.BookEntity;
import org.example.analysis.entity.CharacterEntity;
import org.example.analysis.model.AccumulatedCharacterData;
import org.example.analysis.model.DialogEntry;
import org.example.analysis.repository.BookRepository;
import org.example.analysis.repository.CharacterRepository;
import org.example.analysis.service.analysis.result.CharacterAnalysisResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs without a test transaction so every repository call commits on its own, the
 * way persisters run inside analysis jobs.
 */
@DataJpaTest
@Import(CharacterResultPersister.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class CharacterResultPersisterCommitTest {

    private static final int ROUNDS = 20;

    @Autowired
    private BookRepository bookRepository;

    @Autowired
    private CharacterRepository characterRepository;

    @Autowired
    private CharacterResultPersister persister;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        characterRepository.deleteAll();
        bookRepository.deleteAll();
    }

    @Test
    void concurrentChaptersOfSameBook_keepDialogsFromBoth() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            BookEntity book = bookRepository.save(new BookEntity("Alice's Adventures in Wonderland", "Lewis Carroll"));
            CountDownLatch start = new CountDownLatch(1);

            Future<PersistResult> first = executor.submit(() -> {
                start.await();
                return persister.persist(chapterResult(book.getId(), "ch1", "White Rabbit", "Who are you?"));
            });
            Future<PersistResult> second = executor.submit(() -> {
                start.await();
                return persister.persist(chapterResult(book.getId(), "ch2", "Caterpillar", "Curiouser and curiouser!"));
            });
            start.countDown();

            assertEquals(new PersistResult(2, 0), first.get(10, TimeUnit.SECONDS));
            assertEquals(new PersistResult(2, 0), second.get(10, TimeUnit.SECONDS));

            CharacterEntity alice = characterRepository.findByBookIdAndName(book.getId(), "Alice").orElseThrow();
            List<CharacterResultPersister.StoredDialog> dialogs = objectMapper.readValue(alice.getDialogsJson(),
                    new TypeReference<List<CharacterResultPersister.StoredDialog>>() {});
            assertEquals(List.of("ch1", "ch2"),
                    dialogs.stream().map(CharacterResultPersister.StoredDialog::chapterId).toList(),
                    "round " + round);
            assertEquals(3, characterRepository.countByBookId(book.getId()));
        }
    }

    @Test
    void persist_oneCharacterRejectedByStore_keepsTheOthers() {
        BookEntity book = bookRepository.save(new BookEntity("Alice's Adventures in Wonderland", "Lewis Carroll"));

        PersistResult outcome = persister.persist(new CharacterAnalysisResult(book.getId(), "ch1", List.of(
                new AccumulatedCharacterData("Alice", List.of("curious"), null, null,
                        List.of(new DialogEntry(0, "Who are you?", "neutral", 0.5))),
                AccumulatedCharacterData.named("x".repeat(300)))));

        assertEquals(new PersistResult(1, 1), outcome);
        assertTrue(characterRepository.findByBookIdAndName(book.getId(), "Alice").isPresent());
        assertEquals(1, characterRepository.countByBookId(book.getId()));
    }

    private static CharacterAnalysisResult chapterResult(String bookId, String chapterId, String other, String line) {
        return new CharacterAnalysisResult(bookId, chapterId, List.of(
                new AccumulatedCharacterData("Alice", List.of("curious"), null, null,
                        List.of(new DialogEntry(0, line, "neutral", 0.5))),
                AccumulatedCharacterData.named(other)));
    }
}
