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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CharacterResultPersisterTest {

    @Mock
    private BookRepository bookRepository;

    @Mock
    private CharacterRepository characterRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CharacterResultPersister persister;
    private BookEntity book;

    @BeforeEach
    void setUp() {
        persister = new CharacterResultPersister(bookRepository, characterRepository);
        book = new BookEntity("Alice's Adventures in Wonderland", "Lewis Carroll");
        book.setId("book-1");
        when(bookRepository.findById("book-1")).thenReturn(Optional.of(book));
    }

    @Test
    void persist_insertLosesRace_mergesIntoRowWrittenByOtherChapter() throws Exception {
        CharacterEntity existing = new CharacterEntity(book, "Alice");
        existing.setDialogsJson("""
                [{"chapterId": "ch1", "pageNumber": 0, "text": "Who are you?", "emotion": "neutral", "intensity": 0.5}]""");
        when(characterRepository.findByBookIdAndName("book-1", "Alice"))
                .thenReturn(Optional.empty(), Optional.of(existing));
        when(characterRepository.save(any(CharacterEntity.class)))
                .thenThrow(new DataIntegrityViolationException("Unique index or primary key violation"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        PersistResult outcome = persister.persist(new CharacterAnalysisResult("book-1", "ch2", List.of(
                new AccumulatedCharacterData("Alice", List.of("curious"), null, null,
                        List.of(new DialogEntry(3, "Curiouser and curiouser!", "surprised", 0.8))))));

        assertEquals(new PersistResult(1, 0), outcome);
        ArgumentCaptor<CharacterEntity> captor = ArgumentCaptor.forClass(CharacterEntity.class);
        verify(characterRepository, times(2)).save(captor.capture());
        CharacterEntity saved = captor.getAllValues().get(1);
        assertSame(existing, saved);
        List<CharacterResultPersister.StoredDialog> dialogs = objectMapper.readValue(saved.getDialogsJson(),
                new TypeReference<List<CharacterResultPersister.StoredDialog>>() {});
        assertEquals(List.of("ch1", "ch2"), dialogs.stream().map(CharacterResultPersister.StoredDialog::chapterId).toList());
    }

    @Test
    void persist_constraintViolationOnRetry_countsOneFailure() {
        when(characterRepository.findByBookIdAndName("book-1", "Alice")).thenReturn(Optional.empty());
        when(characterRepository.save(any(CharacterEntity.class)))
                .thenThrow(new DataIntegrityViolationException("Value too long for column"));

        PersistResult outcome = persister.persist(new CharacterAnalysisResult("book-1", "ch1",
                List.of(AccumulatedCharacterData.named("Alice"))));

        assertEquals(new PersistResult(0, 1), outcome);
        verify(characterRepository, times(2)).save(any(CharacterEntity.class));
    }
}
