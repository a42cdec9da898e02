package org.example.analysis.service.analysis.persist;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.analysis.entity.BookEntity;
import org.example.analysis.entity.CharacterEntity;
import org.example.analysis.model.AccumulatedCharacterData;
import org.example.analysis.model.DialogEntry;
import org.example.analysis.repository.BookRepository;
import org.example.analysis.repository.CharacterRepository;
import org.example.analysis.service.analysis.result.CharacterAnalysisResult;
import org.example.analysis.service.analysis.result.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores characters by exact name within the book. Dialogs from several chapters
 * live in the same row, keyed by (chapterId, pageNumber, text). Persists for one book
 * are serialized so concurrent chapters read and extend the same row.
 */
@Component
public class CharacterResultPersister implements TaskResultPersister<CharacterAnalysisResult> {

    private static final Logger log = LoggerFactory.getLogger(CharacterResultPersister.class);

    private static final TypeReference<List<String>> TRAITS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<StoredDialog>> DIALOGS_TYPE = new TypeReference<>() {};

    private final BookRepository bookRepository;
    private final CharacterRepository characterRepository;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ConcurrentHashMap<String, Object> bookLocks = new ConcurrentHashMap<>();

    public record StoredDialog(String chapterId, int pageNumber, String text, String emotion, double intensity) {}

    public CharacterResultPersister(BookRepository bookRepository, CharacterRepository characterRepository) {
        this.bookRepository = bookRepository;
        this.characterRepository = characterRepository;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CHARACTERS;
    }

    @Override
    public Class<CharacterAnalysisResult> resultType() {
        return CharacterAnalysisResult.class;
    }

    @Override
    public PersistResult persist(CharacterAnalysisResult result) {
        BookEntity book = bookRepository.findById(result.bookId())
                .orElseThrow(() -> new IllegalArgumentException("Book not found: " + result.bookId()));

        int persisted = 0;
        int failures = 0;
        synchronized (bookLocks.computeIfAbsent(book.getId(), id -> new Object())) {
            for (AccumulatedCharacterData character : result.characters()) {
                try {
                    upsertWithRetry(book, result.chapterId(), character);
                    persisted++;
                } catch (RuntimeException | JsonProcessingException e) {
                    failures++;
                    log.warn("Failed to persist character '{}' for book {}: {}",
                            character.name(), result.bookId(), e.getMessage());
                }
            }
        }
        return new PersistResult(persisted, failures);
    }

    private void upsertWithRetry(BookEntity book, String chapterId, AccumulatedCharacterData character)
            throws JsonProcessingException {
        try {
            upsert(book, chapterId, character);
        } catch (DataIntegrityViolationException e) {
            // Another writer inserted the same (book, name) first; merge into its row.
            log.debug("Character '{}' for book {} inserted concurrently, retrying as update",
                    character.name(), book.getId());
            upsert(book, chapterId, character);
        }
    }

    private void upsert(BookEntity book, String chapterId, AccumulatedCharacterData character)
            throws JsonProcessingException {
        Optional<CharacterEntity> existing = characterRepository.findByBookIdAndName(book.getId(), character.name());
        CharacterEntity entity = existing.orElseGet(() -> new CharacterEntity(book, character.name()));

        LinkedHashSet<String> traits = new LinkedHashSet<>(readTraits(entity.getTraitsJson()));
        traits.addAll(character.traits());
        entity.setTraitsJson(objectMapper.writeValueAsString(new ArrayList<>(traits)));

        if (character.voiceProfile() != null) {
            entity.setVoiceProfileJson(objectMapper.writeValueAsString(character.voiceProfile()));
        }
        if (character.speakerId() != null) {
            entity.setSpeakerId(character.speakerId());
        }
        entity.setDialogsJson(objectMapper.writeValueAsString(
                mergeDialogs(readDialogs(entity.getDialogsJson()), chapterId, character.dialogs())));

        if (existing.isPresent()) {
            entity.setUpdatedAt(LocalDateTime.now());
        }
        characterRepository.save(entity);
    }

    private List<StoredDialog> mergeDialogs(List<StoredDialog> stored, String chapterId, List<DialogEntry> incoming) {
        Map<String, StoredDialog> byKey = new LinkedHashMap<>();
        for (StoredDialog dialog : stored) {
            byKey.put(key(dialog.chapterId(), dialog.pageNumber(), dialog.text()), dialog);
        }
        for (DialogEntry dialog : incoming) {
            byKey.put(key(chapterId, dialog.pageNumber(), dialog.text()),
                    new StoredDialog(chapterId, dialog.pageNumber(), dialog.text(), dialog.emotion(), dialog.intensity()));
        }
        List<StoredDialog> merged = new ArrayList<>(byKey.values());
        merged.sort(Comparator.comparing((StoredDialog d) -> String.valueOf(d.chapterId()))
                .thenComparingInt(StoredDialog::pageNumber));
        return merged;
    }

    private static String key(String chapterId, int pageNumber, String text) {
        return chapterId + "\u0000" + pageNumber + "\u0000" + text;
    }

    private List<String> readTraits(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return objectMapper.readValue(json, TRAITS_TYPE);
    }

    private List<StoredDialog> readDialogs(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return objectMapper.readValue(json, DIALOGS_TYPE);
    }
}
