package org.example.analysis.service.analysis.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;

/**
 * Checkpoints as pretty-printed JSON files named {@code batched_<bookId>_<chapterId>.json}.
 * Writes go to a {@code .tmp} sibling that is then moved over the real file.
 */
public class FileCheckpointManager<T extends AnalysisCheckpoint> implements CheckpointManager<T> {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointManager.class);

    private final Path directory;
    private final Class<T> checkpointType;
    private final ObjectMapper objectMapper;
    private final Duration expiry;
    private final Clock clock;

    public FileCheckpointManager(Path directory, Class<T> checkpointType, ObjectMapper objectMapper,
                                 Duration expiry, Clock clock) {
        this.directory = directory;
        this.checkpointType = checkpointType;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.expiry = expiry;
        this.clock = clock;
    }

    @Override
    public T load(String bookId, String chapterId, String contentHash) {
        Path file = checkpointFile(bookId, chapterId);
        if (!Files.exists(file)) {
            log.debug("No checkpoint for book {} chapter {}", bookId, chapterId);
            return null;
        }

        T checkpoint;
        try {
            checkpoint = objectMapper.readValue(file.toFile(), checkpointType);
        } catch (IOException e) {
            log.warn("Corrupt checkpoint {}, deleting: {}", file.getFileName(), e.getMessage());
            deleteQuietly(file);
            return null;
        }
        if (checkpoint == null || checkpoint.bookId() == null || checkpoint.chapterId() == null
                || checkpoint.contentHash() == null) {
            log.warn("Checkpoint {} is missing required fields, deleting", file.getFileName());
            deleteQuietly(file);
            return null;
        }

        long ageMillis = clock.millis() - checkpoint.timestamp();
        if (ageMillis > expiry.toMillis()) {
            log.debug("Checkpoint for book {} chapter {} expired ({} ms old), deleting", bookId, chapterId, ageMillis);
            deleteQuietly(file);
            return null;
        }
        if (!checkpoint.contentHash().equals(contentHash)) {
            log.debug("Checkpoint for book {} chapter {} has hash {} but content is {}, deleting",
                    bookId, chapterId, checkpoint.contentHash(), contentHash);
            deleteQuietly(file);
            return null;
        }

        log.debug("Loaded checkpoint for book {} chapter {}", bookId, chapterId);
        return checkpoint;
    }

    @Override
    public CheckpointWriteResult save(T checkpoint) {
        Path file = checkpointFile(checkpoint.bookId(), checkpoint.chapterId());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(tmp.toFile(), checkpoint);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            return CheckpointWriteResult.ok();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to save checkpoint {}: {}", file.getFileName(), e.getMessage());
            deleteQuietly(tmp);
            return CheckpointWriteResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public void delete(String bookId, String chapterId) {
        deleteQuietly(checkpointFile(bookId, chapterId));
    }

    @Override
    public boolean exists(String bookId, String chapterId) {
        return Files.exists(checkpointFile(bookId, chapterId));
    }

    Path checkpointFile(String bookId, String chapterId) {
        return directory.resolve("batched_" + sanitize(bookId) + "_" + sanitize(chapterId) + ".json");
    }

    private static String sanitize(String id) {
        return id.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete checkpoint file {}: {}", file, e.getMessage());
        }
    }
}
