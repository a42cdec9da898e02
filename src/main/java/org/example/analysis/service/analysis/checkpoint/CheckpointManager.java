package org.example.analysis.service.analysis.checkpoint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Stores progress snapshots keyed by (bookId, chapterId).
 *
 * <p>{@link #load} only returns checkpoints that are still valid: the stored content
 * hash must match and the checkpoint must not be older than the expiry. Invalid or
 * unreadable checkpoints are deleted when encountered.
 */
public interface CheckpointManager<T extends AnalysisCheckpoint> {

    int CONTENT_HASH_LENGTH = 16;

    /**
     * @return the checkpoint, or null when absent, expired, for other content, or unreadable
     */
    T load(String bookId, String chapterId, String contentHash);

    CheckpointWriteResult save(T checkpoint);

    void delete(String bookId, String chapterId);

    boolean exists(String bookId, String chapterId);

    /**
     * SHA-256 over the newline-joined sections, hex encoded, first 16 characters.
     * Used for change detection only.
     */
    static String computeContentHash(List<String> sections) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.join("\n", sections).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, CONTENT_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
