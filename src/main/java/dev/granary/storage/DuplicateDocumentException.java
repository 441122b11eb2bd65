package dev.granary.storage;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * The payload is already stored for this source.
 *
 * <p>Callers treat this as a successful no-op. {@link #getExistingDocumentId()} is null when the
 * duplicate was detected by the unique index rather than by the lookup.
 */
public class DuplicateDocumentException extends RuntimeException {

    private final String sourceId;
    private final String contentHash;
    private final @Nullable UUID existingDocumentId;

    public DuplicateDocumentException(String sourceId, String contentHash,
                                      @Nullable UUID existingDocumentId) {
        super("Document with hash " + contentHash + " already stored for source " + sourceId);
        this.sourceId = sourceId;
        this.contentHash = contentHash;
        this.existingDocumentId = existingDocumentId;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getContentHash() {
        return contentHash;
    }

    public @Nullable UUID getExistingDocumentId() {
        return existingDocumentId;
    }
}
