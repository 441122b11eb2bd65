package dev.granary.storage;

import dev.granary.source.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Content-addressed persistence of raw payloads.
 *
 * <p>Storing is a three step sequence: look up {@code (source_id, content_hash)}, write the blob,
 * insert the metadata record. Content-level dedup is independent of the ingestion queue's
 * delivery-level dedup, since the same bytes can arrive through two blob paths or two pull cycles.
 *
 * <p>No lock is taken. Two concurrent stores of the same content both pass the lookup; the unique
 * index rejects the second insert, which is reported as the same {@link DuplicateDocumentException}
 * a lookup hit produces. The loser's blob stays in the raw container unreferenced.
 */
@Service
public class RawDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(RawDocumentStore.class);

    private final RawDocumentRepository repository;
    private final BlobStorageClient blobStorage;
    private final Clock clock;

    public RawDocumentStore(RawDocumentRepository repository, BlobStorageClient blobStorage,
                            Clock clock) {
        this.repository = repository;
        this.blobStorage = blobStorage;
        this.clock = clock;
    }

    /**
     * Store a raw payload for a source.
     *
     * @param content     payload bytes
     * @param config      configuration of the owning source
     * @param ingestionId ingestion that produced the payload
     * @param metadata    metadata extracted upstream (path fields, linkage fields)
     * @return the persisted record
     * @throws DuplicateDocumentException if this content is already stored for the source
     * @throws StorageException           if the blob write or the insert fails otherwise
     */
    public RawDocument storeRawDocument(byte[] content, SourceConfig config, UUID ingestionId,
                                        Map<String, Object> metadata) {
        String sourceId = config.sourceId();
        String contentHash = ContentHasher.sha256(content);

        Optional<RawDocument> existing = repository.findBySourceIdAndContentHash(sourceId, contentHash);
        if (existing.isPresent()) {
            log.info("Duplicate content {} for source {}, already stored as {}",
                    contentHash, sourceId, existing.get().getDocumentId());
            throw new DuplicateDocumentException(sourceId, contentHash, existing.get().getDocumentId());
        }

        String container = config.storage().rawContainer();
        String contentType = contentTypeFor(config.ingestion().fileFormat());
        RawDocument document = new RawDocument(sourceId, ingestionId, container, contentHash,
                contentType, content.length, clock.instant(), metadata);

        blobStorage.put(container, document.getBlobPath(), content, contentType);

        try {
            RawDocument saved = repository.saveAndFlush(document);
            log.info("Stored raw document {} for source {} at {}/{}",
                    saved.getDocumentId(), sourceId, container, saved.getBlobPath());
            return saved;
        } catch (DataAccessException e) {
            if (UniqueViolations.isUniqueViolation(e)) {
                log.info("Concurrent store of content {} for source {} lost the insert race",
                        contentHash, sourceId);
                throw new DuplicateDocumentException(sourceId, contentHash, null);
            }
            throw new StorageException("Failed to insert raw document metadata for source " + sourceId, e);
        }
    }

    public Optional<RawDocument> findByDocumentId(UUID documentId) {
        return repository.findById(documentId);
    }

    public Optional<RawDocument> findByContentHash(String sourceId, String contentHash) {
        return repository.findBySourceIdAndContentHash(sourceId, contentHash);
    }

    static String contentTypeFor(String fileFormat) {
        if (fileFormat == null) {
            return "application/octet-stream";
        }
        return switch (fileFormat.toLowerCase(Locale.ROOT)) {
            case "json" -> "application/json";
            case "zip" -> "application/zip";
            default -> "application/octet-stream";
        };
    }
}
