package dev.granary.storage;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Metadata record of one raw payload written to blob storage.
 *
 * <p>The unique constraint on {@code (source_id, content_hash)} is the only synchronisation between
 * concurrent writers of the same content: the loser of a race fails on insert. Records are
 * immutable once written and are never deleted here.
 *
 * <p>Maps to the {@code raw_documents} table managed by Flyway migrations.
 */
@Entity
@Table(name = "raw_documents",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_raw_documents_source_hash", columnNames = {"source_id", "content_hash"}),
        indexes = @Index(name = "idx_raw_documents_ingestion_id", columnList = "ingestion_id"))
public class RawDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "document_id")
    private UUID documentId;

    @Column(name = "source_id", nullable = false, updatable = false)
    private String sourceId;

    @Column(name = "ingestion_id", nullable = false, updatable = false)
    private UUID ingestionId;

    @Column(name = "blob_container", nullable = false, updatable = false)
    private String blobContainer;

    @Column(name = "blob_path", nullable = false, updatable = false)
    private String blobPath;

    @Column(name = "content_hash", nullable = false, updatable = false, length = 64)
    private String contentHash;

    @Column(name = "content_type", nullable = false, updatable = false)
    private String contentType;

    @Column(name = "size_bytes", nullable = false, updatable = false)
    private long sizeBytes;

    @Column(name = "stored_at", nullable = false, updatable = false)
    private Instant storedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> metadata = new HashMap<>();

    protected RawDocument() {
        // JPA requires no-arg constructor
    }

    public RawDocument(String sourceId, UUID ingestionId, String blobContainer, String contentHash,
                       String contentType, long sizeBytes, Instant storedAt,
                       Map<String, Object> metadata) {
        this.sourceId = sourceId;
        this.ingestionId = ingestionId;
        this.blobContainer = blobContainer;
        this.blobPath = blobPath(sourceId, ingestionId, contentHash);
        this.contentHash = contentHash;
        this.contentType = contentType;
        this.sizeBytes = sizeBytes;
        this.storedAt = storedAt;
        this.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
    }

    /** Blob path of a raw payload: {@code {source_id}/{ingestion_id}/{content_hash}}. */
    public static String blobPath(String sourceId, UUID ingestionId, String contentHash) {
        return sourceId + "/" + ingestionId + "/" + contentHash;
    }

    public UUID getDocumentId() {
        return documentId;
    }

    public String getSourceId() {
        return sourceId;
    }

    public UUID getIngestionId() {
        return ingestionId;
    }

    public String getBlobContainer() {
        return blobContainer;
    }

    public String getBlobPath() {
        return blobPath;
    }

    public String getContentHash() {
        return contentHash;
    }

    public String getContentType() {
        return contentType;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public Instant getStoredAt() {
        return storedAt;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Flat view used to build event payloads. Extracted metadata is exposed both under {@code
     * metadata} and, for correlation fields, under {@code linkage_fields}.
     */
    public Map<String, Object> toEventDocument() {
        Map<String, Object> document = new HashMap<>();
        document.put("document_id", String.valueOf(documentId));
        document.put("source_id", sourceId);
        document.put("ingestion_id", String.valueOf(ingestionId));
        document.put("blob_container", blobContainer);
        document.put("blob_path", blobPath);
        document.put("content_hash", contentHash);
        document.put("content_type", contentType);
        document.put("size_bytes", sizeBytes);
        document.put("stored_at", storedAt == null ? null : storedAt.toString());
        document.put("metadata", new HashMap<>(metadata));
        document.put("linkage_fields", new HashMap<>(metadata));
        return document;
    }
}
