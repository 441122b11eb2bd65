package dev.granary.ingestion;

import dev.granary.source.TriggerMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Queue record of an {@link IngestionJob}.
 *
 * <p>The job fields are written once. Only the bookkeeping columns ({@code status}, {@code
 * claimed_at}, {@code raw_document_id}, {@code error_message}, {@code processed_at}) change
 * afterwards. The unique
 * constraint on {@code idempotency_key} is what makes admission idempotent.
 *
 * <p>The id is assigned by the caller, so {@link Persistable} tells Spring Data that a fresh
 * instance is new and must be inserted rather than merged.
 *
 * <p>Maps to the {@code ingestion_jobs} table managed by Flyway migrations.
 */
@Entity
@Table(name = "ingestion_jobs", uniqueConstraints =
    @UniqueConstraint(name = "uq_ingestion_jobs_idempotency_key", columnNames = "idempotency_key")
)
public class IngestionJobEntity implements Persistable<UUID> {

    @Id
    @Column(name = "ingestion_id")
    private UUID ingestionId;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "source_id", nullable = false, updatable = false)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_mode", nullable = false, updatable = false)
    private TriggerMode triggerMode;

    @Column(name = "container", nullable = false, updatable = false)
    private String container;

    @Column(name = "blob_path", nullable = false, updatable = false)
    private String blobPath;

    @Column(name = "blob_etag", nullable = false, updatable = false)
    private String blobEtag;

    @Column(name = "content_length", nullable = false, updatable = false)
    private long contentLength;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "trace_id", nullable = false, updatable = false)
    private String traceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status;

    @Column(name = "raw_document_id")
    private UUID rawDocumentId;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Transient
    private boolean isNew = true;

    protected IngestionJobEntity() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a queue record for a job.
     *
     * @param job       the immutable job value
     * @param status    initial status, {@link JobStatus#QUEUED} unless the payload is already stored
     * @param createdAt admission time
     */
    public IngestionJobEntity(IngestionJob job, JobStatus status, Instant createdAt) {
        this.ingestionId = job.ingestionId();
        this.idempotencyKey = job.idempotencyKey();
        this.sourceId = job.sourceId();
        this.triggerMode = job.triggerMode();
        this.container = job.container();
        this.blobPath = job.blobPath();
        this.blobEtag = job.blobEtag();
        this.contentLength = job.contentLength();
        this.metadata = new HashMap<>(job.metadata());
        this.traceId = job.traceId();
        this.status = status;
        this.createdAt = createdAt;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    @Override
    public UUID getId() {
        return ingestionId;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    /** The immutable job value this record was created from. */
    public IngestionJob toJob() {
        return new IngestionJob(ingestionId, sourceId, triggerMode, container, blobPath, blobEtag,
                contentLength, metadata, traceId);
    }

    void complete(JobStatus terminal, UUID documentId, String error, Instant at) {
        this.status = terminal;
        this.rawDocumentId = documentId;
        this.errorMessage = error;
        this.processedAt = at;
    }

    public UUID getIngestionId() {
        return ingestionId;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public String getSourceId() {
        return sourceId;
    }

    public TriggerMode getTriggerMode() {
        return triggerMode;
    }

    public JobStatus getStatus() {
        return status;
    }

    public UUID getRawDocumentId() {
        return rawDocumentId;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }
}
