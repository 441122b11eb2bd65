package dev.granary.ingestion;

import dev.granary.source.TriggerMode;
import dev.granary.storage.UniqueViolations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotent admission of ingestion jobs.
 *
 * <p>This is the single point that turns a trigger into at most one job. The check is the unique
 * index on {@code idempotency_key}: the insert either succeeds (first sighting) or violates the
 * constraint (already admitted), so concurrent redeliveries cannot both get through. There is no
 * read-before-write.
 *
 * <p>Consumers use {@link #findPending(int)}, {@link #claim(UUID)} and the {@code mark*} methods to
 * move a job through {@link JobStatus}; the job value itself never changes. A claim is a lease:
 * {@link #requeueExpiredClaims(Duration)} returns jobs whose consumer never finished them to the
 * queue.
 */
@Service
public class IngestionQueue {

    private static final Logger log = LoggerFactory.getLogger(IngestionQueue.class);

    private final IngestionJobRepository repository;
    private final Clock clock;
    private final IngestionMetrics metrics;

    public IngestionQueue(IngestionJobRepository repository, Clock clock, IngestionMetrics metrics) {
        this.repository = repository;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Admit a job awaiting processing.
     *
     * @return true on first sighting of the job's idempotency key, false for a duplicate
     */
    public boolean queueJob(IngestionJob job) {
        return admit(job, JobStatus.QUEUED);
    }

    /**
     * Admit a job whose payload was already written to the raw document store.
     *
     * @return true on first sighting of the job's idempotency key, false for a duplicate
     */
    public boolean queueStoredJob(IngestionJob job, UUID rawDocumentId) {
        IngestionJobEntity entity = new IngestionJobEntity(job, JobStatus.STORED, clock.instant());
        entity.complete(JobStatus.STORED, rawDocumentId, null, clock.instant());
        return insert(entity);
    }

    /** Whether a job with this idempotency key was ever admitted. */
    public boolean isAdmitted(String idempotencyKey) {
        return repository.existsByIdempotencyKey(idempotencyKey);
    }

    /** Oldest {@code QUEUED} blob-trigger jobs, at most {@code limit}. */
    public List<IngestionJob> findPending(int limit) {
        return repository.findByStatusAndTriggerModeOrderByCreatedAtAsc(
                        JobStatus.QUEUED, TriggerMode.BLOB_TRIGGER, PageRequest.of(0, limit))
                .stream()
                .map(IngestionJobEntity::toJob)
                .toList();
    }

    public Optional<IngestionJobEntity> findByIngestionId(UUID ingestionId) {
        return repository.findById(ingestionId);
    }

    /**
     * Move a job from QUEUED to PROCESSING.
     *
     * @return false if the job is unknown or another consumer claimed it first
     */
    public boolean claim(UUID ingestionId) {
        return repository.claim(ingestionId, JobStatus.QUEUED, JobStatus.PROCESSING, clock.instant()) == 1;
    }

    /**
     * Put PROCESSING jobs claimed longer than {@code claimTimeout} ago back to QUEUED.
     *
     * @return number of jobs re-queued
     */
    public int requeueExpiredClaims(Duration claimTimeout) {
        Instant claimedBefore = clock.instant().minus(claimTimeout);
        int requeued = repository.releaseExpiredClaims(JobStatus.PROCESSING, JobStatus.QUEUED, claimedBefore);
        if (requeued > 0) {
            log.warn("Re-queued {} ingestion jobs claimed before {}", requeued, claimedBefore);
            metrics.jobsRequeued(requeued);
        }
        return requeued;
    }

    @Transactional
    public boolean markStored(UUID ingestionId, UUID rawDocumentId) {
        return complete(ingestionId, JobStatus.STORED, rawDocumentId, null);
    }

    @Transactional
    public boolean markDuplicate(UUID ingestionId) {
        return complete(ingestionId, JobStatus.DUPLICATE, null, null);
    }

    @Transactional
    public boolean markFailed(UUID ingestionId, String errorMessage) {
        return complete(ingestionId, JobStatus.FAILED, null, errorMessage);
    }

    private boolean admit(IngestionJob job, JobStatus status) {
        return insert(new IngestionJobEntity(job, status, clock.instant()));
    }

    private boolean insert(IngestionJobEntity entity) {
        try {
            repository.saveAndFlush(entity);
            log.info("Queued ingestion job {} for source {} ({})",
                    entity.getIngestionId(), entity.getSourceId(), entity.getIdempotencyKey());
            metrics.jobAdmitted(entity.getSourceId(), entity.getTriggerMode());
            return true;
        } catch (DataIntegrityViolationException e) {
            if (!UniqueViolations.isUniqueViolation(e)) {
                throw e;
            }
            log.info("Duplicate ingestion trigger for source {} ({}), not queued",
                    entity.getSourceId(), entity.getIdempotencyKey());
            metrics.jobDuplicate(entity.getSourceId(), entity.getTriggerMode());
            return false;
        }
    }

    private boolean complete(UUID ingestionId, JobStatus status, UUID rawDocumentId, String error) {
        Optional<IngestionJobEntity> entity = repository.findById(ingestionId);
        if (entity.isEmpty()) {
            log.warn("Cannot mark unknown ingestion job {} as {}", ingestionId, status);
            return false;
        }
        if (entity.get().getStatus().isTerminal()) {
            log.warn("Ingestion job {} already {}, not marking {}", ingestionId, entity.get().getStatus(), status);
            return false;
        }
        entity.get().complete(status, rawDocumentId, error, clock.instant());
        repository.save(entity.get());
        return true;
    }
}
