package dev.granary.ingestion;

import dev.granary.source.TriggerMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link IngestionJobEntity} queue records. */
public interface IngestionJobRepository extends JpaRepository<IngestionJobEntity, UUID> {

  Optional<IngestionJobEntity> findByIdempotencyKey(String idempotencyKey);

  boolean existsByIdempotencyKey(String idempotencyKey);

  /** Oldest jobs first, for queue consumers. */
  List<IngestionJobEntity> findByStatusAndTriggerModeOrderByCreatedAtAsc(
      JobStatus status, TriggerMode triggerMode, Pageable pageable);

  /**
   * Compare-and-set on the status column that also stamps the claim time. Returns the number of
   * updated rows, so exactly one of several concurrent consumers sees 1.
   */
  @Transactional
  @Modifying(clearAutomatically = true)
  @Query(
      "update IngestionJobEntity j set j.status = :to, j.claimedAt = :claimedAt "
          + "where j.ingestionId = :ingestionId and j.status = :from")
  int claim(
      @Param("ingestionId") UUID ingestionId,
      @Param("from") JobStatus from,
      @Param("to") JobStatus to,
      @Param("claimedAt") Instant claimedAt);

  /** Moves every job claimed before {@code claimedBefore} and still in {@code from} back to {@code to}. */
  @Transactional
  @Modifying(clearAutomatically = true)
  @Query(
      "update IngestionJobEntity j set j.status = :to, j.claimedAt = null "
          + "where j.status = :from and j.claimedAt < :claimedBefore")
  int releaseExpiredClaims(
      @Param("from") JobStatus from,
      @Param("to") JobStatus to,
      @Param("claimedBefore") Instant claimedBefore);
}
