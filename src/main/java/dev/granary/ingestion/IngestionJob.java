package dev.granary.ingestion;

import dev.granary.source.TriggerMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * One accepted ingestion trigger. Immutable; the queue keeps its processing status separately.
 *
 * <p>The idempotency key depends on the trigger mode:
 *
 * <ul>
 *   <li>{@code blob_trigger}: {@code blob:{blob_path}#{etag}}, so a redelivered notification for
 *       the same blob version is rejected while a new upload to the same path is accepted
 *   <li>{@code scheduled_pull}: {@code content:{source_id}:{content_hash}}, since a pulled payload
 *       has no etag; {@code blobEtag} then holds the content hash
 * </ul>
 *
 * @param ingestionId generated identifier
 * @param sourceId owning source
 * @param triggerMode how the job was triggered
 * @param container landing container, or the raw container for pulled payloads
 * @param blobPath path inside {@code container}
 * @param blobEtag blob etag, or content hash for pulled payloads
 * @param contentLength payload size in bytes
 * @param metadata fields extracted from the path pattern or the iteration item
 * @param traceId correlation id carried through logs and events
 */
public record IngestionJob(
    UUID ingestionId,
    String sourceId,
    TriggerMode triggerMode,
    String container,
    String blobPath,
    String blobEtag,
    long contentLength,
    Map<String, Object> metadata,
    String traceId) {

  public IngestionJob {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Job for a blob-created notification. */
  public static IngestionJob forBlob(
      String sourceId,
      String container,
      String blobPath,
      String etag,
      long contentLength,
      Map<String, ?> metadata,
      @Nullable String traceId) {
    return new IngestionJob(
        UUID.randomUUID(),
        sourceId,
        TriggerMode.BLOB_TRIGGER,
        container,
        blobPath,
        etag,
        contentLength,
        copy(metadata),
        traceId == null ? UUID.randomUUID().toString() : traceId);
  }

  /**
   * Job for a pulled payload already written to the raw container.
   *
   * @param ingestionId the id the payload was stored under
   */
  public static IngestionJob forPull(
      UUID ingestionId,
      String sourceId,
      String rawContainer,
      String rawBlobPath,
      String contentHash,
      long contentLength,
      Map<String, ?> metadata,
      String traceId) {
    return new IngestionJob(
        ingestionId,
        sourceId,
        TriggerMode.SCHEDULED_PULL,
        rawContainer,
        rawBlobPath,
        contentHash,
        contentLength,
        copy(metadata),
        traceId);
  }

  /** Key under which the queue admits this job at most once. */
  public String idempotencyKey() {
    return switch (triggerMode) {
      case BLOB_TRIGGER -> "blob:" + blobPath + "#" + blobEtag;
      case SCHEDULED_PULL -> "content:" + sourceId + ":" + blobEtag;
    };
  }

  private static Map<String, Object> copy(Map<String, ?> metadata) {
    return metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
  }
}
