package dev.granary.gateway;

import dev.granary.ingestion.IngestionJob;
import dev.granary.source.PathMetadataExtractor;
import dev.granary.source.SourceConfig;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Turns a blob-created notification for a matched source into an {@link IngestionJob}.
 *
 * <p>Pure function of its inputs; the gateway decides beforehand whether the source accepts the
 * event.
 */
final class BlobTriggerStrategy {

  private BlobTriggerStrategy() {
    // utility class
  }

  static IngestionJob toJob(
      SourceConfig config,
      BlobSubject subject,
      String etag,
      long contentLength,
      @Nullable String traceId) {
    Map<String, String> metadata =
        PathMetadataExtractor.extract(subject.blobPath(), config.ingestion().pathPattern());
    return IngestionJob.forBlob(
        config.sourceId(),
        subject.container(),
        subject.blobPath(),
        etag,
        contentLength,
        metadata,
        traceId);
  }
}
