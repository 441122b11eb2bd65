package dev.granary.pull;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one scheduler trigger.
 *
 * @param sourceId triggered source
 * @param success true unless the run could not start or every item failed
 * @param fetched payloads fetched and stored
 * @param failed items whose fetch or store failed
 * @param duplicates payloads already stored
 * @param message reason when the run did not execute
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PullJobResult(
    String sourceId,
    boolean success,
    int fetched,
    int failed,
    int duplicates,
    @Nullable String message) {

  static PullJobResult notRun(String sourceId, String message) {
    return new PullJobResult(sourceId, false, 0, 0, 0, message);
  }

  static PullJobResult of(PullRun run) {
    boolean success = run.fetched() > 0 || run.failed() == 0;
    return new PullJobResult(
        run.sourceId(), success, run.fetched(), run.failed(), run.duplicates(), null);
  }
}
