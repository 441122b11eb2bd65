package dev.granary.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A recurring job as the scheduler reports it.
 *
 * @param name job name derived from the source id
 * @param schedule cron expression or {@code @every <duration>}
 * @param data payload delivered with each trigger, carries {@code source_id}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduledJob(String name, @Nullable String schedule, Map<String, Object> data) {

  public ScheduledJob {
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public @Nullable String sourceId() {
    Object sourceId = data.get("source_id");
    return sourceId == null ? null : sourceId.toString();
  }
}
