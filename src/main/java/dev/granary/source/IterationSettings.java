package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Describes a pull that runs once per item of an externally provided list.
 *
 * <p>The list comes from a tool exposed by another service ({@code sourceMcp}/{@code sourceTool}),
 * optionally nested under {@code resultPath}. Fields named in {@code injectLinkage} are copied from
 * each item into the stored document's metadata.
 *
 * @param foreach label of the iterated entity, used only for logging
 * @param sourceMcp application id of the service exposing the tool
 * @param sourceTool tool name
 * @param toolArguments JSON arguments sent to the tool
 * @param resultPath dotted path to the list inside the tool response
 * @param injectLinkage item fields propagated as linkage metadata
 * @param concurrency maximum parallel fetches, defaults to 5
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IterationSettings(
    @Nullable String foreach,
    String sourceMcp,
    String sourceTool,
    Map<String, Object> toolArguments,
    @Nullable String resultPath,
    List<String> injectLinkage,
    int concurrency) {

  public static final int DEFAULT_CONCURRENCY = 5;

  public IterationSettings {
    toolArguments = toolArguments == null ? Map.of() : Map.copyOf(toolArguments);
    injectLinkage = injectLinkage == null ? List.of() : List.copyOf(injectLinkage);
    if (concurrency <= 0) {
      concurrency = DEFAULT_CONCURRENCY;
    }
  }
}
