package dev.granary.source;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts named fields from a blob path using a {@link PathPattern}.
 *
 * <p>Each {@code {name}} placeholder matches one path segment part ({@code [^/]+}); everything else
 * in the template matches literally. The whole path must match. Only fields listed in {@code
 * extract_fields} are returned, and a path that does not match yields an empty map.
 */
public final class PathMetadataExtractor {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");

  private static final Map<String, CompiledPattern> CACHE = new ConcurrentHashMap<>();

  private PathMetadataExtractor() {
    // utility class
  }

  /**
   * Extract metadata from {@code blobPath}.
   *
   * @param blobPath path inside the container, without leading slash
   * @param pathPattern the source's pattern, may be null
   * @return extracted fields in pattern order, empty when nothing matches
   */
  public static Map<String, String> extract(String blobPath, PathPattern pathPattern) {
    if (pathPattern == null || pathPattern.pattern() == null || pathPattern.pattern().isBlank()) {
      return Map.of();
    }
    CompiledPattern compiled =
        CACHE.computeIfAbsent(pathPattern.pattern(), PathMetadataExtractor::compile);
    Matcher matcher = compiled.regex().matcher(blobPath);
    if (!matcher.matches()) {
      return Map.of();
    }

    Map<String, String> metadata = new LinkedHashMap<>();
    for (int i = 0; i < compiled.names().size(); i++) {
      String name = compiled.names().get(i);
      if (pathPattern.extractFields().contains(name)) {
        metadata.putIfAbsent(name, matcher.group(i + 1));
      }
    }
    return metadata;
  }

  // Java group names do not allow underscores, so placeholders become positional groups.
  private static CompiledPattern compile(String template) {
    List<String> names = new ArrayList<>();
    StringBuilder regex = new StringBuilder();
    Matcher matcher = PLACEHOLDER.matcher(template);
    int last = 0;
    while (matcher.find()) {
      if (matcher.start() > last) {
        regex.append(Pattern.quote(template.substring(last, matcher.start())));
      }
      regex.append("([^/]+)");
      names.add(matcher.group(1));
      last = matcher.end();
    }
    if (last < template.length()) {
      regex.append(Pattern.quote(template.substring(last)));
    }
    return new CompiledPattern(Pattern.compile(regex.toString()), List.copyOf(names));
  }

  private record CompiledPattern(Pattern regex, List<String> names) {}
}
