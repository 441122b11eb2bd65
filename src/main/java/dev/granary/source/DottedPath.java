package dev.granary.source;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Lookup of {@code a.b.c} style paths through nested maps. */
public final class DottedPath {

  private DottedPath() {
    // utility class
  }

  /**
   * Follow {@code path} through nested maps.
   *
   * @return the value, or null when a step is missing or not a map
   */
  public static @Nullable Object resolve(@Nullable Map<String, ?> root, String path) {
    Object current = root;
    for (String key : path.split("\\.")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(key);
    }
    return current;
  }
}
