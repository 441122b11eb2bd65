package dev.granary.events;

import dev.granary.source.DottedPath;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds event payloads from a document map.
 *
 * <p>A dotted field such as {@code location.region} is looked up through nested maps and stored
 * under {@code location_region}. A plain field is read from the document first, then from its
 * {@code linkage_fields} map. Fields that resolve to nothing are left out.
 */
public final class EventPayloadExtractor {

  static final String LINKAGE_FIELDS = "linkage_fields";

  private EventPayloadExtractor() {
    // utility class
  }

  public static Map<String, Object> extract(Map<String, ?> document, List<String> payloadFields) {
    Map<String, Object> payload = new LinkedHashMap<>();
    for (String field : payloadFields) {
      if (field.contains(".")) {
        Object value = DottedPath.resolve(document, field);
        if (value != null) {
          payload.put(field.replace('.', '_'), value);
        }
        continue;
      }
      Object value = document.get(field);
      if (value == null && document.get(LINKAGE_FIELDS) instanceof Map<?, ?> linkage) {
        value = linkage.get(field);
      }
      if (value != null) {
        payload.put(field, value);
      }
    }
    return payload;
  }
}
