package dev.granary.pull;

import dev.granary.source.DottedPath;
import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Builds pull request URLs from a base URL and templated query parameters.
 *
 * <p>Parameter values may contain {@code {item.<dotted.path>}} placeholders. With an iteration item
 * each placeholder is replaced by the value at that path, or by an empty string when the path does
 * not resolve. Without an item placeholders are left as they are.
 */
public final class RequestUrlBuilder {

  private static final Pattern ITEM_PLACEHOLDER = Pattern.compile("\\{item\\.([a-zA-Z0-9_.]+)}");

  private RequestUrlBuilder() {
    // utility class
  }

  /**
   * Build the full request URL.
   *
   * @param baseUrl URL without query, or with a query the parameters are appended to
   * @param parameters query parameters in order
   * @param item current iteration item, or null for a single pull
   * @return {@code baseUrl} alone when there are no parameters
   */
  public static String build(
      String baseUrl, Map<String, String> parameters, @Nullable Map<String, ?> item) {
    if (parameters.isEmpty()) {
      return baseUrl;
    }
    StringJoiner query = new StringJoiner("&");
    parameters.forEach(
        (name, value) ->
            query.add(encode(name) + "=" + encode(resolvePlaceholders(value, item))));
    return baseUrl + (baseUrl.contains("?") ? "&" : "?") + query;
  }

  /** Substitute {@code {item.<path>}} placeholders in a single value. */
  public static String resolvePlaceholders(@Nullable String value, @Nullable Map<String, ?> item) {
    if (value == null) {
      return "";
    }
    if (item == null) {
      return value;
    }
    Matcher matcher = ITEM_PLACEHOLDER.matcher(value);
    StringBuilder resolved = new StringBuilder();
    while (matcher.find()) {
      Object replacement = DottedPath.resolve(item, matcher.group(1));
      matcher.appendReplacement(
          resolved, Matcher.quoteReplacement(replacement == null ? "" : format(replacement)));
    }
    matcher.appendTail(resolved);
    return resolved.toString();
  }

  /** Item values come from JSON, so floating point numbers are written without exponent. */
  static String format(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    if ((value instanceof Double || value instanceof Float)
        && Double.isFinite(((Number) value).doubleValue())) {
      return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
    }
    return value.toString();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
