package proxyotel.config;

import java.util.Locale;
import javax.annotation.Nullable;

/** Header formats used to carry trace context between services. */
public enum PropagationStyle {
  W3C("w3c"),
  JAEGER("jaeger"),
  ZIPKIN("zipkin");

  public final String displayName;

  PropagationStyle(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Case insensitive lookup by display name or by the OpenTelemetry environment spelling.
   *
   * @return the matching style, or {@code null} when the name is not recognized
   */
  @Nullable
  public static PropagationStyle fromString(String value) {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "w3c":
      case "tracecontext":
        return W3C;
      case "jaeger":
        return JAEGER;
      case "zipkin":
      case "b3":
      case "b3multi":
        return ZIPKIN;
      default:
        return null;
    }
  }

  /**
   * Picks the first recognized entry of a comma-separated list, as found in {@code
   * OTEL_PROPAGATORS}.
   */
  @Nullable
  public static PropagationStyle fromList(String values) {
    int start = 0;
    while (start < values.length()) {
      int end = values.indexOf(',', start);
      if (end < 0) {
        end = values.length();
      }
      if (end > start) {
        PropagationStyle style = fromString(values.substring(start, end));
        if (style != null) {
          return style;
        }
      }
      start = end + 1;
    }
    return null;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
