package proxyotel.config;

import java.util.Locale;
import javax.annotation.Nullable;

/** Named sampling strategies a deployment can select. */
public enum SamplerStrategy {
  ALWAYS_ON("AlwaysOn"),
  /** Samples everything but never tells downstream services about the decision. */
  SILENT_ON("SilentOn"),
  ALWAYS_OFF("AlwaysOff"),
  PARENT_BASED("ParentBased");

  public final String displayName;

  SamplerStrategy(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Case insensitive lookup by display name or by the OpenTelemetry environment spelling.
   *
   * @return the matching strategy, or {@code null} when the name is not recognized
   */
  @Nullable
  public static SamplerStrategy fromString(String value) {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "alwayson":
      case "always_on":
        return ALWAYS_ON;
      case "silenton":
        return SILENT_ON;
      case "alwaysoff":
      case "always_off":
        return ALWAYS_OFF;
      case "parentbased":
      case "parentbased_always_on":
        return PARENT_BASED;
      default:
        return null;
    }
  }

  /** Whether the single-bit sampling decision header must be left out when injecting. */
  public boolean suppressesSamplingHeader() {
    return this == SILENT_ON;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
