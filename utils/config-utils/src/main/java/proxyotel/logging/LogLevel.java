package proxyotel.logging;

import java.util.Locale;
import javax.annotation.Nullable;

/** Log level enum. */
public enum LogLevel {
  DEBUG,
  INFO,
  WARN,
  ERROR;

  /**
   * Case insensitive conversion from {@link String} to {@link LogLevel}.
   *
   * <p>Besides the level names, {@code trace} maps to {@link #DEBUG}, {@code warning} to {@link
   * #WARN}, and both {@code fatal} and {@code none} to {@link #ERROR}.
   *
   * @param level the {@link LogLevel} as a {@link String}
   * @return the corresponding {@link LogLevel}, or {@code null} when the name is not recognized
   */
  @Nullable
  public static LogLevel fromString(String level) {
    switch (level.trim().toLowerCase(Locale.ROOT)) {
      case "trace":
      case "debug":
        return DEBUG;
      case "info":
        return INFO;
      case "warn":
      case "warning":
        return WARN;
      case "error":
      case "fatal":
      case "none":
        return ERROR;
      default:
        return null;
    }
  }
}
