package proxyotel.trace.logging;

import proxyotel.logging.LogLevel;

/** Enables runtime switching of LogLevel. */
public interface LogLevelSwitcher {

  /**
   * Switch the current LogLevel to a new LogLevel
   *
   * @param level the LogLevel to switch to
   */
  void switchLevel(LogLevel level);

  /** Restore the LogLevel to the original setting. */
  void restore();
}
