package proxyotel.trace.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.LinkedHashMap;
import java.util.Map;
import proxyotel.logging.LogLevel;

/** Applies the module's log verbosity to our own loggers and to the OpenTelemetry SDK's. */
final class LogbackLevelSwitcher implements LogLevelSwitcher {
  static final String[] LOGGER_NAMES = {"proxyotel", "io.opentelemetry"};

  private final LoggerContext context;
  // levels as configured before the first switch, null meaning inherited
  private final Map<String, Level> original = new LinkedHashMap<>();

  LogbackLevelSwitcher(LoggerContext context) {
    this.context = context;
  }

  @Override
  public synchronized void switchLevel(LogLevel level) {
    Level target = toLogback(level);
    for (String name : LOGGER_NAMES) {
      Logger logger = context.getLogger(name);
      if (!original.containsKey(name)) {
        original.put(name, logger.getLevel());
      }
      logger.setLevel(target);
    }
  }

  @Override
  public synchronized void restore() {
    for (Map.Entry<String, Level> entry : original.entrySet()) {
      context.getLogger(entry.getKey()).setLevel(entry.getValue());
    }
    original.clear();
  }

  static Level toLogback(LogLevel level) {
    switch (level) {
      case DEBUG:
        return Level.DEBUG;
      case WARN:
        return Level.WARN;
      case ERROR:
        return Level.ERROR;
      case INFO:
      default:
        return Level.INFO;
    }
  }
}
