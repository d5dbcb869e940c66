package proxyotel.trace.logging;

import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proxyotel.logging.LogLevel;

/** Switches the levels of whichever SLF4J binding is on the classpath, when it supports it. */
public final class GlobalLogLevelSwitcher implements LogLevelSwitcher {
  private static final String LOGBACK_CONTEXT = "ch.qos.logback.classic.LoggerContext";

  private static volatile LogLevelSwitcher INSTANCE = null;

  public static LogLevelSwitcher get() {
    LogLevelSwitcher switcher = INSTANCE;
    if (switcher == null) {
      ILoggerFactory factory = LoggerFactory.getILoggerFactory();
      INSTANCE = switcher = new GlobalLogLevelSwitcher(factory);
    }
    return switcher;
  }

  private final Logger log;
  private final LogLevelSwitcher delegate;

  GlobalLogLevelSwitcher(ILoggerFactory factory) {
    log = factory.getLogger(GlobalLogLevelSwitcher.class.getName());
    if (LOGBACK_CONTEXT.equals(factory.getClass().getName())) {
      // only touch logback classes once we know the binding is there
      delegate = new LogbackLevelSwitcher((LoggerContext) factory);
    } else {
      log.warn(
          "Unable to switch log levels with {}, keeping the logging configuration as is",
          factory.getClass().getSimpleName());
      delegate = null;
    }
  }

  @Override
  public void switchLevel(LogLevel level) {
    if (delegate != null) {
      delegate.switchLevel(level);
    }
  }

  @Override
  public void restore() {
    if (delegate != null) {
      delegate.restore();
    }
  }
}
