package com.trino.client.log;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * {@link TrinoLogger} backed by {@code java.util.logging}. Unless the application configured
 * handlers for {@value #ROOT_LOGGER_NAME} itself, records go to the console through {@link
 * Slf4jFormatter}.
 */
public class JulLogger implements TrinoLogger {

  static final String ROOT_LOGGER_NAME = "com.trino.client";

  // strong reference, JUL only keeps loggers weakly
  private static final Logger ROOT_LOGGER = Logger.getLogger(ROOT_LOGGER_NAME);
  private static final AtomicBoolean HANDLER_INSTALLED = new AtomicBoolean(false);

  private final Logger logger;
  private final String sourceClassName;

  public JulLogger(Class<?> clazz) {
    this.logger = Logger.getLogger(clazz.getName());
    this.sourceClassName = clazz.getName();
    if (HANDLER_INSTALLED.compareAndSet(false, true)) {
      installDefaultHandler(ROOT_LOGGER);
    }
  }

  /** Adds a console handler using {@link Slf4jFormatter} when {@code root} has no handler. */
  static void installDefaultHandler(Logger root) {
    if (root.getHandlers().length > 0) {
      return;
    }
    Handler console = new ConsoleHandler();
    console.setFormatter(new Slf4jFormatter());
    console.setLevel(Level.ALL);
    root.addHandler(console);
    root.setUseParentHandlers(false);
  }

  static String formatMessage(String format, Object... arguments) {
    if (arguments == null || arguments.length == 0) {
      return format;
    }
    return String.format(format, arguments);
  }

  private void log(Level level, String message, Throwable throwable) {
    if (!logger.isLoggable(level)) {
      return;
    }
    LogRecord record = new LogRecord(level, message);
    record.setLoggerName(logger.getName());
    record.setSourceClassName(sourceClassName);
    record.setSourceMethodName(callerMethodName());
    record.setThrown(throwable);
    logger.log(record);
  }

  private String callerMethodName() {
    StackTraceElement[] stackTrace = new Throwable().getStackTrace();
    for (StackTraceElement element : stackTrace) {
      if (element.getClassName().equals(sourceClassName)) {
        return element.getMethodName();
      }
    }
    return null;
  }

  @Override
  public void trace(String message) {
    log(Level.FINEST, message, null);
  }

  @Override
  public void trace(String format, Object... arguments) {
    log(Level.FINEST, formatMessage(format, arguments), null);
  }

  @Override
  public void debug(String message) {
    log(Level.FINE, message, null);
  }

  @Override
  public void debug(String format, Object... arguments) {
    log(Level.FINE, formatMessage(format, arguments), null);
  }

  @Override
  public void info(String message) {
    log(Level.INFO, message, null);
  }

  @Override
  public void info(String format, Object... arguments) {
    log(Level.INFO, formatMessage(format, arguments), null);
  }

  @Override
  public void warn(String message) {
    log(Level.WARNING, message, null);
  }

  @Override
  public void warn(String format, Object... arguments) {
    log(Level.WARNING, formatMessage(format, arguments), null);
  }

  @Override
  public void error(String message) {
    log(Level.SEVERE, message, null);
  }

  @Override
  public void error(String format, Object... arguments) {
    log(Level.SEVERE, formatMessage(format, arguments), null);
  }

  @Override
  public void error(Throwable throwable, String format, Object... arguments) {
    log(Level.SEVERE, formatMessage(format, arguments), throwable);
  }

  @Override
  public boolean isDebugEnabled() {
    return logger.isLoggable(Level.FINE);
  }
}
