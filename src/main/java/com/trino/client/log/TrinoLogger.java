package com.trino.client.log;

/**
 * Logging facade used throughout the client. Formatted variants take {@link String#format}
 * patterns regardless of the backend selected by {@link TrinoLoggerFactory}.
 */
public interface TrinoLogger {

  void trace(String message);

  void trace(String format, Object... arguments);

  void debug(String message);

  void debug(String format, Object... arguments);

  void info(String message);

  void info(String format, Object... arguments);

  void warn(String message);

  void warn(String format, Object... arguments);

  void error(String message);

  void error(String format, Object... arguments);

  /** Logs an error with the stack trace of {@code throwable}. */
  void error(Throwable throwable, String format, Object... arguments);

  boolean isDebugEnabled();
}
