package com.trino.client.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link TrinoLogger} backed by SLF4J. */
public class Slf4jLogger implements TrinoLogger {

  private final Logger logger;

  public Slf4jLogger(Class<?> clazz) {
    this.logger = LoggerFactory.getLogger(clazz);
  }

  public Slf4jLogger(String name) {
    this.logger = LoggerFactory.getLogger(name);
  }

  @Override
  public void trace(String message) {
    logger.trace(message);
  }

  @Override
  public void trace(String format, Object... arguments) {
    if (logger.isTraceEnabled()) {
      logger.trace(JulLogger.formatMessage(format, arguments));
    }
  }

  @Override
  public void debug(String message) {
    logger.debug(message);
  }

  @Override
  public void debug(String format, Object... arguments) {
    if (logger.isDebugEnabled()) {
      logger.debug(JulLogger.formatMessage(format, arguments));
    }
  }

  @Override
  public void info(String message) {
    logger.info(message);
  }

  @Override
  public void info(String format, Object... arguments) {
    if (logger.isInfoEnabled()) {
      logger.info(JulLogger.formatMessage(format, arguments));
    }
  }

  @Override
  public void warn(String message) {
    logger.warn(message);
  }

  @Override
  public void warn(String format, Object... arguments) {
    if (logger.isWarnEnabled()) {
      logger.warn(JulLogger.formatMessage(format, arguments));
    }
  }

  @Override
  public void error(String message) {
    logger.error(message);
  }

  @Override
  public void error(String format, Object... arguments) {
    if (logger.isErrorEnabled()) {
      logger.error(JulLogger.formatMessage(format, arguments));
    }
  }

  @Override
  public void error(Throwable throwable, String format, Object... arguments) {
    if (logger.isErrorEnabled()) {
      logger.error(JulLogger.formatMessage(format, arguments), throwable);
    }
  }

  @Override
  public boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
