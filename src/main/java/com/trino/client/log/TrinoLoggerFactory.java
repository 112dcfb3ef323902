package com.trino.client.log;

/**
 * Creates {@link TrinoLogger} instances. The backend is chosen by the {@value
 * #LOGGER_IMPL_PROPERTY} system property; SLF4J is used when it is absent or unrecognised.
 */
public class TrinoLoggerFactory {

  public static final String LOGGER_IMPL_PROPERTY = "trino.client.loggerImpl";

  enum LoggerImpl {
    SLF4JLOGGER,
    JDKLOGGER
  }

  private TrinoLoggerFactory() {
    // Utility class
  }

  public static TrinoLogger getLogger(Class<?> clazz) {
    if (resolveImpl() == LoggerImpl.JDKLOGGER) {
      return new JulLogger(clazz);
    }
    return new Slf4jLogger(clazz);
  }

  static LoggerImpl resolveImpl() {
    String configured = System.getProperty(LOGGER_IMPL_PROPERTY);
    if (configured == null) {
      return LoggerImpl.SLF4JLOGGER;
    }
    try {
      return LoggerImpl.valueOf(configured.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      return LoggerImpl.SLF4JLOGGER;
    }
  }
}
