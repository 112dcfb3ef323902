package com.trino.client.log;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Renders {@code java.util.logging} records the way the SLF4J backend prints them: {@code
 * timestamp LEVEL class#method - message}, with SLF4J level names and the stack trace of the
 * attached throwable, if any, on the following lines.
 */
public class Slf4jFormatter extends Formatter {

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS z").withZone(ZoneId.systemDefault());

  @Override
  public String format(LogRecord record) {
    StringBuilder line =
        new StringBuilder()
            .append(TIMESTAMP.format(Instant.ofEpochMilli(record.getMillis())))
            .append(' ')
            .append(levelName(record.getLevel()))
            .append(' ')
            .append(record.getSourceClassName())
            .append('#')
            .append(record.getSourceMethodName())
            .append(" - ")
            .append(formatMessage(record))
            .append(System.lineSeparator());
    if (record.getThrown() != null) {
      StringWriter trace = new StringWriter();
      record.getThrown().printStackTrace(new PrintWriter(trace));
      line.append(trace);
    }
    return line.toString();
  }

  static String levelName(Level level) {
    int value = level.intValue();
    if (value >= Level.SEVERE.intValue()) {
      return "ERROR";
    }
    if (value >= Level.WARNING.intValue()) {
      return "WARN";
    }
    if (value >= Level.INFO.intValue()) {
      return "INFO";
    }
    if (value >= Level.FINE.intValue()) {
      return "DEBUG";
    }
    return "TRACE";
  }
}
