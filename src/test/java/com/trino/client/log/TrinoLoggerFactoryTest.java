package com.trino.client.log;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class TrinoLoggerFactoryTest {

  private final List<LogRecord> records = new ArrayList<>();
  private final Handler capture =
      new Handler() {
        @Override
        public void publish(LogRecord record) {
          records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };

  @AfterEach
  void tearDown() {
    System.clearProperty(TrinoLoggerFactory.LOGGER_IMPL_PROPERTY);
    Logger.getLogger(TrinoLoggerFactoryTest.class.getName()).removeHandler(capture);
  }

  @Test
  void testSlf4jIsDefault() {
    assertTrue(TrinoLoggerFactory.getLogger(TrinoLoggerFactoryTest.class) instanceof Slf4jLogger);
    System.setProperty(TrinoLoggerFactory.LOGGER_IMPL_PROPERTY, "log4j");
    assertEquals(TrinoLoggerFactory.LoggerImpl.SLF4JLOGGER, TrinoLoggerFactory.resolveImpl());
  }

  @Test
  void testJdkLoggerSelectedByProperty() {
    System.setProperty(TrinoLoggerFactory.LOGGER_IMPL_PROPERTY, " jdkLogger ");
    assertTrue(TrinoLoggerFactory.getLogger(TrinoLoggerFactoryTest.class) instanceof JulLogger);
  }

  @Test
  void testJulLoggerFormatsAndRecordsCaller() {
    Logger jul = Logger.getLogger(TrinoLoggerFactoryTest.class.getName());
    jul.setLevel(Level.FINE);
    jul.addHandler(capture);
    TrinoLogger logger = new JulLogger(TrinoLoggerFactoryTest.class);

    logger.debug("Query %s returned %d rows", "q1", 3);
    IllegalStateException failure = new IllegalStateException("boom");
    logger.error(failure, "Failed %s", "q2");
    logger.trace("not published");

    assertEquals(2, records.size());
    assertEquals("Query q1 returned 3 rows", records.get(0).getMessage());
    assertEquals(Level.FINE, records.get(0).getLevel());
    assertEquals("testJulLoggerFormatsAndRecordsCaller", records.get(0).getSourceMethodName());
    assertSame(failure, records.get(1).getThrown());
    assertTrue(logger.isDebugEnabled());
  }

  @Test
  void testMessageWithoutArgumentsIsNotFormatted() {
    assertEquals("100% done", JulLogger.formatMessage("100% done"));
  }

  @Test
  void testSlf4jFormatterLayout() {
    LogRecord record = new LogRecord(Level.WARNING, "Rollback on close failed");
    record.setSourceClassName("com.trino.client.api.impl.TrinoConnection");
    record.setSourceMethodName("close");
    String line = new Slf4jFormatter().format(record);
    assertTrue(
        line.endsWith(
            " WARN com.trino.client.api.impl.TrinoConnection#close - Rollback on close failed"
                + System.lineSeparator()),
        line);
  }

  @Test
  void testSlf4jFormatterAppendsStackTrace() {
    LogRecord record = new LogRecord(Level.SEVERE, "Commit failed");
    record.setSourceClassName("com.trino.client.api.impl.TrinoConnection");
    record.setSourceMethodName("commit");
    record.setThrown(new IllegalStateException("conflict"));
    String[] lines = new Slf4jFormatter().format(record).split(System.lineSeparator());
    assertTrue(lines[0].contains(" ERROR "), lines[0]);
    assertEquals("java.lang.IllegalStateException: conflict", lines[1]);
    assertTrue(lines[2].trim().startsWith("at "), lines[2]);
  }

  @Test
  void testSlf4jLevelNames() {
    assertEquals("TRACE", Slf4jFormatter.levelName(Level.FINEST));
    assertEquals("DEBUG", Slf4jFormatter.levelName(Level.FINE));
    assertEquals("INFO", Slf4jFormatter.levelName(Level.INFO));
    assertEquals("WARN", Slf4jFormatter.levelName(Level.WARNING));
    assertEquals("ERROR", Slf4jFormatter.levelName(Level.SEVERE));
  }

  @Test
  void testJulBackendInstallsConsoleHandlerWithSlf4jLayout() {
    Logger root = Logger.getLogger("com.trino.client.log.install." + System.nanoTime());
    JulLogger.installDefaultHandler(root);
    assertEquals(1, root.getHandlers().length);
    assertTrue(root.getHandlers()[0].getFormatter() instanceof Slf4jFormatter);
    assertFalse(root.getUseParentHandlers());

    JulLogger.installDefaultHandler(root);
    assertEquals(1, root.getHandlers().length);
  }

  @Test
  void testJulBackendKeepsApplicationHandlers() {
    Logger root = Logger.getLogger("com.trino.client.log.configured." + System.nanoTime());
    root.addHandler(capture);
    JulLogger.installDefaultHandler(root);
    assertArrayEquals(new Handler[] {capture}, root.getHandlers());
    assertTrue(root.getUseParentHandlers());
  }
}
