package com.trino.client.api.impl;

import com.google.common.io.BaseEncoding;
import com.trino.client.api.ITrinoTemporal;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoValidationException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Renders bound parameter values as Trino SQL literals for {@code EXECUTE ... USING}. */
public final class ParameterFormatter {

  private static final DateTimeFormatter OFFSET_FORMAT = DateTimeFormatter.ofPattern("xxx");

  private ParameterFormatter() {}

  public static String format(Object value) throws TrinoValidationException {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof Boolean) {
      return ((Boolean) value) ? "true" : "false";
    }
    if (value instanceof Byte
        || value instanceof Short
        || value instanceof Integer
        || value instanceof Long
        || value instanceof BigInteger) {
      return value.toString();
    }
    if (value instanceof BigDecimal) {
      return "DECIMAL '" + ((BigDecimal) value).toPlainString() + "'";
    }
    if (value instanceof Double) {
      return formatDouble((Double) value);
    }
    if (value instanceof Float) {
      return formatFloat((Float) value);
    }
    if (value instanceof String) {
      return quote((String) value);
    }
    if (value instanceof byte[]) {
      return "X'" + BaseEncoding.base16().encode((byte[]) value) + "'";
    }
    if (value instanceof ITrinoTemporal) {
      ITrinoTemporal<?> temporal = (ITrinoTemporal<?>) value;
      return temporal.getTypeKeyword() + " '" + temporal.toWireLiteral() + "'";
    }
    String temporal = formatJavaTime(value);
    if (temporal != null) {
      return temporal;
    }
    if (value instanceof UUID) {
      return "UUID '" + value + "'";
    }
    if (value instanceof TrinoStruct) {
      return "ROW(" + formatAll(((TrinoStruct) value).getValues()) + ")";
    }
    if (value instanceof List) {
      return "ARRAY[" + formatAll((List<?>) value) + "]";
    }
    if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      List<Object> keys = new ArrayList<>(map.keySet());
      List<Object> values = new ArrayList<>(map.size());
      for (Object key : keys) {
        values.add(map.get(key));
      }
      return "MAP(" + format(keys) + ", " + format(values) + ")";
    }
    throw new TrinoValidationException(
        String.format(
            "Query parameter of type '%s' is not supported", value.getClass().getName()),
        TrinoDriverErrorCode.INVALID_ARGUMENT);
  }

  /** Comma separated literals of the given values, in order. */
  public static String formatAll(List<?> values) throws TrinoValidationException {
    List<String> literals = new ArrayList<>(values.size());
    for (Object value : values) {
      literals.add(format(value));
    }
    return String.join(", ", literals);
  }

  /** Wraps text in single quotes, doubling embedded quotes. */
  public static String quote(String text) {
    return "'" + text.replace("'", "''") + "'";
  }

  private static String formatDouble(double value) {
    if (Double.isNaN(value)) {
      return "nan()";
    }
    if (value == Double.POSITIVE_INFINITY) {
      return "infinity()";
    }
    if (value == Double.NEGATIVE_INFINITY) {
      return "-infinity()";
    }
    return "DOUBLE '" + value + "'";
  }

  // Float.toString keeps the shortest decimal that identifies the float, 1.1f stays 1.1
  private static String formatFloat(float value) {
    if (Float.isNaN(value) || Float.isInfinite(value)) {
      return formatDouble(value);
    }
    return "DOUBLE '" + Float.toString(value) + "'";
  }

  private static String formatJavaTime(Object value) {
    if (value instanceof LocalDate) {
      return "DATE '" + DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) value) + "'";
    }
    if (value instanceof LocalTime) {
      return "TIME '" + DateTimeFormatter.ISO_LOCAL_TIME.format((LocalTime) value) + "'";
    }
    if (value instanceof OffsetTime) {
      OffsetTime time = (OffsetTime) value;
      return "TIME '"
          + DateTimeFormatter.ISO_LOCAL_TIME.format(time.toLocalTime())
          + OFFSET_FORMAT.format(time)
          + "'";
    }
    if (value instanceof LocalDateTime) {
      return "TIMESTAMP '" + dateTime((LocalDateTime) value) + "'";
    }
    if (value instanceof OffsetDateTime) {
      OffsetDateTime dateTime = (OffsetDateTime) value;
      return "TIMESTAMP '"
          + dateTime(dateTime.toLocalDateTime())
          + " "
          + OFFSET_FORMAT.format(dateTime)
          + "'";
    }
    if (value instanceof ZonedDateTime) {
      ZonedDateTime dateTime = (ZonedDateTime) value;
      return "TIMESTAMP '"
          + dateTime(dateTime.toLocalDateTime())
          + " "
          + dateTime.getZone().getId()
          + "'";
    }
    return null;
  }

  private static String dateTime(LocalDateTime value) {
    return DateTimeFormatter.ISO_LOCAL_DATE.format(value)
        + " "
        + DateTimeFormatter.ISO_LOCAL_TIME.format(value);
  }
}
