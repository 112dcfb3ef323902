package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.api.impl.TrinoTime;
import com.trino.client.api.impl.TrinoTimeWithTimeZone;
import com.trino.client.api.impl.TrinoTimestamp;
import com.trino.client.api.impl.TrinoTimestampWithTimeZone;
import com.trino.client.exception.TrinoDataException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetTime;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/** Converters for date, time, timestamp and interval literals. */
final class TemporalConverters {

  private static final int TIME_LENGTH = 8; // HH:MM:SS
  private static final int OFFSET_LENGTH = 6; // +HH:MM

  private TemporalConverters() {}

  static ValueConverter date() {
    return value -> {
      String text = value.asText();
      try {
        return LocalDate.parse(text);
      } catch (DateTimeException e) {
        throw dataError(text, "date", e);
      }
    };
  }

  static ValueConverter time(int precision) {
    return value -> {
      String text = value.asText();
      return new TrinoTime(parseTime(text, text, precision), precision);
    };
  }

  static ValueConverter timeWithTimeZone(int precision) {
    return value -> {
      String text = value.asText();
      if (text.length() < TIME_LENGTH + OFFSET_LENGTH) {
        throw dataError(text, "time with time zone", null);
      }
      int split = text.length() - OFFSET_LENGTH;
      LocalTime time = parseTime(text.substring(0, split), text, precision);
      String offset = text.substring(split);
      try {
        return new TrinoTimeWithTimeZone(OffsetTime.of(time, ZoneOffset.of(offset)), precision);
      } catch (DateTimeException e) {
        throw dataError(text, "time with time zone", e);
      }
    };
  }

  static ValueConverter timestamp(int precision) {
    return value -> {
      String text = value.asText();
      return new TrinoTimestamp(parseTimestamp(text, text, precision), precision);
    };
  }

  static ValueConverter timestampWithTimeZone(int precision) {
    return value -> {
      String text = value.asText();
      int space = text.lastIndexOf(' ');
      if (space < 0) {
        throw dataError(text, "timestamp with time zone", null);
      }
      LocalDateTime dateTime = parseTimestamp(text.substring(0, space), text, precision);
      try {
        ZoneId zone = ZoneId.of(text.substring(space + 1));
        return new TrinoTimestampWithTimeZone(ZonedDateTime.of(dateTime, zone), precision);
      } catch (DateTimeException e) {
        throw dataError(text, "timestamp with time zone", e);
      }
    };
  }

  /** {@code Y-M}, optionally negative. */
  static ValueConverter intervalYearToMonth() {
    return value -> {
      String text = value.asText().trim();
      boolean negative = text.startsWith("-");
      String body = negative ? text.substring(1) : text;
      int dash = body.indexOf('-');
      try {
        int years = Integer.parseInt(body.substring(0, dash));
        int months = Integer.parseInt(body.substring(dash + 1));
        Period period = Period.of(years, months, 0);
        return negative ? period.negated() : period;
      } catch (RuntimeException e) {
        throw dataError(text, "interval year to month", e);
      }
    };
  }

  /** {@code D HH:MM:SS.mmm}, optionally negative. */
  static ValueConverter intervalDayToSecond() {
    return value -> {
      String text = value.asText().trim();
      boolean negative = text.startsWith("-");
      String body = negative ? text.substring(1) : text;
      try {
        int space = body.indexOf(' ');
        long days = Long.parseLong(body.substring(0, space));
        String[] clock = body.substring(space + 1).split(":");
        String[] seconds = clock[2].split("\\.");
        Duration duration =
            Duration.ofDays(days)
                .plusHours(Long.parseLong(clock[0]))
                .plusMinutes(Long.parseLong(clock[1]))
                .plusSeconds(Long.parseLong(seconds[0]));
        if (seconds.length > 1) {
          duration = duration.plusNanos(FractionalSeconds.parse(seconds[1], 9, text).getNanos());
        }
        return negative ? duration.negated() : duration;
      } catch (RuntimeException e) {
        throw dataError(text, "interval day to second", e);
      }
    };
  }

  private static LocalTime parseTime(String text, String literal, int precision)
      throws TrinoDataException {
    try {
      LocalTime whole = LocalTime.parse(wholeSeconds(text, literal, "time"));
      FractionalSeconds seconds = FractionalSeconds.parse(fraction(text), precision, literal);
      return whole.plusSeconds(seconds.getCarrySeconds()).plusNanos(seconds.getNanos());
    } catch (DateTimeException e) {
      throw dataError(literal, "time", e);
    }
  }

  private static LocalDateTime parseTimestamp(String text, String literal, int precision)
      throws TrinoDataException {
    int space = text.indexOf(' ');
    if (space < 0) {
      throw dataError(literal, "timestamp", null);
    }
    String timePart = text.substring(space + 1);
    try {
      LocalDate date = LocalDate.parse(text.substring(0, space));
      LocalTime time = LocalTime.parse(wholeSeconds(timePart, literal, "timestamp"));
      FractionalSeconds seconds = FractionalSeconds.parse(fraction(timePart), precision, literal);
      return date.atTime(time).plusSeconds(seconds.getCarrySeconds()).plusNanos(seconds.getNanos());
    } catch (DateTimeException e) {
      throw dataError(literal, "timestamp", e);
    }
  }

  /** {@code HH:MM:SS} prefix of a time literal. */
  private static String wholeSeconds(String time, String literal, String type)
      throws TrinoDataException {
    if (time.length() < TIME_LENGTH
        || (time.length() > TIME_LENGTH && time.charAt(TIME_LENGTH) != '.')) {
      throw dataError(literal, type, null);
    }
    return time.substring(0, TIME_LENGTH);
  }

  private static String fraction(String time) {
    return time.length() > TIME_LENGTH + 1 ? time.substring(TIME_LENGTH + 1) : "";
  }

  private static TrinoDataException dataError(String text, String type, Throwable cause) {
    String message = String.format("Could not convert '%s' into %s", text, type);
    return cause == null ? new TrinoDataException(message) : new TrinoDataException(message, cause);
  }
}
