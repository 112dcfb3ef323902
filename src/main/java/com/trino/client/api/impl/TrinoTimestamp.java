package com.trino.client.api.impl;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** Value of a {@code timestamp(p)} column. */
public class TrinoTimestamp extends AbstractTrinoTemporal<LocalDateTime> {

  static final DateTimeFormatter WHOLE_SECONDS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

  public TrinoTimestamp(LocalDateTime value, int precision) {
    super(value, precision);
  }

  @Override
  protected int getNanos() {
    return getValue().getNano();
  }

  @Override
  protected String formatWholeSeconds() {
    return WHOLE_SECONDS.format(getValue());
  }

  @Override
  public String getTypeKeyword() {
    return "TIMESTAMP";
  }
}
