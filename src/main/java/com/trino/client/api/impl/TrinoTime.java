package com.trino.client.api.impl;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/** Value of a {@code time(p)} column. */
public class TrinoTime extends AbstractTrinoTemporal<LocalTime> {

  static final DateTimeFormatter WHOLE_SECONDS = DateTimeFormatter.ofPattern("HH:mm:ss");

  public TrinoTime(LocalTime value, int precision) {
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
    return "TIME";
  }
}
