package com.trino.client.api.impl;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Value of a {@code timestamp(p) with time zone} column. The zone is either a fixed offset or a
 * region id, and is rendered back the way it was received.
 */
public class TrinoTimestampWithTimeZone extends AbstractTrinoTemporal<ZonedDateTime> {

  public TrinoTimestampWithTimeZone(ZonedDateTime value, int precision) {
    super(value, precision);
  }

  @Override
  protected int getNanos() {
    return getValue().getNano();
  }

  @Override
  protected String formatWholeSeconds() {
    return TrinoTimestamp.WHOLE_SECONDS.format(getValue());
  }

  @Override
  protected String formatSuffix() {
    if (getValue().getZone() instanceof ZoneOffset) {
      String offset = getValue().getZone().getId();
      return " " + ("Z".equals(offset) ? "+00:00" : offset);
    }
    return " " + getValue().getZone().getId();
  }

  @Override
  public String getTypeKeyword() {
    return "TIMESTAMP";
  }
}
