package com.trino.client.api.impl;

import java.time.OffsetTime;

/** Value of a {@code time(p) with time zone} column. Trino only uses fixed offsets here. */
public class TrinoTimeWithTimeZone extends AbstractTrinoTemporal<OffsetTime> {

  public TrinoTimeWithTimeZone(OffsetTime value, int precision) {
    super(value, precision);
  }

  @Override
  protected int getNanos() {
    return getValue().getNano();
  }

  @Override
  protected String formatWholeSeconds() {
    return TrinoTime.WHOLE_SECONDS.format(getValue());
  }

  @Override
  protected String formatSuffix() {
    String offset = getValue().getOffset().getId();
    return "Z".equals(offset) ? "+00:00" : offset;
  }

  @Override
  public String getTypeKeyword() {
    return "TIME";
  }
}
