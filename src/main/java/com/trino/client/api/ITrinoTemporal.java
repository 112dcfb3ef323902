package com.trino.client.api;

/**
 * Interface for temporal values decoded from Trino with their declared precision.
 *
 * <p>Trino time and timestamp types carry a fractional-second precision between 0 and 12 digits.
 * The Java value exposed by {@link #getValue()} is limited to nanoseconds, so implementations also
 * remember the declared precision and can render the exact literal the server sent, including
 * trailing zeros.
 *
 * @param <T> the {@code java.time} type holding the value
 */
public interface ITrinoTemporal<T> {

  /**
   * Returns the value as a {@code java.time} object.
   *
   * @return the decoded value
   */
  T getValue();

  /**
   * Returns the number of fractional-second digits declared by the column type.
   *
   * @return precision between 0 and 12
   */
  int getPrecision();

  /**
   * Returns the value rendered as the server formats it, with exactly {@link #getPrecision()}
   * fractional digits.
   *
   * @return the wire literal
   */
  String toWireLiteral();

  /**
   * Returns the SQL type keyword used when binding this value as a parameter.
   *
   * @return {@code TIME} or {@code TIMESTAMP}
   */
  String getTypeKeyword();
}
