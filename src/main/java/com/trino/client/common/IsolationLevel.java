package com.trino.client.common;

/**
 * Transaction isolation levels. {@link #AUTOCOMMIT} runs every statement in its own transaction.
 */
public enum IsolationLevel {
  AUTOCOMMIT(null),
  READ_UNCOMMITTED("READ UNCOMMITTED"),
  READ_COMMITTED("READ COMMITTED"),
  REPEATABLE_READ("REPEATABLE READ"),
  SERIALIZABLE("SERIALIZABLE");

  private final String sqlName;

  IsolationLevel(String sqlName) {
    this.sqlName = sqlName;
  }

  /** Name used in {@code START TRANSACTION ISOLATION LEVEL ...}; null for autocommit. */
  public String getSqlName() {
    return sqlName;
  }

  public boolean isAutocommit() {
    return this == AUTOCOMMIT;
  }
}
