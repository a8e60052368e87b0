/*
 * Where: Common utilities
 * What: Converts Instant to Timestamp explicitly for JDBC binding
 * Why: The PostgreSQL driver cannot always infer a SQL type for Instant
 */
package com.pimapos.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC; Timestamp.from keeps it UTC regardless of the database time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
