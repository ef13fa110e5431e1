/*
 * Where: shared JDBC helpers
 * What: converts Instant to and from java.sql.Timestamp for NamedParameterJdbcTemplate binds
 * Why: the PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.scoutfeed.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps the same point on the time line
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
