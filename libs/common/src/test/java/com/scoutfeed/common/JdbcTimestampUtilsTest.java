package com.scoutfeed.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void convertsBothDirectionsWithoutShiftingTheInstant() {
    final Instant instant = Instant.parse("2026-03-01T12:34:56.789Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(timestamp.toInstant()).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
  }

  @Test
  void nullStaysNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
