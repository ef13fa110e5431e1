/*
 * Where: Match tracker data access
 * What: account_polling_state reads and optimistic conditional upserts
 */
package com.scoutfeed.tracker.repository;

import static com.scoutfeed.common.JdbcTimestampUtils.getInstant;
import static com.scoutfeed.common.JdbcTimestampUtils.toTimestamp;

import com.scoutfeed.tracker.model.PollingState;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcMatchStateStore implements MatchStateStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public PollingState get(long accountId) {
    final String sql =
        """
        SELECT last_match_time, last_processed_match_id, last_checked_at,
               suspended_at, suspended_reason
        FROM account_polling_state
        WHERE account_id = :accountId
        """;
    final List<PollingState> rows =
        jdbcTemplate.query(
            sql, new MapSqlParameterSource("accountId", accountId), JdbcMatchStateStore::mapRow);
    return rows.isEmpty() ? PollingState.EMPTY : rows.get(0);
  }

  @Override
  public void set(long accountId, PollingState state) {
    final String sql =
        """
        INSERT INTO account_polling_state (
          account_id, last_match_time, last_processed_match_id, last_checked_at,
          suspended_at, suspended_reason
        ) VALUES (
          :accountId, :lastMatchTime, :lastProcessedMatchId, :lastCheckedAt,
          :suspendedAt, :suspendedReason
        )
        ON CONFLICT (account_id) DO UPDATE
        SET last_match_time = EXCLUDED.last_match_time,
            last_processed_match_id = EXCLUDED.last_processed_match_id,
            last_checked_at = EXCLUDED.last_checked_at,
            suspended_at = EXCLUDED.suspended_at,
            suspended_reason = EXCLUDED.suspended_reason
        """;
    jdbcTemplate.update(sql, stateParams(accountId, state));
  }

  @Override
  public boolean compareAndSet(long accountId, PollingState expected, PollingState updated) {
    if (PollingState.EMPTY.equals(expected)) {
      // no row yet counts as EMPTY; a concurrent first insert makes this a no-op
      final int inserted = insertIfAbsent(accountId, updated);
      if (inserted > 0) {
        return true;
      }
    }
    final String sql =
        """
        UPDATE account_polling_state
        SET last_match_time = :lastMatchTime,
            last_processed_match_id = :lastProcessedMatchId,
            last_checked_at = :lastCheckedAt,
            suspended_at = :suspendedAt,
            suspended_reason = :suspendedReason
        WHERE account_id = :accountId
          AND last_match_time IS NOT DISTINCT FROM :expectedLastMatchTime
          AND last_processed_match_id IS NOT DISTINCT FROM :expectedLastProcessedMatchId
          AND last_checked_at IS NOT DISTINCT FROM :expectedLastCheckedAt
          AND suspended_at IS NOT DISTINCT FROM :expectedSuspendedAt
          AND suspended_reason IS NOT DISTINCT FROM :expectedSuspendedReason
        """;
    final MapSqlParameterSource params =
        stateParams(accountId, updated)
            .addValue("expectedLastMatchTime", toTimestamp(expected.lastMatchTime()), Types.TIMESTAMP)
            .addValue("expectedLastProcessedMatchId", expected.lastProcessedMatchId(), Types.VARCHAR)
            .addValue("expectedLastCheckedAt", toTimestamp(expected.lastCheckedAt()), Types.TIMESTAMP)
            .addValue("expectedSuspendedAt", toTimestamp(expected.suspendedAt()), Types.TIMESTAMP)
            .addValue("expectedSuspendedReason", expected.suspendedReason(), Types.VARCHAR);
    return jdbcTemplate.update(sql, params) > 0;
  }

  private int insertIfAbsent(long accountId, PollingState state) {
    final String sql =
        """
        INSERT INTO account_polling_state (
          account_id, last_match_time, last_processed_match_id, last_checked_at,
          suspended_at, suspended_reason
        ) VALUES (
          :accountId, :lastMatchTime, :lastProcessedMatchId, :lastCheckedAt,
          :suspendedAt, :suspendedReason
        )
        ON CONFLICT (account_id) DO NOTHING
        """;
    return jdbcTemplate.update(sql, stateParams(accountId, state));
  }

  private static MapSqlParameterSource stateParams(long accountId, PollingState state) {
    // explicit SQL types: all of these may be null
    return new MapSqlParameterSource()
        .addValue("accountId", accountId)
        .addValue("lastMatchTime", toTimestamp(state.lastMatchTime()), Types.TIMESTAMP)
        .addValue("lastProcessedMatchId", state.lastProcessedMatchId(), Types.VARCHAR)
        .addValue("lastCheckedAt", toTimestamp(state.lastCheckedAt()), Types.TIMESTAMP)
        .addValue("suspendedAt", toTimestamp(state.suspendedAt()), Types.TIMESTAMP)
        .addValue("suspendedReason", state.suspendedReason(), Types.VARCHAR);
  }

  static PollingState mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PollingState(
        getInstant(rs, "last_match_time"),
        rs.getString("last_processed_match_id"),
        getInstant(rs, "last_checked_at"),
        getInstant(rs, "suspended_at"),
        rs.getString("suspended_reason"));
  }
}
