/*
 * Where: Match tracker data access
 * What: tracked_accounts registration and the roster join with polling state
 */
package com.scoutfeed.tracker.repository;

import static com.scoutfeed.common.JdbcTimestampUtils.toTimestamp;

import com.scoutfeed.tracker.model.RosterEntry;
import com.scoutfeed.tracker.model.TrackedAccount;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TrackedAccountRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Every tracked account with its polling state; accounts without a state row get EMPTY. */
  public List<RosterEntry> findRoster() {
    final String sql =
        """
        SELECT a.account_id, a.server_scope, a.player_id, a.external_account_id, a.region, a.alias,
               s.last_match_time, s.last_processed_match_id, s.last_checked_at,
               s.suspended_at, s.suspended_reason
        FROM tracked_accounts a
        LEFT JOIN account_polling_state s ON s.account_id = a.account_id
        ORDER BY a.account_id
        """;
    return jdbcTemplate.query(
        sql,
        (rs, rowNum) ->
            new RosterEntry(mapAccount(rs), JdbcMatchStateStore.mapRow(rs, rowNum)));
  }

  /**
   * Inserts the account and returns its id. A second registration of the same external id in
   * the same server surfaces as {@link org.springframework.dao.DuplicateKeyException}.
   */
  public long insert(
      String serverScope,
      long playerId,
      String externalAccountId,
      String region,
      String alias,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO tracked_accounts (
          server_scope, player_id, external_account_id, region, alias, created_at
        ) VALUES (
          :serverScope, :playerId, :externalAccountId, :region, :alias, :createdAt
        )
        RETURNING account_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("serverScope", serverScope)
            .addValue("playerId", playerId)
            .addValue("externalAccountId", externalAccountId)
            .addValue("region", region)
            .addValue("alias", alias)
            .addValue("createdAt", toTimestamp(createdAt));
    final Long accountId = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (accountId == null) {
      throw new IllegalStateException("account insert returned no id");
    }
    return accountId;
  }

  public Optional<TrackedAccount> findById(long accountId) {
    final String sql =
        """
        SELECT account_id, server_scope, player_id, external_account_id, region, alias
        FROM tracked_accounts
        WHERE account_id = :accountId
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("accountId", accountId), (rs, rowNum) -> mapAccount(rs))
        .stream()
        .findFirst();
  }

  public List<TrackedAccount> findByPlayerId(long playerId) {
    final String sql =
        """
        SELECT account_id, server_scope, player_id, external_account_id, region, alias
        FROM tracked_accounts
        WHERE player_id = :playerId
        ORDER BY account_id
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("playerId", playerId), (rs, rowNum) -> mapAccount(rs));
  }

  private static TrackedAccount mapAccount(ResultSet rs) throws SQLException {
    return new TrackedAccount(
        rs.getLong("account_id"),
        rs.getString("server_scope"),
        rs.getLong("player_id"),
        rs.getString("external_account_id"),
        rs.getString("region"),
        rs.getString("alias"));
  }
}
