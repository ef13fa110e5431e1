/*
 * Where: Match tracker data access
 * What: channel_permission_errors audit of denied deliveries per (server, channel)
 * Why: owner notice suppression has to survive restarts, and long-broken servers are escalated from it
 */
package com.scoutfeed.tracker.repository;

import static com.scoutfeed.common.JdbcTimestampUtils.getInstant;
import static com.scoutfeed.common.JdbcTimestampUtils.toTimestamp;

import com.scoutfeed.tracker.model.AbandonedServer;
import com.scoutfeed.tracker.model.DeliveryOutcome;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ChannelPermissionErrorRepository {

  public static final String ERROR_TYPE_PROACTIVE_CHECK = "proactive_check";
  public static final String ERROR_TYPE_API_ERROR = "api_error";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Counts one more consecutive denial. The first denial after a success starts a new streak, so
   * first_occurrence and owner_notified are reset then.
   */
  public void recordPermissionError(
      String serverScope, String channelId, String errorType, String reason, Instant now) {
    final String sql =
        """
        INSERT INTO channel_permission_errors (
          server_scope, channel_id, error_type, error_reason,
          first_occurrence, last_occurrence, consecutive_error_count, owner_notified
        ) VALUES (
          :serverScope, :channelId, :errorType, :reason, :now, :now, 1, FALSE
        )
        ON CONFLICT (server_scope, channel_id) DO UPDATE
        SET error_type = EXCLUDED.error_type,
            error_reason = EXCLUDED.error_reason,
            last_occurrence = EXCLUDED.last_occurrence,
            first_occurrence = CASE
              WHEN channel_permission_errors.consecutive_error_count = 0
                THEN EXCLUDED.first_occurrence
              ELSE channel_permission_errors.first_occurrence
            END,
            owner_notified = CASE
              WHEN channel_permission_errors.consecutive_error_count = 0 THEN FALSE
              ELSE channel_permission_errors.owner_notified
            END,
            consecutive_error_count = channel_permission_errors.consecutive_error_count + 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("serverScope", serverScope)
            .addValue("channelId", channelId)
            .addValue("errorType", errorType)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  /** Resets the streak. Channels that never failed have no row and are left alone. */
  public int recordSuccessfulSend(String serverScope, String channelId, Instant now) {
    final String sql =
        """
        UPDATE channel_permission_errors
        SET consecutive_error_count = 0,
            last_successful_send = :now,
            owner_notified = FALSE
        WHERE server_scope = :serverScope
          AND channel_id = :channelId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("serverScope", serverScope)
            .addValue("channelId", channelId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<DeliveryOutcome> findLastOutcome(String serverScope, String channelId) {
    final String sql =
        """
        SELECT consecutive_error_count
        FROM channel_permission_errors
        WHERE server_scope = :serverScope
          AND channel_id = :channelId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("serverScope", serverScope)
            .addValue("channelId", channelId);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                rs.getInt("consecutive_error_count") > 0
                    ? DeliveryOutcome.PERMISSION_DENIED
                    : DeliveryOutcome.OK)
        .stream()
        .findFirst();
  }

  /**
   * Servers with at least one channel failing since before {@code cutoff}, with no success since
   * the cutoff and no owner notified yet.
   */
  public List<AbandonedServer> findAbandonedServers(Instant cutoff) {
    final String sql =
        """
        SELECT server_scope,
               MIN(first_occurrence) AS first_occurrence,
               MAX(last_occurrence) AS last_occurrence,
               SUM(consecutive_error_count) AS error_count
        FROM channel_permission_errors
        WHERE consecutive_error_count > 0
          AND first_occurrence <= :cutoff
          AND (last_successful_send IS NULL OR last_successful_send <= :cutoff)
          AND owner_notified = FALSE
        GROUP BY server_scope
        ORDER BY server_scope
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("cutoff", toTimestamp(cutoff)),
        (rs, rowNum) ->
            new AbandonedServer(
                rs.getString("server_scope"),
                getInstant(rs, "first_occurrence"),
                getInstant(rs, "last_occurrence"),
                rs.getLong("error_count")));
  }

  public int markServerOwnerNotified(String serverScope) {
    final String sql =
        """
        UPDATE channel_permission_errors
        SET owner_notified = TRUE
        WHERE server_scope = :serverScope
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("serverScope", serverScope));
  }

  public int deleteResolvedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM channel_permission_errors
        WHERE consecutive_error_count = 0
          AND last_successful_send <= :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }
}
