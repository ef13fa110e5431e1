/*
 * Where: Match tracker data access
 * What: subscribe/unsubscribe writes on the subscriptions table
 * Why: unsubscribing never cascades, the player and its accounts stay tracked
 */
package com.scoutfeed.tracker.repository;

import static com.scoutfeed.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SubscriptionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Returns false when the player is already subscribed to the channel in that server. */
  public boolean insertIfAbsent(
      String serverScope, long playerId, String channelId, Instant createdAt) {
    final String sql =
        """
        INSERT INTO subscriptions (server_scope, player_id, channel_id, created_at)
        VALUES (:serverScope, :playerId, :channelId, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("serverScope", serverScope)
            .addValue("playerId", playerId)
            .addValue("channelId", channelId)
            .addValue("createdAt", toTimestamp(createdAt));
    try {
      return jdbcTemplate.update(sql, params) > 0;
    } catch (DuplicateKeyException ex) {
      return false;
    }
  }

  public int delete(String serverScope, long playerId, String channelId) {
    final String sql =
        """
        DELETE FROM subscriptions
        WHERE server_scope = :serverScope
          AND player_id = :playerId
          AND channel_id = :channelId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("serverScope", serverScope)
            .addValue("playerId", playerId)
            .addValue("channelId", channelId);
    return jdbcTemplate.update(sql, params);
  }
}
