package com.scoutfeed.tracker.repository;

import com.scoutfeed.tracker.model.ChannelTarget;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcSubscriptionDirectory implements SubscriptionDirectory {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public List<ChannelTarget> subscriptionsFor(long playerId) {
    // oldest first so the first server scope seen for a channel is stable across cycles
    final String sql =
        """
        SELECT channel_id, server_scope
        FROM subscriptions
        WHERE player_id = :playerId
        ORDER BY created_at, subscription_id
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("playerId", playerId),
        (rs, rowNum) -> new ChannelTarget(rs.getString("channel_id"), rs.getString("server_scope")));
  }
}
