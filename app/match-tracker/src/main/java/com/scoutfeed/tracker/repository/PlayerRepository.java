package com.scoutfeed.tracker.repository;

import static com.scoutfeed.common.JdbcTimestampUtils.getInstant;
import static com.scoutfeed.common.JdbcTimestampUtils.toTimestamp;

import com.scoutfeed.tracker.model.Player;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PlayerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Player insert(String serverScope, String alias, Instant createdAt) {
    final String sql =
        """
        INSERT INTO players (server_scope, alias, created_at)
        VALUES (:serverScope, :alias, :createdAt)
        RETURNING player_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("serverScope", serverScope)
            .addValue("alias", alias)
            .addValue("createdAt", toTimestamp(createdAt));
    final Long playerId = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (playerId == null) {
      throw new IllegalStateException("player insert returned no id");
    }
    return new Player(playerId, serverScope, alias, createdAt);
  }

  public Optional<Player> findById(long playerId) {
    final String sql =
        """
        SELECT player_id, server_scope, alias, created_at
        FROM players
        WHERE player_id = :playerId
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource("playerId", playerId),
            (rs, rowNum) ->
                new Player(
                    rs.getLong("player_id"),
                    rs.getString("server_scope"),
                    rs.getString("alias"),
                    getInstant(rs, "created_at")))
        .stream()
        .findFirst();
  }
}
