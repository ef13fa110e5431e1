package com.scoutfeed.tracker.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.scoutfeed.tracker.AbstractPostgresContainerTest;
import com.scoutfeed.tracker.RepositoryTestSupport;
import com.scoutfeed.tracker.model.ChannelTarget;
import com.scoutfeed.tracker.model.Player;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SubscriptionRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private PlayerRepository playerRepository;
  @Autowired private SubscriptionRepository subscriptionRepository;
  @Autowired private JdbcSubscriptionDirectory subscriptionDirectory;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private long playerId;

  @BeforeEach
  void setUp() {
    RepositoryTestSupport.truncateAll(jdbcTemplate);
    final Player player = playerRepository.insert("server-a", "Alpha", BASE_TIME);
    playerId = player.playerId();
  }

  @Test
  void duplicateSubscriptionIsNotInserted() {
    assertThat(subscriptionRepository.insertIfAbsent("server-a", playerId, "123", BASE_TIME)).isTrue();
    assertThat(subscriptionRepository.insertIfAbsent("server-a", playerId, "123", BASE_TIME)).isFalse();
    // the same channel reached from another server is a separate subscription
    assertThat(subscriptionRepository.insertIfAbsent("server-b", playerId, "123", BASE_TIME)).isTrue();
  }

  @Test
  void directoryListsOldestSubscriptionFirst() {
    subscriptionRepository.insertIfAbsent("server-b", playerId, "123", BASE_TIME.plusSeconds(10));
    subscriptionRepository.insertIfAbsent("server-a", playerId, "123", BASE_TIME);
    subscriptionRepository.insertIfAbsent("server-a", playerId, "456", BASE_TIME.plusSeconds(20));

    assertThat(subscriptionDirectory.subscriptionsFor(playerId))
        .containsExactly(
            new ChannelTarget("123", "server-a"),
            new ChannelTarget("123", "server-b"),
            new ChannelTarget("456", "server-a"));
    assertThat(subscriptionDirectory.subscriptionsFor(playerId + 1000)).isEmpty();
  }

  @Test
  void deleteRemovesOnlyTheNamedSubscription() {
    subscriptionRepository.insertIfAbsent("server-a", playerId, "123", BASE_TIME);
    subscriptionRepository.insertIfAbsent("server-b", playerId, "123", BASE_TIME);

    assertThat(subscriptionRepository.delete("server-a", playerId, "123")).isEqualTo(1);
    assertThat(subscriptionRepository.delete("server-a", playerId, "123")).isZero();
    assertThat(subscriptionDirectory.subscriptionsFor(playerId))
        .containsExactly(new ChannelTarget("123", "server-b"));
  }
}
