/*
 * Where: Match tracker channel resolution unit test
 * What: deduplication by channel id across accounts, players and server scopes
 */
package com.scoutfeed.tracker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;

import com.scoutfeed.tracker.model.ChannelTarget;
import com.scoutfeed.tracker.repository.SubscriptionDirectory;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class NotificationResolverTest {

  private static final long PLAYER_P = 1L;
  private static final long PLAYER_Q = 2L;

  @Mock private SubscriptionDirectory subscriptionDirectory;

  private NotificationResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new NotificationResolver(subscriptionDirectory);
  }

  @Test
  void sameChannelFromTwoServersYieldsOneTarget() {
    // server A and server B both subscribe P to channel 123
    when(subscriptionDirectory.subscriptionsFor(PLAYER_P))
        .thenReturn(
            List.of(new ChannelTarget("123", "server-a"), new ChannelTarget("123", "server-b")));

    final Set<ChannelTarget> channels = resolver.channelsFor(Set.of(PLAYER_P));

    assertThat(channels).hasSize(1);
    assertThat(channels.iterator().next()).isEqualTo(new ChannelTarget("123", "server-a"));
  }

  @Test
  void twoPlayersInOneChannelYieldOneTarget() {
    when(subscriptionDirectory.subscriptionsFor(PLAYER_P))
        .thenReturn(List.of(new ChannelTarget("123", "server-a")));
    when(subscriptionDirectory.subscriptionsFor(PLAYER_Q))
        .thenReturn(
            List.of(new ChannelTarget("123", "server-a"), new ChannelTarget("456", "server-a")));

    final Set<ChannelTarget> channels = resolver.channelsFor(List.of(PLAYER_Q, PLAYER_P));

    assertThat(channels)
        .extracting(ChannelTarget::channelId)
        .containsExactlyInAnyOrder("123", "456");
  }

  @Test
  void repeatedPlayerIdsAreResolvedOnce() {
    // two accounts of one player map to the same player id
    when(subscriptionDirectory.subscriptionsFor(PLAYER_P))
        .thenReturn(List.of(new ChannelTarget("123", "server-a")));

    final Set<ChannelTarget> channels = resolver.channelsFor(List.of(PLAYER_P, PLAYER_P));

    assertThat(channels).containsExactly(new ChannelTarget("123", "server-a"));
  }

  @Test
  void playerWithoutSubscriptionsContributesNothing() {
    when(subscriptionDirectory.subscriptionsFor(PLAYER_P)).thenReturn(List.of());
    when(subscriptionDirectory.subscriptionsFor(PLAYER_Q))
        .thenReturn(List.of(new ChannelTarget("456", "server-b")));

    final Set<ChannelTarget> channels = resolver.channelsFor(Set.of(PLAYER_P, PLAYER_Q));

    assertThat(channels).containsExactly(new ChannelTarget("456", "server-b"));
  }

  @Test
  void noSubscriptionsIsAnEmptySet() {
    when(subscriptionDirectory.subscriptionsFor(anyLong())).thenReturn(List.of());

    assertThat(resolver.channelsFor(Set.of(PLAYER_P))).isEmpty();
    assertThat(resolver.channelsFor(Set.of())).isEmpty();
  }

  @Test
  void directoryFailureSurfacesAsStoreUnavailable() {
    when(subscriptionDirectory.subscriptionsFor(PLAYER_P))
        .thenThrow(new QueryTimeoutException("timeout"));

    assertThatThrownBy(() -> resolver.channelsFor(Set.of(PLAYER_P)))
        .isInstanceOf(StoreUnavailableException.class);
  }
}
