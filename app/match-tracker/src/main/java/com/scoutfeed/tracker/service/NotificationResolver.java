/*
 * Where: Match tracker service layer
 * What: turns the players of a new match into the channels that should announce it
 * Why: one Discord channel must get one message per match, however many accounts, players or
 *      servers lead to it
 */
package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.ChannelTarget;
import com.scoutfeed.tracker.repository.SubscriptionDirectory;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationResolver {

  private final SubscriptionDirectory subscriptionDirectory;

  /**
   * Channels subscribed by any of the players, deduplicated by channel id. The scope kept for a
   * channel is the first one found, walking players in ascending id order.
   */
  public Set<ChannelTarget> channelsFor(Collection<Long> playerIds) {
    final Map<String, ChannelTarget> byChannel = new LinkedHashMap<>();
    for (Long playerId : new TreeSet<>(playerIds)) {
      for (ChannelTarget target : subscriptionsOf(playerId)) {
        byChannel.putIfAbsent(target.channelId(), target);
      }
    }
    return new LinkedHashSet<>(byChannel.values());
  }

  private Iterable<ChannelTarget> subscriptionsOf(long playerId) {
    try {
      return subscriptionDirectory.subscriptionsFor(playerId);
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("subscription lookup failed playerId=" + playerId, ex);
    }
  }
}
