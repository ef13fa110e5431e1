package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.api.DuplicateRegistrationException;
import com.scoutfeed.tracker.api.PlayerNotFoundException;
import com.scoutfeed.tracker.api.SubscriptionNotFoundException;
import com.scoutfeed.tracker.api.request.SubscriptionRequest;
import com.scoutfeed.tracker.model.ChannelTarget;
import com.scoutfeed.tracker.repository.PlayerRepository;
import com.scoutfeed.tracker.repository.SubscriptionRepository;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubscriptionService {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionService.class);

  private final PlayerRepository playerRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final Clock clock;

  public ChannelTarget subscribe(long playerId, SubscriptionRequest request) {
    if (playerRepository.findById(playerId).isEmpty()) {
      throw new PlayerNotFoundException(playerId);
    }
    final boolean created =
        subscriptionRepository.insertIfAbsent(
            request.serverScope(), playerId, request.channelId(), clock.instant());
    if (!created) {
      throw new DuplicateRegistrationException(
          "player " + playerId + " already subscribed to channel " + request.channelId());
    }
    logger.info(
        "subscription created player_id={} server_scope={} channel_id={}",
        playerId,
        request.serverScope(),
        request.channelId());
    return new ChannelTarget(request.channelId(), request.serverScope());
  }

  /** Removes the subscription only; the player and its accounts stay tracked. */
  public void unsubscribe(long playerId, String serverScope, String channelId) {
    final int removed = subscriptionRepository.delete(serverScope, playerId, channelId);
    if (removed == 0) {
      throw new SubscriptionNotFoundException(playerId, serverScope, channelId);
    }
    logger.info(
        "subscription removed player_id={} server_scope={} channel_id={}",
        playerId,
        serverScope,
        channelId);
  }
}
