package com.scoutfeed.tracker.repository;

import com.scoutfeed.tracker.model.ChannelTarget;
import java.util.List;

/** Read-only view of where a player's matches are announced. */
public interface SubscriptionDirectory {

  List<ChannelTarget> subscriptionsFor(long playerId);
}
