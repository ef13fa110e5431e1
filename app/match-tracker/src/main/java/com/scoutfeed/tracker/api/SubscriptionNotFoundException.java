package com.scoutfeed.tracker.api;

public class SubscriptionNotFoundException extends RuntimeException {
  public SubscriptionNotFoundException(long playerId, String serverScope, String channelId) {
    super(
        "subscription not found: player="
            + playerId
            + " server="
            + serverScope
            + " channel="
            + channelId);
  }
}
