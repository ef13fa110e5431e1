package com.scoutfeed.tracker.api;

public class PlayerNotFoundException extends RuntimeException {
  public PlayerNotFoundException(long playerId) {
    super("player not found: " + playerId);
  }
}
