/*
 * Where: Match tracker domain model
 * What: what a channel is told about: one match and the tracked accounts that played it
 * Why: the channel sender renders the message, the core only decides who receives it
 */
package com.scoutfeed.tracker.model;

import java.time.Instant;
import java.util.List;

public record MatchNotification(String matchId, Instant matchTime, List<TrackedAccount> accounts) {

  public MatchNotification {
    accounts = List.copyOf(accounts);
  }
}
