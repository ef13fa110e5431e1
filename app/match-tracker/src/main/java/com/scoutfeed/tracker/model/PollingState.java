/*
 * Where: Match tracker domain model
 * What: per-account polling state (last match seen, last match acted on, last upstream check)
 * Why: the polling cadence and the at-most-once processing guarantee both derive from it
 */
package com.scoutfeed.tracker.model;

import java.time.Instant;

public record PollingState(
    Instant lastMatchTime,
    String lastProcessedMatchId,
    Instant lastCheckedAt,
    Instant suspendedAt,
    String suspendedReason) {

  public static final PollingState EMPTY = new PollingState(null, null, null, null, null);

  public boolean suspended() {
    return suspendedAt != null;
  }

  public PollingState withLastMatchTime(Instant value) {
    return new PollingState(value, lastProcessedMatchId, lastCheckedAt, suspendedAt, suspendedReason);
  }

  public PollingState withLastProcessedMatchId(String value) {
    return new PollingState(lastMatchTime, value, lastCheckedAt, suspendedAt, suspendedReason);
  }

  public PollingState withLastCheckedAt(Instant value) {
    return new PollingState(lastMatchTime, lastProcessedMatchId, value, suspendedAt, suspendedReason);
  }

  public PollingState withSuspension(Instant at, String reason) {
    return new PollingState(lastMatchTime, lastProcessedMatchId, lastCheckedAt, at, reason);
  }
}
