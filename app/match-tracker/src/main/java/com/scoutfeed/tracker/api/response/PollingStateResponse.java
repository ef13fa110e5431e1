package com.scoutfeed.tracker.api.response;

import com.scoutfeed.tracker.model.PollingState;
import java.time.Duration;
import java.time.Instant;

public record PollingStateResponse(
    long accountId,
    Instant lastMatchTime,
    String lastProcessedMatchId,
    Instant lastCheckedAt,
    boolean suspended,
    Instant suspendedAt,
    String suspendedReason,
    long pollingIntervalSeconds) {

  public static PollingStateResponse of(long accountId, PollingState state, Duration interval) {
    return new PollingStateResponse(
        accountId,
        state.lastMatchTime(),
        state.lastProcessedMatchId(),
        state.lastCheckedAt(),
        state.suspended(),
        state.suspendedAt(),
        state.suspendedReason(),
        interval.toSeconds());
  }
}
