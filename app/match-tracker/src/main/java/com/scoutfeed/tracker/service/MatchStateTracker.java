/*
 * Where: Match tracker service layer
 * What: the only writer of account polling state
 * Why: every change is a read followed by a conditional write, so concurrent writers cannot
 *      lose a processed match id or move lastCheckedAt backwards
 */
package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.PollingState;
import com.scoutfeed.tracker.repository.MatchStateStore;
import java.time.Instant;
import java.util.Objects;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchStateTracker {

  private static final Logger logger = LoggerFactory.getLogger(MatchStateTracker.class);
  static final int MAX_WRITE_ATTEMPTS = 5;

  private final MatchStateStore store;

  /** Creates the all-empty state row for a freshly registered account, if it has none. */
  public void initialize(long accountId) {
    try {
      store.compareAndSet(accountId, PollingState.EMPTY, PollingState.EMPTY);
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("polling state init failed accountId=" + accountId, ex);
    }
  }

  public void recordCheckAttempt(long accountId, Instant now) {
    Objects.requireNonNull(now, "now");
    update(
        accountId,
        state ->
            state.lastCheckedAt() != null && !now.isAfter(state.lastCheckedAt())
                ? state
                : state.withLastCheckedAt(now));
  }

  public boolean hasProcessed(long accountId, String matchId) {
    return matchId != null && matchId.equals(currentState(accountId).lastProcessedMatchId());
  }

  /**
   * Records {@code matchId} as acted on. Returns false, changing nothing, when it already was the
   * last processed match.
   */
  public boolean markProcessed(long accountId, String matchId, Instant matchTime) {
    Objects.requireNonNull(matchId, "matchId");
    return update(
        accountId,
        state ->
            matchId.equals(state.lastProcessedMatchId())
                ? state
                : state
                    .withLastProcessedMatchId(matchId)
                    .withLastMatchTime(later(state.lastMatchTime(), matchTime)));
  }

  /** Seeds lastMatchTime for the interval policy without marking any match processed. */
  public void backfill(long accountId, Instant matchTime) {
    if (matchTime == null) {
      return;
    }
    update(accountId, state -> state.withLastMatchTime(later(state.lastMatchTime(), matchTime)));
  }

  public boolean suspend(long accountId, String reason, Instant now) {
    return update(
        accountId, state -> state.suspended() ? state : state.withSuspension(now, reason));
  }

  public boolean resume(long accountId) {
    return update(
        accountId, state -> state.suspended() ? state.withSuspension(null, null) : state);
  }

  public PollingState currentState(long accountId) {
    try {
      return store.get(accountId);
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("polling state read failed accountId=" + accountId, ex);
    }
  }

  private boolean update(long accountId, UnaryOperator<PollingState> change) {
    for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
      final PollingState current = currentState(accountId);
      final PollingState updated = change.apply(current);
      if (updated.equals(current)) {
        return false;
      }
      final boolean written;
      try {
        written = store.compareAndSet(accountId, current, updated);
      } catch (DataAccessException ex) {
        throw new StoreUnavailableException(
            "polling state write failed accountId=" + accountId, ex);
      }
      if (written) {
        return true;
      }
      logger.debug("polling state changed concurrently accountId={} attempt={}", accountId, attempt);
    }
    throw new StoreUnavailableException(
        "polling state write contended accountId=" + accountId + " attempts=" + MAX_WRITE_ATTEMPTS);
  }

  private static Instant later(Instant current, Instant candidate) {
    if (current == null) {
      return candidate;
    }
    if (candidate == null) {
      return current;
    }
    return candidate.isAfter(current) ? candidate : current;
  }
}
