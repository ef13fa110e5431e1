/*
 * Where: Match tracker persistence seam
 * What: per-account polling state with read-then-conditional-write access
 * Why: at-most-once processing needs a write that fails when another writer got there first
 */
package com.scoutfeed.tracker.repository;

import com.scoutfeed.tracker.model.PollingState;

public interface MatchStateStore {

  /** Returns {@link PollingState#EMPTY} for an account that has no state row yet. */
  PollingState get(long accountId);

  void set(long accountId, PollingState state);

  /**
   * Replaces the state only if the stored value still equals {@code expected}. An absent row
   * matches {@link PollingState#EMPTY}.
   *
   * @return false when the stored state changed in between
   */
  boolean compareAndSet(long accountId, PollingState expected, PollingState updated);
}
