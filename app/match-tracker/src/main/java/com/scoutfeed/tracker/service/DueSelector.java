/*
 * Where: Match tracker service layer
 * What: picks the roster accounts whose polling interval has elapsed
 * Why: a full scan per tick with no retained state; revisit with a min-heap keyed on next-due
 *      time if the roster grows past a few thousand accounts
 */
package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.PollingState;
import com.scoutfeed.tracker.model.RosterEntry;
import com.scoutfeed.tracker.model.TrackedAccount;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DueSelector {

  private final PollingIntervalPolicy policy;

  /** Accounts due at {@code now}, in no particular order. Suspended accounts are never due. */
  public List<TrackedAccount> dueAccounts(List<RosterEntry> roster, Instant now) {
    final List<TrackedAccount> due = new ArrayList<>();
    for (RosterEntry entry : roster) {
      if (isDue(entry.state(), now)) {
        due.add(entry.account());
      }
    }
    return due;
  }

  boolean isDue(PollingState state, Instant now) {
    if (state.suspended()) {
      return false;
    }
    if (state.lastCheckedAt() == null) {
      return true;
    }
    final Duration interval = policy.interval(state.lastMatchTime(), now);
    return Duration.between(state.lastCheckedAt(), now).compareTo(interval) >= 0;
  }
}
