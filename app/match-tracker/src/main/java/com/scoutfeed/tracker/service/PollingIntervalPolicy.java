/*
 * Where: Match tracker service layer
 * What: maps time since an account's last match to how long to wait before polling it again
 * Why: active players are checked every minute while dormant ones cost one call per hour
 */
package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.config.PollingPolicyProperties;
import com.scoutfeed.tracker.config.PollingPolicyProperties.Tier;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PollingIntervalPolicy {

  private final List<Tier> tiers;
  private final Duration neverSeenInterval;
  private final Duration maxInterval;

  public PollingIntervalPolicy(PollingPolicyProperties properties) {
    this.tiers =
        properties.tiers().stream().sorted(Comparator.comparing(Tier::activeWithin)).toList();
    this.maxInterval = properties.maxInterval();
    this.neverSeenInterval = bounded(properties.neverSeenInterval());
  }

  /**
   * Interval until the next check. Total: a missing {@code lastMatchTime} or {@code now} yields
   * the never-seen interval, and a match time in the future counts as just played.
   */
  public Duration interval(Instant lastMatchTime, Instant now) {
    if (lastMatchTime == null || now == null) {
      return neverSeenInterval;
    }
    Duration elapsed = Duration.between(lastMatchTime, now);
    if (elapsed.isNegative()) {
      elapsed = Duration.ZERO;
    }
    for (Tier tier : tiers) {
      if (elapsed.compareTo(tier.activeWithin()) < 0) {
        return bounded(tier.interval());
      }
    }
    return maxInterval;
  }

  public List<Tier> tiers() {
    return tiers;
  }

  private Duration bounded(Duration interval) {
    if (interval == null || interval.isZero() || interval.isNegative()) {
      return maxInterval;
    }
    return interval.compareTo(maxInterval) > 0 ? maxInterval : interval;
  }
}
