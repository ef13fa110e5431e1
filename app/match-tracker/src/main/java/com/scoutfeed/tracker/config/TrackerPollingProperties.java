/*
 * Where: Match tracker configuration binding
 * What: tick, deadline and concurrency bounds of the poll cycle
 * Why: a cycle must finish before the next tick, and upstream concurrency must stay bounded
 */
package com.scoutfeed.tracker.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "tracker.polling")
@Validated
public record TrackerPollingProperties(
    boolean enabled,
    @NotNull Duration tickInterval,
    @NotNull Duration cycleDeadline,
    @Positive int maxConcurrentFetches,
    @Positive int maxAccountsPerCycle,
    @NotNull Duration fetchTimeout) {

  @AssertTrue(message = "tracker.polling.cycle-deadline must be positive and shorter than tick-interval")
  public boolean isCycleDeadlineWithinTick() {
    return isPositive(cycleDeadline)
        && isPositive(tickInterval)
        && cycleDeadline.compareTo(tickInterval) < 0;
  }

  @AssertTrue(message = "tracker.polling.fetch-timeout must be positive and not exceed cycle-deadline")
  public boolean isFetchTimeoutWithinDeadline() {
    return isPositive(fetchTimeout)
        && cycleDeadline != null
        && fetchTimeout.compareTo(cycleDeadline) <= 0;
  }

  private static boolean isPositive(Duration duration) {
    // null is reported by @NotNull
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
