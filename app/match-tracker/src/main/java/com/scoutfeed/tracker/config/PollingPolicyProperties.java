/*
 * Where: Match tracker configuration binding
 * What: the activity tier table behind the polling interval policy
 * Why: operators retune polling cadence through configuration instead of a code change
 */
package com.scoutfeed.tracker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "tracker.policy")
@Validated
public record PollingPolicyProperties(
    @NotEmpty List<@Valid @NotNull Tier> tiers,
    @NotNull Duration neverSeenInterval,
    @NotNull Duration maxInterval) {

  /** Accounts whose last match is younger than {@code activeWithin} are polled every {@code interval}. */
  public record Tier(@NotNull Duration activeWithin, @NotNull Duration interval) {}

  @AssertTrue(message = "tracker.policy intervals must be positive and not exceed max-interval")
  public boolean isIntervalsBounded() {
    if (!isPositive(maxInterval) || !isPositive(neverSeenInterval)) {
      return false;
    }
    if (neverSeenInterval.compareTo(maxInterval) > 0) {
      return false;
    }
    if (tiers == null) {
      return true;
    }
    for (Tier tier : tiers) {
      if (tier == null || !isPositive(tier.activeWithin()) || !isPositive(tier.interval())) {
        return false;
      }
      if (tier.interval().compareTo(maxInterval) > 0) {
        return false;
      }
    }
    return true;
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
