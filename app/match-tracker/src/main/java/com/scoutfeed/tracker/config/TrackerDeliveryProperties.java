/*
 * Where: Match tracker configuration binding
 * What: send timeout and owner notice throttling for channel delivery
 */
package com.scoutfeed.tracker.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "tracker.delivery")
@Validated
public record TrackerDeliveryProperties(
    @NotNull Duration sendTimeout,
    @Positive double ownerNoticesPerSecond,
    @Positive int errorReasonMaxLength) {

  @AssertTrue(message = "tracker.delivery.send-timeout must be positive")
  public boolean isSendTimeoutPositive() {
    return sendTimeout != null && !sendTimeout.isZero() && !sendTimeout.isNegative();
  }
}
