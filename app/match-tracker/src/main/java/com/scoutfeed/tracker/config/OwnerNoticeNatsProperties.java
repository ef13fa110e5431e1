/*
 * Where: Match tracker configuration binding
 * What: JetStream subject/stream used to hand owner notices to the Discord gateway
 */
package com.scoutfeed.tracker.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "tracker.nats")
@Validated
public record OwnerNoticeNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotNull Duration duplicateWindow) {

  @AssertTrue(message = "tracker.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return duplicateWindow != null && !duplicateWindow.isZero() && !duplicateWindow.isNegative();
  }
}
