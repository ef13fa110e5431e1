/*
 * Where: Match tracker domain model
 * What: per-cycle counters returned by the driver and exported as metrics
 * Why: one value object keeps the summary log line, metrics and admin response consistent
 */
package com.scoutfeed.tracker.model;

import java.time.Duration;

public record PollCycleReport(
    String cycleId,
    boolean skipped,
    int rosterSize,
    int accountsDue,
    int accountsChecked,
    int matchesFound,
    int notificationsSent,
    int notificationsDenied,
    int notificationsDropped,
    int fetchFailures,
    int abandonedChecks,
    Duration elapsed) {

  public static PollCycleReport skipped(String cycleId) {
    return new PollCycleReport(cycleId, true, 0, 0, 0, 0, 0, 0, 0, 0, 0, Duration.ZERO);
  }
}
