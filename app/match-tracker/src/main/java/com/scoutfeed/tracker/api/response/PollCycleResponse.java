package com.scoutfeed.tracker.api.response;

import com.scoutfeed.tracker.model.PollCycleReport;

public record PollCycleResponse(
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
    long elapsedMillis) {

  public static PollCycleResponse of(PollCycleReport report) {
    return new PollCycleResponse(
        report.cycleId(),
        report.skipped(),
        report.rosterSize(),
        report.accountsDue(),
        report.accountsChecked(),
        report.matchesFound(),
        report.notificationsSent(),
        report.notificationsDenied(),
        report.notificationsDropped(),
        report.fetchFailures(),
        report.abandonedChecks(),
        report.elapsed().toMillis());
  }
}
