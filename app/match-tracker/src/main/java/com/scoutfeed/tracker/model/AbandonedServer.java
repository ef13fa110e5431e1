package com.scoutfeed.tracker.model;

import java.time.Instant;

/** Server whose channels have been failing on permissions with no success for a long time. */
public record AbandonedServer(
    String serverScope,
    Instant firstOccurrence,
    Instant lastOccurrence,
    long errorCount) {}
