package com.scoutfeed.tracker.model;

import java.time.Instant;

/** Most recent match the upstream reports for one account. */
public record LatestMatch(String matchId, Instant matchTime) {}
