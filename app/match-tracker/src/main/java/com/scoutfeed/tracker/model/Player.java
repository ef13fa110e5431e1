package com.scoutfeed.tracker.model;

import java.time.Instant;

public record Player(long playerId, String serverScope, String alias, Instant createdAt) {}
