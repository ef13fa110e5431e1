package com.scoutfeed.tracker.model;

import java.time.Instant;

public record OwnerNotice(
    String channelId, OwnerNoticeReason reason, String detail, Instant occurredAt) {}
