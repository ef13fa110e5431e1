package com.scoutfeed.tracker.nats;

/** JSON body of an owner notice as consumed by the Discord gateway. */
public record OwnerNoticePayload(
    String noticeId,
    String serverScope,
    String channelId,
    String reason,
    String detail,
    String occurredAt,
    String cycleId) {}
