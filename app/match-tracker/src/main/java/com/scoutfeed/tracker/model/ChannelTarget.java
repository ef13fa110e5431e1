/*
 * Where: Match tracker domain model
 * What: a destination channel plus the server scope it was reached through
 * Why: the scope is needed for permission bookkeeping and owner lookups, never for dedup
 */
package com.scoutfeed.tracker.model;

public record ChannelTarget(String channelId, String serverScope) {}
