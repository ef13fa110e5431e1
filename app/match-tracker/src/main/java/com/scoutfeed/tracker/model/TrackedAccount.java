/*
 * Where: Match tracker domain model
 * What: one upstream game account watched on behalf of a Discord server
 * Why: accounts are scoped per server, so the same external id may appear once per server
 */
package com.scoutfeed.tracker.model;

public record TrackedAccount(
    long accountId,
    String serverScope,
    long playerId,
    String externalAccountId,
    String region,
    String alias) {}
