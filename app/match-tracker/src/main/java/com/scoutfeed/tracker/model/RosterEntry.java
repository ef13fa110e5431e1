package com.scoutfeed.tracker.model;

public record RosterEntry(TrackedAccount account, PollingState state) {}
