package com.scoutfeed.tracker.model;

public enum OwnerNoticeReason {
  PERMISSION_DENIED,
  CHANNEL_ABANDONED
}
