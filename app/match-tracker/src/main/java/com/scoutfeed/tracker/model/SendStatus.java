package com.scoutfeed.tracker.model;

public enum SendStatus {
  SENT,
  PERMISSION_DENIED,
  NOT_FOUND,
  TRANSIENT
}
