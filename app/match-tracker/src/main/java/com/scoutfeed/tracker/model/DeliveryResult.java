package com.scoutfeed.tracker.model;

import java.util.Locale;

/** Classification of one delivery attempt as seen by the poll cycle. */
public enum DeliveryResult {
  SENT,
  PERMISSION_DENIED,
  DROPPED;

  public String metricValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
