package com.scoutfeed.tracker.model;

public record PermissionCheck(boolean allowed, String reason) {

  public static PermissionCheck granted() {
    return new PermissionCheck(true, null);
  }

  public static PermissionCheck denied(String reason) {
    return new PermissionCheck(false, reason);
  }
}
