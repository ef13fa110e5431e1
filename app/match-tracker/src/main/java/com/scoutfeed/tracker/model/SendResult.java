package com.scoutfeed.tracker.model;

public record SendResult(SendStatus status, String detail) {

  public static SendResult sent() {
    return new SendResult(SendStatus.SENT, null);
  }

  public static SendResult permissionDenied(String detail) {
    return new SendResult(SendStatus.PERMISSION_DENIED, detail);
  }

  public static SendResult notFound(String detail) {
    return new SendResult(SendStatus.NOT_FOUND, detail);
  }

  public static SendResult transientFailure(String detail) {
    return new SendResult(SendStatus.TRANSIENT, detail);
  }
}
