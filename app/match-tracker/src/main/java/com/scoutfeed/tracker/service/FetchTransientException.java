package com.scoutfeed.tracker.service;

/** Rate limits, 5xx responses and network errors. The account is checked again next tick. */
public class FetchTransientException extends UpstreamFetchException {

  public FetchTransientException(String message) {
    super(message, null);
  }

  public FetchTransientException(String message, Throwable cause) {
    super(message, cause);
  }
}
