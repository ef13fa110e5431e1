package com.scoutfeed.tracker.service;

/**
 * The upstream will never answer for this account (for example an unknown or deleted account
 * id). The account is suspended until an operator resumes it.
 */
public class FetchPermanentException extends UpstreamFetchException {

  public FetchPermanentException(String message) {
    super(message, null);
  }

  public FetchPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
