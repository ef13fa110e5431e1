package com.scoutfeed.tracker.service;

/** Failure reported by an {@link UpstreamMatchFetcher}; subclasses decide whether to retry. */
public abstract class UpstreamFetchException extends RuntimeException {

  protected UpstreamFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
