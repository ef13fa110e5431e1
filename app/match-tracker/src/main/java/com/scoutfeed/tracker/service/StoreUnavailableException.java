/*
 * Where: Match tracker service layer
 * What: a polling state or subscription read/write that could not be completed
 * Why: the poll cycle skips the affected account or match for this tick instead of aborting
 */
package com.scoutfeed.tracker.service;

public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
