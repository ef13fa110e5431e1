/*
 * Where: Match tracker admin API
 * What: a player, account or subscription that already exists
 * Why: mapped to 409 so callers can tell a repeat from a failure
 */
package com.scoutfeed.tracker.api;

public class DuplicateRegistrationException extends RuntimeException {
  public DuplicateRegistrationException(String message) {
    super(message);
  }
}
