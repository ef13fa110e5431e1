package com.scoutfeed.tracker.api;

public class AccountNotFoundException extends RuntimeException {
  public AccountNotFoundException(long accountId) {
    super("account not found: " + accountId);
  }
}
