/*
 * Where: Match tracker domain model
 * What: last recorded delivery state of one (server scope, channel) pair
 * Why: repeated owner notices for a channel that stays broken are suppressed until it recovers
 */
package com.scoutfeed.tracker.model;

public enum DeliveryOutcome {
  OK,
  PERMISSION_DENIED
}
