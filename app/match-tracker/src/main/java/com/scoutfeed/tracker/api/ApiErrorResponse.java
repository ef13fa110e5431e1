/*
 * Where: Match tracker admin API
 * What: error body shared by every admin endpoint
 */
package com.scoutfeed.tracker.api;

public record ApiErrorResponse(String code, String message) {}
