/*
 * Where: shared logging helpers
 * What: ids that tie log lines and published messages back to one cycle, notice or request
 */
package com.scoutfeed.common;

import java.util.UUID;

public final class CorrelationIds {
  private static final int SHORT_ID_LENGTH = 8;

  private CorrelationIds() {}

  public static String newCycleId() {
    return "cycle-" + UUID.randomUUID().toString().substring(0, SHORT_ID_LENGTH);
  }

  public static String newNoticeId() {
    return UUID.randomUUID().toString();
  }

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }
}
