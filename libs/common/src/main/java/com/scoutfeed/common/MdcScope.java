/*
 * Where: shared logging helpers
 * What: puts MDC keys for the duration of a try-with-resources block and removes exactly those keys
 * Why: worker threads are pooled, so keys left behind would leak into unrelated log lines
 */
package com.scoutfeed.common;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;

public final class MdcScope implements AutoCloseable {

  private final List<String> keys = new ArrayList<>();

  private MdcScope() {}

  public static MdcScope open() {
    return new MdcScope();
  }

  public static MdcScope of(String key, Object value) {
    return open().put(key, value);
  }

  /** Blank or null values are skipped so callers can pass optional context without checks. */
  public MdcScope put(String key, Object value) {
    if (value == null) {
      return this;
    }
    final String text = String.valueOf(value);
    if (text.isBlank()) {
      return this;
    }
    MDC.put(key, text);
    keys.add(key);
    return this;
  }

  @Override
  public void close() {
    for (String key : keys) {
      MDC.remove(key);
    }
    keys.clear();
  }
}
