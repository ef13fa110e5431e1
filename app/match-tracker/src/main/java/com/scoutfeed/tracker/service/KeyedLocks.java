package com.scoutfeed.tracker.service;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per distinct key. Unlike lock striping, two different keys never share a lock.
 *
 * <p>Locks are weakly held: an entry lives as long as some thread still references its lock.
 */
final class KeyedLocks<K> {

  private final LoadingCache<K, Lock> locks =
      CacheBuilder.newBuilder()
          .weakValues()
          .build(
              new CacheLoader<K, Lock>() {
                @Override
                public Lock load(K key) {
                  return new ReentrantLock();
                }
              });

  Lock get(K key) {
    return locks.getUnchecked(key);
  }
}
