/*
 * Where: Match tracker runtime configuration
 * What: bounded worker pool, I/O time limiter and owner notice executor
 * Why: every blocking call of the poll cycle needs an explicit bound on threads and time
 */
package com.scoutfeed.tracker.config;

import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TrackerRuntimeConfig {

  public static final String POLL_WORKER_POOL = "pollWorkerPool";
  public static final String IO_EXECUTOR = "trackerIoExecutor";
  public static final String OWNER_NOTICE_EXECUTOR = "ownerNoticeExecutor";

  @Bean(name = POLL_WORKER_POOL, destroyMethod = "shutdownNow")
  public ExecutorService pollWorkerPool(TrackerPollingProperties properties) {
    return Executors.newFixedThreadPool(
        properties.maxConcurrentFetches(), daemonThreads("poll-worker-%d"));
  }

  // fetch and send run here so a hung socket can be abandoned by the time limiter
  @Bean(name = IO_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService trackerIoExecutor() {
    return Executors.newCachedThreadPool(daemonThreads("tracker-io-%d"));
  }

  @Bean
  public TimeLimiter trackerTimeLimiter(@Qualifier(IO_EXECUTOR) ExecutorService ioExecutor) {
    return SimpleTimeLimiter.create(ioExecutor);
  }

  @Bean(name = OWNER_NOTICE_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService ownerNoticeExecutor() {
    return Executors.newSingleThreadExecutor(daemonThreads("owner-notice-%d"));
  }

  private static ThreadFactory daemonThreads(String nameFormat) {
    return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
  }
}
