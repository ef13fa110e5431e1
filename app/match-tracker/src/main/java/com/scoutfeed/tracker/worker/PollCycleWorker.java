/*
 * Where: Match tracker workers
 * What: runs one poll cycle per tick
 * Why: fixed delay, so a slow cycle pushes the next tick back instead of stacking up
 */
package com.scoutfeed.tracker.worker;

import com.scoutfeed.tracker.service.PollCycleDriver;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "tracker.polling.enabled", havingValue = "true", matchIfMissing = true)
public class PollCycleWorker {

  private static final Logger logger = LoggerFactory.getLogger(PollCycleWorker.class);

  private final PollCycleDriver driver;

  @Scheduled(
      fixedDelayString = "${tracker.polling.tick-interval}",
      initialDelayString = "${tracker.polling.initial-delay:PT10S}")
  public void run() {
    try {
      driver.runCycle();
    } catch (RuntimeException ex) {
      logger.error("poll cycle failed", ex);
    }
  }
}
