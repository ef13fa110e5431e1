/*
 * Where: Match tracker service layer
 * What: escalates servers whose channels stay unreachable and prunes resolved audit rows
 * Why: a server where the bot lost access for a week needs a human decision; the per-match
 *      notices are suppressed by then
 */
package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.config.PermissionErrorMaintenanceProperties;
import com.scoutfeed.tracker.model.AbandonedServer;
import com.scoutfeed.tracker.model.OwnerNotice;
import com.scoutfeed.tracker.model.OwnerNoticeReason;
import com.scoutfeed.tracker.repository.ChannelPermissionErrorRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PermissionErrorMaintenanceService {

  private static final Logger logger =
      LoggerFactory.getLogger(PermissionErrorMaintenanceService.class);

  private final ChannelPermissionErrorRepository permissionErrorRepository;
  private final OwnerNotifier ownerNotifier;
  private final TrackerMetrics metrics;
  private final PermissionErrorMaintenanceProperties properties;
  private final Clock clock;

  /** Returns the number of servers escalated. */
  public int escalateAbandonedServers() {
    final Instant now = clock.instant();
    final List<AbandonedServer> servers =
        permissionErrorRepository.findAbandonedServers(now.minus(properties.abandonAfter()));
    int escalated = 0;
    for (AbandonedServer server : servers) {
      final String detail =
          "channels failing since "
              + server.firstOccurrence()
              + ", last error "
              + server.lastOccurrence()
              + ", "
              + server.errorCount()
              + " consecutive errors";
      try {
        ownerNotifier.notify(
            server.serverScope(),
            new OwnerNotice(null, OwnerNoticeReason.CHANNEL_ABANDONED, detail, now));
      } catch (RuntimeException ex) {
        // not marked, so the next run tries again
        logger.warn("abandoned server notice failed server_scope={}", server.serverScope(), ex);
        continue;
      }
      permissionErrorRepository.markServerOwnerNotified(server.serverScope());
      metrics.recordAbandonedServer();
      escalated++;
      logger.warn(
          "server escalated as abandoned server_scope={} firstOccurrence={} errorCount={}",
          server.serverScope(),
          server.firstOccurrence(),
          server.errorCount());
    }
    return escalated;
  }

  public int deleteResolvedErrors() {
    final Instant threshold = clock.instant().minus(properties.resolvedRetention());
    final int deleted = permissionErrorRepository.deleteResolvedOlderThan(threshold);
    metrics.recordResolvedErrorsDeleted(deleted);
    if (deleted > 0) {
      logger.info("resolved permission errors deleted count={} threshold={}", deleted, threshold);
    }
    return deleted;
  }
}
