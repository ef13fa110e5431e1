package com.scoutfeed.tracker.worker;

import com.scoutfeed.tracker.service.PermissionErrorMaintenanceService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "tracker.maintenance.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class PermissionErrorMaintenanceWorker {

  private static final Logger logger =
      LoggerFactory.getLogger(PermissionErrorMaintenanceWorker.class);

  private final PermissionErrorMaintenanceService maintenanceService;

  @Scheduled(fixedDelayString = "${tracker.maintenance.interval}")
  public void run() {
    try {
      maintenanceService.escalateAbandonedServers();
      maintenanceService.deleteResolvedErrors();
    } catch (DataAccessException ex) {
      logger.warn("permission error maintenance failed, retrying next run", ex);
    }
  }
}
