package com.scoutfeed.tracker.worker;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scoutfeed.tracker.service.PermissionErrorMaintenanceService;
import com.scoutfeed.tracker.service.PollCycleDriver;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

class PollCycleWorkerTest {

  @Test
  void failingCycleDoesNotEscapeTheScheduler() {
    final PollCycleDriver driver = Mockito.mock(PollCycleDriver.class);
    when(driver.runCycle()).thenThrow(new IllegalStateException("boom"));
    final PollCycleWorker worker = new PollCycleWorker(driver);

    worker.run();

    verify(driver).runCycle();
  }

  @Test
  void maintenanceRunsEscalationThenCleanup() {
    final PermissionErrorMaintenanceService service =
        Mockito.mock(PermissionErrorMaintenanceService.class);
    final PermissionErrorMaintenanceWorker worker = new PermissionErrorMaintenanceWorker(service);

    worker.run();

    verify(service).escalateAbandonedServers();
    verify(service).deleteResolvedErrors();
  }

  @Test
  void maintenanceSurvivesStoreFailure() {
    final PermissionErrorMaintenanceService service =
        Mockito.mock(PermissionErrorMaintenanceService.class);
    when(service.escalateAbandonedServers())
        .thenThrow(new DataAccessResourceFailureException("db down"));
    final PermissionErrorMaintenanceWorker worker = new PermissionErrorMaintenanceWorker(service);

    worker.run();

    verify(service).escalateAbandonedServers();
  }
}
