/*
 * Where: Match tracker service layer
 * What: poll cycle, delivery and owner notice metrics
 * Why: fetch failure spikes and permission denial trends must be visible from Prometheus
 */
package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.DeliveryResult;
import com.scoutfeed.tracker.model.PollCycleReport;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class TrackerMetrics {

  private static final String METRIC_CYCLE_TOTAL = "tracker.poll.cycle.total";
  private static final String METRIC_CYCLE_DURATION = "tracker.poll.cycle.duration";
  private static final String METRIC_ROSTER_SIZE = "tracker.roster.size";
  private static final String METRIC_ACCOUNTS_DUE = "tracker.poll.accounts.due";
  private static final String METRIC_ACCOUNTS_CHECKED = "tracker.poll.accounts.checked.total";
  private static final String METRIC_MATCHES_FOUND = "tracker.poll.matches.found.total";
  private static final String METRIC_FETCH_FAILURE = "tracker.poll.fetch.failure.total";
  private static final String METRIC_DISPATCH_ABANDONED = "tracker.poll.dispatch.abandoned.total";
  private static final String METRIC_DELIVERY_TOTAL = "tracker.delivery.total";
  private static final String METRIC_OWNER_NOTICE_TOTAL = "tracker.owner.notice.total";
  private static final String METRIC_ABANDONED_SERVERS = "tracker.maintenance.abandoned.servers.total";
  private static final String METRIC_RESOLVED_DELETED = "tracker.maintenance.resolved.deleted.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger rosterSize = new AtomicInteger(0);
  private final AtomicInteger accountsDue = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> taggedCounters = new ConcurrentHashMap<>();
  private final Counter accountsChecked;
  private final Counter matchesFound;
  private final Counter dispatchAbandoned;
  private final Counter abandonedServers;
  private final Counter resolvedDeleted;
  private final Timer cycleDuration;

  public TrackerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_ROSTER_SIZE, rosterSize, AtomicInteger::get)
        .description("Tracked accounts seen by the last poll cycle")
        .register(meterRegistry);
    Gauge.builder(METRIC_ACCOUNTS_DUE, accountsDue, AtomicInteger::get)
        .description("Accounts due in the last poll cycle")
        .register(meterRegistry);
    this.accountsChecked =
        Counter.builder(METRIC_ACCOUNTS_CHECKED)
            .description("Accounts whose upstream fetch completed")
            .register(meterRegistry);
    this.matchesFound =
        Counter.builder(METRIC_MATCHES_FOUND)
            .description("New matches discovered")
            .register(meterRegistry);
    this.dispatchAbandoned =
        Counter.builder(METRIC_DISPATCH_ABANDONED)
            .description("Match fan-outs cancelled at the cycle deadline")
            .register(meterRegistry);
    this.abandonedServers =
        Counter.builder(METRIC_ABANDONED_SERVERS)
            .description("Servers escalated for long-running channel permission errors")
            .register(meterRegistry);
    this.resolvedDeleted =
        Counter.builder(METRIC_RESOLVED_DELETED)
            .description("Resolved channel permission error rows deleted")
            .register(meterRegistry);
    this.cycleDuration =
        Timer.builder(METRIC_CYCLE_DURATION)
            .description("Wall time of completed poll cycles")
            .register(meterRegistry);
  }

  public void recordCycle(PollCycleReport report) {
    if (report.skipped()) {
      increment(METRIC_CYCLE_TOTAL, "result", "skipped", "Poll cycles by result");
      return;
    }
    increment(METRIC_CYCLE_TOTAL, "result", "completed", "Poll cycles by result");
    rosterSize.set(report.rosterSize());
    accountsDue.set(report.accountsDue());
    accountsChecked.increment(report.accountsChecked());
    matchesFound.increment(report.matchesFound());
    cycleDuration.record(report.elapsed());
  }

  /** reason: transient, timeout, permanent, store, unexpected, deadline, busy. */
  public void recordFetchFailure(String reason) {
    increment(METRIC_FETCH_FAILURE, "reason", reason, "Upstream fetches that did not complete");
  }

  public void recordDispatchAbandoned() {
    dispatchAbandoned.increment();
  }

  public void recordDelivery(DeliveryResult result) {
    increment(METRIC_DELIVERY_TOTAL, "result", result.metricValue(), "Channel delivery outcomes");
  }

  /** result: published, suppressed, rate_limited, rejected, failed. */
  public void recordOwnerNotice(String result) {
    increment(METRIC_OWNER_NOTICE_TOTAL, "result", result, "Owner notice outcomes");
  }

  public void recordAbandonedServer() {
    abandonedServers.increment();
  }

  public void recordResolvedErrorsDeleted(int count) {
    if (count > 0) {
      resolvedDeleted.increment(count);
    }
  }

  private void increment(String name, String tagKey, String tagValue, String description) {
    taggedCounters
        .computeIfAbsent(
            name + '|' + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
