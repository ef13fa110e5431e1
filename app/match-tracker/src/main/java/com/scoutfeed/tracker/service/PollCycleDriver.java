/*
 * Where: Match tracker service layer
 * What: one poll tick: select due accounts, fetch their latest match, fan new matches out,
 *       then record them as processed
 * Why: delivery always precedes markProcessed, so a crash in between re-notifies instead of
 *      losing the notification
 */
package com.scoutfeed.tracker.service;

import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.scoutfeed.common.CorrelationIds;
import com.scoutfeed.common.MdcScope;
import com.scoutfeed.tracker.config.TrackerPollingProperties;
import com.scoutfeed.tracker.config.TrackerRuntimeConfig;
import com.scoutfeed.tracker.model.ChannelTarget;
import com.scoutfeed.tracker.model.DeliveryResult;
import com.scoutfeed.tracker.model.LatestMatch;
import com.scoutfeed.tracker.model.MatchNotification;
import com.scoutfeed.tracker.model.PollCycleReport;
import com.scoutfeed.tracker.model.PollingState;
import com.scoutfeed.tracker.model.RosterEntry;
import com.scoutfeed.tracker.model.TrackedAccount;
import com.scoutfeed.tracker.repository.TrackedAccountRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class PollCycleDriver {

  private static final Logger logger = LoggerFactory.getLogger(PollCycleDriver.class);
  static final String MDC_CYCLE_ID = "cycle_id";
  static final String MDC_ACCOUNT_ID = "account_id";
  static final String MDC_MATCH_ID = "match_id";
  private static final int SUSPEND_REASON_MAX_LENGTH = 500;

  private final TrackedAccountRepository accountRepository;
  private final DueSelector dueSelector;
  private final PollingIntervalPolicy policy;
  private final MatchStateTracker stateTracker;
  private final UpstreamMatchFetcher matchFetcher;
  private final NotificationResolver notificationResolver;
  private final DeliveryGuard deliveryGuard;
  private final TrackerMetrics metrics;
  private final TrackerPollingProperties properties;
  private final ExecutorService workerPool;
  private final TimeLimiter timeLimiter;
  private final Clock clock;
  private final ReentrantLock cycleLock = new ReentrantLock();
  private final KeyedLocks<Long> accountLocks = new KeyedLocks<>();

  public PollCycleDriver(
      TrackedAccountRepository accountRepository,
      DueSelector dueSelector,
      PollingIntervalPolicy policy,
      MatchStateTracker stateTracker,
      UpstreamMatchFetcher matchFetcher,
      NotificationResolver notificationResolver,
      DeliveryGuard deliveryGuard,
      TrackerMetrics metrics,
      TrackerPollingProperties properties,
      @Qualifier(TrackerRuntimeConfig.POLL_WORKER_POOL) ExecutorService workerPool,
      TimeLimiter timeLimiter,
      Clock clock) {
    this.accountRepository = accountRepository;
    this.dueSelector = dueSelector;
    this.policy = policy;
    this.stateTracker = stateTracker;
    this.matchFetcher = matchFetcher;
    this.notificationResolver = notificationResolver;
    this.deliveryGuard = deliveryGuard;
    this.metrics = metrics;
    this.properties = properties;
    this.workerPool = workerPool;
    this.timeLimiter = timeLimiter;
    this.clock = clock;
  }

  /** Runs one tick. Returns a skipped report when the previous tick is still draining. */
  public PollCycleReport runCycle() {
    final String cycleId = CorrelationIds.newCycleId();
    if (!cycleLock.tryLock()) {
      logger.warn("poll cycle skipped, previous cycle still running cycleId={}", cycleId);
      final PollCycleReport skipped = PollCycleReport.skipped(cycleId);
      metrics.recordCycle(skipped);
      return skipped;
    }
    try (MdcScope ignored = MdcScope.of(MDC_CYCLE_ID, cycleId)) {
      final PollCycleReport report = runLocked(cycleId);
      metrics.recordCycle(report);
      logger.info(
          "poll cycle finished cycleId={} roster={} due={} checked={} matches={} sent={} denied={}"
              + " dropped={} fetchFailures={} abandoned={} elapsedMs={}",
          cycleId,
          report.rosterSize(),
          report.accountsDue(),
          report.accountsChecked(),
          report.matchesFound(),
          report.notificationsSent(),
          report.notificationsDenied(),
          report.notificationsDropped(),
          report.fetchFailures(),
          report.abandonedChecks(),
          report.elapsed().toMillis());
      return report;
    } finally {
      cycleLock.unlock();
    }
  }

  private PollCycleReport runLocked(String cycleId) {
    final long startedNanos = System.nanoTime();
    final long deadlineNanos = startedNanos + properties.cycleDeadline().toNanos();
    final Instant now = clock.instant();
    final CycleTally tally = new CycleTally();

    final List<RosterEntry> roster;
    try {
      roster = accountRepository.findRoster();
    } catch (DataAccessException ex) {
      logger.warn("roster unavailable, poll cycle ends early cycleId={}", cycleId, ex);
      return tally.toReport(cycleId, 0, 0, elapsedSince(startedNanos));
    }
    logTierDistribution(roster, now);

    final List<TrackedAccount> due = dueSelector.dueAccounts(roster, now);
    final List<TrackedAccount> selected = capPerCycle(due, roster);
    if (selected.size() < due.size()) {
      logger.info(
          "poll cycle capped cycleId={} due={} selected={}", cycleId, due.size(), selected.size());
    }

    final List<Discovery> discoveries = checkPhase(cycleId, selected, now, deadlineNanos, tally);
    dispatchPhase(cycleId, discoveries, now, deadlineNanos, tally);
    return tally.toReport(cycleId, roster.size(), due.size(), elapsedSince(startedNanos));
  }

  // longest-unchecked first, so a capped roster cannot starve anyone
  private List<TrackedAccount> capPerCycle(List<TrackedAccount> due, List<RosterEntry> roster) {
    final int cap = properties.maxAccountsPerCycle();
    if (due.size() <= cap) {
      return due;
    }
    final Map<Long, Instant> lastChecked = new HashMap<>();
    for (RosterEntry entry : roster) {
      lastChecked.put(entry.account().accountId(), entry.state().lastCheckedAt());
    }
    final Comparator<TrackedAccount> oldestFirst =
        Comparator.comparing(
                (TrackedAccount account) -> lastChecked.get(account.accountId()),
                Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(TrackedAccount::accountId);
    return due.stream().sorted(oldestFirst).limit(cap).toList();
  }

  private List<Discovery> checkPhase(
      String cycleId,
      List<TrackedAccount> accounts,
      Instant now,
      long deadlineNanos,
      CycleTally tally) {
    final List<Callable<CheckOutcome>> tasks = new ArrayList<>(accounts.size());
    for (TrackedAccount account : accounts) {
      tasks.add(() -> check(cycleId, account, now));
    }
    final List<Future<CheckOutcome>> futures = invokeBeforeDeadline(tasks, deadlineNanos);
    final List<Discovery> discoveries = new ArrayList<>();
    for (int i = 0; i < accounts.size(); i++) {
      final TrackedAccount account = accounts.get(i);
      final CheckOutcome outcome =
          i < futures.size() ? await(futures.get(i), account) : CheckOutcome.ABANDONED;
      tally.record(outcome);
      if (outcome == CheckOutcome.ABANDONED) {
        metrics.recordFetchFailure("deadline");
        logger.warn(
            "upstream check abandoned at cycle deadline cycleId={} account_id={}",
            cycleId,
            account.accountId());
      }
      if (outcome.discovery != null) {
        discoveries.add(outcome.discovery);
      }
    }
    return discoveries;
  }

  private CheckOutcome await(Future<CheckOutcome> future, TrackedAccount account) {
    if (future.isCancelled()) {
      return CheckOutcome.ABANDONED;
    }
    try {
      return future.get();
    } catch (CancellationException ex) {
      return CheckOutcome.ABANDONED;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return CheckOutcome.ABANDONED;
    } catch (ExecutionException ex) {
      metrics.recordFetchFailure("unexpected");
      logger.error("upstream check crashed account_id={}", account.accountId(), ex.getCause());
      return CheckOutcome.FAILED;
    }
  }

  private CheckOutcome check(String cycleId, TrackedAccount account, Instant now) {
    final Lock lock = accountLocks.get(account.accountId());
    if (!lock.tryLock()) {
      // a task abandoned by an earlier cycle is still working on this account
      metrics.recordFetchFailure("busy");
      logger.warn("account busy, check skipped account_id={}", account.accountId());
      return CheckOutcome.BUSY;
    }
    try (MdcScope ignored =
        MdcScope.open().put(MDC_CYCLE_ID, cycleId).put(MDC_ACCOUNT_ID, account.accountId())) {
      final Optional<LatestMatch> latest;
      try {
        latest = fetchLatest(account);
      } catch (FetchTransientException ex) {
        metrics.recordFetchFailure("transient");
        logger.warn(
            "upstream fetch failed, retrying next tick account_id={} reason={}",
            account.accountId(),
            ex.getMessage());
        return CheckOutcome.FAILED;
      } catch (FetchPermanentException ex) {
        metrics.recordFetchFailure("permanent");
        logger.warn(
            "upstream rejected account, suspending account_id={} reason={}",
            account.accountId(),
            ex.getMessage());
        stateTracker.suspend(account.accountId(), truncate(ex.getMessage()), now);
        return CheckOutcome.FAILED;
      }
      if (latest.isEmpty()) {
        stateTracker.recordCheckAttempt(account.accountId(), now);
        return CheckOutcome.NO_MATCH;
      }
      final LatestMatch match = latest.get();
      if (stateTracker.hasProcessed(account.accountId(), match.matchId())) {
        stateTracker.recordCheckAttempt(account.accountId(), now);
        return CheckOutcome.ALREADY_PROCESSED;
      }
      return CheckOutcome.discovered(new Discovery(account, match));
    } catch (StoreUnavailableException ex) {
      metrics.recordFetchFailure("store");
      logger.warn("polling state unavailable, account skipped account_id={}", account.accountId(), ex);
      return CheckOutcome.FAILED;
    } finally {
      lock.unlock();
    }
  }

  private Optional<LatestMatch> fetchLatest(TrackedAccount account) {
    try {
      final Optional<LatestMatch> latest =
          timeLimiter.callWithTimeout(
              () -> matchFetcher.latestMatch(account.externalAccountId(), account.region()),
              properties.fetchTimeout());
      return latest == null ? Optional.empty() : latest;
    } catch (TimeoutException ex) {
      throw new FetchTransientException("fetch timed out after " + properties.fetchTimeout(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new FetchTransientException("fetch interrupted", ex);
    } catch (ExecutionException | UncheckedExecutionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof UpstreamFetchException fetchException) {
        throw fetchException;
      }
      throw new FetchTransientException("fetch failed unexpectedly: " + cause, cause);
    }
  }

  private void dispatchPhase(
      String cycleId,
      List<Discovery> discoveries,
      Instant now,
      long deadlineNanos,
      CycleTally tally) {
    // accounts that played the same match collapse into one fan-out
    final Map<String, List<Discovery>> byMatch = new LinkedHashMap<>();
    for (Discovery discovery : discoveries) {
      byMatch.computeIfAbsent(discovery.match().matchId(), ignored -> new ArrayList<>()).add(discovery);
    }
    tally.matchesFound = byMatch.size();
    if (byMatch.isEmpty()) {
      return;
    }
    final List<String> matchIds = new ArrayList<>(byMatch.keySet());
    final List<Callable<DispatchOutcome>> jobs = new ArrayList<>(matchIds.size());
    for (String matchId : matchIds) {
      final List<Discovery> group = byMatch.get(matchId);
      jobs.add(() -> dispatch(cycleId, matchId, group, now));
    }
    final List<Future<DispatchOutcome>> futures = invokeBeforeDeadline(jobs, deadlineNanos);
    for (int i = 0; i < matchIds.size(); i++) {
      final String matchId = matchIds.get(i);
      final DispatchOutcome outcome =
          i < futures.size() ? awaitDispatch(futures.get(i), matchId) : DispatchOutcome.ABANDONED;
      if (outcome.abandoned()) {
        metrics.recordDispatchAbandoned();
        logger.warn(
            "match fan-out abandoned at cycle deadline, redelivered next tick cycleId={} match_id={}",
            cycleId,
            matchId);
      }
      tally.notificationsSent += outcome.sent();
      tally.notificationsDenied += outcome.denied();
      tally.notificationsDropped += outcome.dropped();
    }
  }

  private DispatchOutcome awaitDispatch(Future<DispatchOutcome> future, String matchId) {
    if (future.isCancelled()) {
      return DispatchOutcome.ABANDONED;
    }
    try {
      return future.get();
    } catch (CancellationException ex) {
      return DispatchOutcome.ABANDONED;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return DispatchOutcome.ABANDONED;
    } catch (ExecutionException ex) {
      logger.error("match fan-out crashed match_id={}", matchId, ex.getCause());
      return DispatchOutcome.NONE;
    }
  }

  private DispatchOutcome dispatch(
      String cycleId, String matchId, List<Discovery> group, Instant now) {
    try (MdcScope ignored =
        MdcScope.open().put(MDC_CYCLE_ID, cycleId).put(MDC_MATCH_ID, matchId)) {
      final List<TrackedAccount> accounts = group.stream().map(Discovery::account).toList();
      final Set<Long> playerIds = new TreeSet<>();
      for (TrackedAccount account : accounts) {
        playerIds.add(account.playerId());
      }
      final Set<ChannelTarget> channels;
      try {
        channels = notificationResolver.channelsFor(playerIds);
      } catch (StoreUnavailableException ex) {
        // nothing delivered and nothing marked: the match is picked up again next tick
        logger.warn("subscriptions unavailable, fan-out postponed match_id={}", matchId, ex);
        return DispatchOutcome.NONE;
      }
      final MatchNotification notification =
          new MatchNotification(matchId, group.get(0).match().matchTime(), accounts);
      int sent = 0;
      int denied = 0;
      int dropped = 0;
      for (ChannelTarget channel : channels) {
        if (Thread.currentThread().isInterrupted()) {
          return new DispatchOutcome(sent, denied, dropped, true);
        }
        final DeliveryResult result = deliveryGuard.deliver(channel, notification);
        if (result == DeliveryResult.SENT) {
          sent++;
        } else if (result == DeliveryResult.PERMISSION_DENIED) {
          denied++;
        } else {
          dropped++;
        }
      }
      if (Thread.currentThread().isInterrupted()) {
        return new DispatchOutcome(sent, denied, dropped, true);
      }
      if (channels.isEmpty()) {
        logger.debug("no subscribed channels match_id={} accounts={}", matchId, accounts.size());
      }
      for (Discovery discovery : group) {
        markDelivered(discovery, now);
      }
      return new DispatchOutcome(sent, denied, dropped, false);
    }
  }

  private void markDelivered(Discovery discovery, Instant now) {
    final long accountId = discovery.account().accountId();
    final Lock lock = accountLocks.get(accountId);
    lock.lock();
    try {
      stateTracker.markProcessed(accountId, discovery.match().matchId(), discovery.match().matchTime());
      stateTracker.recordCheckAttempt(accountId, now);
    } catch (StoreUnavailableException ex) {
      logger.error(
          "fan-out attempted but match not recorded, may notify again account_id={} match_id={}",
          accountId,
          discovery.match().matchId(),
          ex);
    } finally {
      lock.unlock();
    }
  }

  private <T> List<Future<T>> invokeBeforeDeadline(List<Callable<T>> tasks, long deadlineNanos) {
    if (tasks.isEmpty()) {
      return List.of();
    }
    final long remainingNanos = deadlineNanos - System.nanoTime();
    if (remainingNanos <= 0) {
      return List.of();
    }
    try {
      return workerPool.invokeAll(tasks, remainingNanos, TimeUnit.NANOSECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return List.of();
    }
  }

  private void logTierDistribution(List<RosterEntry> roster, Instant now) {
    if (!logger.isDebugEnabled()) {
      return;
    }
    final Map<Duration, Integer> perInterval = new TreeMap<>();
    int suspended = 0;
    for (RosterEntry entry : roster) {
      final PollingState state = entry.state();
      if (state.suspended()) {
        suspended++;
        continue;
      }
      perInterval.merge(policy.interval(state.lastMatchTime(), now), 1, Integer::sum);
    }
    logger.debug("roster by polling interval {} suspended={}", perInterval, suspended);
  }

  private static String truncate(String reason) {
    if (reason == null) {
      return "permanent upstream failure";
    }
    return reason.length() <= SUSPEND_REASON_MAX_LENGTH
        ? reason
        : reason.substring(0, SUSPEND_REASON_MAX_LENGTH);
  }

  private static Duration elapsedSince(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos);
  }

  private record Discovery(TrackedAccount account, LatestMatch match) {}

  private record DispatchOutcome(int sent, int denied, int dropped, boolean abandoned) {
    static final DispatchOutcome NONE = new DispatchOutcome(0, 0, 0, false);
    static final DispatchOutcome ABANDONED = new DispatchOutcome(0, 0, 0, true);
  }

  private static final class CheckOutcome {
    static final CheckOutcome NO_MATCH = new CheckOutcome(true, false, null);
    static final CheckOutcome ALREADY_PROCESSED = new CheckOutcome(true, false, null);
    static final CheckOutcome FAILED = new CheckOutcome(false, false, null);
    static final CheckOutcome ABANDONED = new CheckOutcome(false, true, null);
    static final CheckOutcome BUSY = new CheckOutcome(false, true, null);

    final boolean checked;
    final boolean abandoned;
    final Discovery discovery;

    private CheckOutcome(boolean checked, boolean abandoned, Discovery discovery) {
      this.checked = checked;
      this.abandoned = abandoned;
      this.discovery = discovery;
    }

    static CheckOutcome discovered(Discovery discovery) {
      return new CheckOutcome(true, false, discovery);
    }
  }

  private static final class CycleTally {
    int accountsChecked;
    int matchesFound;
    int notificationsSent;
    int notificationsDenied;
    int notificationsDropped;
    int fetchFailures;
    int abandonedChecks;

    void record(CheckOutcome outcome) {
      if (outcome.checked) {
        accountsChecked++;
        return;
      }
      fetchFailures++;
      if (outcome.abandoned) {
        abandonedChecks++;
      }
    }

    PollCycleReport toReport(String cycleId, int rosterSize, int accountsDue, Duration elapsed) {
      return new PollCycleReport(
          cycleId,
          false,
          rosterSize,
          accountsDue,
          accountsChecked,
          matchesFound,
          notificationsSent,
          notificationsDenied,
          notificationsDropped,
          fetchFailures,
          abandonedChecks,
          elapsed);
    }
  }
}
