/*
 * Where: Match tracker service layer
 * What: delivers one match notification to one channel and classifies the outcome
 * Why: a channel the bot cannot post to must reach its server owner once, not on every match
 */
package com.scoutfeed.tracker.service;

import static com.scoutfeed.tracker.repository.ChannelPermissionErrorRepository.ERROR_TYPE_API_ERROR;
import static com.scoutfeed.tracker.repository.ChannelPermissionErrorRepository.ERROR_TYPE_PROACTIVE_CHECK;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.RateLimiter;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.scoutfeed.tracker.config.TrackerDeliveryProperties;
import com.scoutfeed.tracker.config.TrackerRuntimeConfig;
import com.scoutfeed.tracker.model.ChannelTarget;
import com.scoutfeed.tracker.model.DeliveryOutcome;
import com.scoutfeed.tracker.model.DeliveryResult;
import com.scoutfeed.tracker.model.MatchNotification;
import com.scoutfeed.tracker.model.OwnerNotice;
import com.scoutfeed.tracker.model.OwnerNoticeReason;
import com.scoutfeed.tracker.model.PermissionCheck;
import com.scoutfeed.tracker.model.SendResult;
import com.scoutfeed.tracker.repository.ChannelPermissionErrorRepository;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class DeliveryGuard {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryGuard.class);

  private final ChannelPermissionChecker permissionChecker;
  private final ChannelSender channelSender;
  private final OwnerNotifier ownerNotifier;
  private final ChannelPermissionErrorRepository permissionErrorRepository;
  private final TrackerMetrics metrics;
  private final TimeLimiter timeLimiter;
  private final ExecutorService ownerNoticeExecutor;
  private final TrackerDeliveryProperties properties;
  private final Clock clock;
  private final RateLimiter ownerNoticeRateLimiter;
  private final KeyedLocks<ChannelKey> channelLocks = new KeyedLocks<>();
  private final ConcurrentMap<ChannelKey, DeliveryOutcome> outcomes = new ConcurrentHashMap<>();
  // present while the current denial streak has a notice in flight or delivered
  private final ConcurrentMap<ChannelKey, NoticeAttempt> ownerNotices = new ConcurrentHashMap<>();

  @Autowired
  public DeliveryGuard(
      ChannelPermissionChecker permissionChecker,
      ChannelSender channelSender,
      OwnerNotifier ownerNotifier,
      ChannelPermissionErrorRepository permissionErrorRepository,
      TrackerMetrics metrics,
      TimeLimiter timeLimiter,
      @Qualifier(TrackerRuntimeConfig.OWNER_NOTICE_EXECUTOR) ExecutorService ownerNoticeExecutor,
      TrackerDeliveryProperties properties,
      Clock clock) {
    this(
        permissionChecker,
        channelSender,
        ownerNotifier,
        permissionErrorRepository,
        metrics,
        timeLimiter,
        ownerNoticeExecutor,
        properties,
        clock,
        RateLimiter.create(properties.ownerNoticesPerSecond()));
  }

  @VisibleForTesting
  DeliveryGuard(
      ChannelPermissionChecker permissionChecker,
      ChannelSender channelSender,
      OwnerNotifier ownerNotifier,
      ChannelPermissionErrorRepository permissionErrorRepository,
      TrackerMetrics metrics,
      TimeLimiter timeLimiter,
      ExecutorService ownerNoticeExecutor,
      TrackerDeliveryProperties properties,
      Clock clock,
      RateLimiter ownerNoticeRateLimiter) {
    this.permissionChecker = permissionChecker;
    this.channelSender = channelSender;
    this.ownerNotifier = ownerNotifier;
    this.permissionErrorRepository = permissionErrorRepository;
    this.metrics = metrics;
    this.timeLimiter = timeLimiter;
    this.ownerNoticeExecutor = ownerNoticeExecutor;
    this.properties = properties;
    this.clock = clock;
    this.ownerNoticeRateLimiter = ownerNoticeRateLimiter;
  }

  /** Never throws; every failure is folded into the returned result. */
  public DeliveryResult deliver(ChannelTarget target, MatchNotification notification) {
    final ChannelKey key = new ChannelKey(target.serverScope(), target.channelId());
    final Lock lock = channelLocks.get(key);
    lock.lock();
    try {
      final DeliveryResult result = deliverLocked(key, notification);
      metrics.recordDelivery(result);
      return result;
    } finally {
      lock.unlock();
    }
  }

  private DeliveryResult deliverLocked(ChannelKey key, MatchNotification notification) {
    final PermissionCheck check = precheck(key);
    if (!check.allowed()) {
      onPermissionDenied(key, ERROR_TYPE_PROACTIVE_CHECK, check.reason(), notification);
      return DeliveryResult.PERMISSION_DENIED;
    }
    final SendResult result = send(key, notification);
    switch (result.status()) {
      case SENT:
        onSent(key);
        return DeliveryResult.SENT;
      case PERMISSION_DENIED:
        onPermissionDenied(key, ERROR_TYPE_API_ERROR, result.detail(), notification);
        return DeliveryResult.PERMISSION_DENIED;
      default:
        // not found, rate limited, network: dropped for this cycle, never escalated
        logger.warn(
            "match notification dropped server_scope={} channel_id={} match_id={} status={} detail={}",
            key.serverScope(),
            key.channelId(),
            notification.matchId(),
            result.status(),
            result.detail());
        return DeliveryResult.DROPPED;
    }
  }

  private PermissionCheck precheck(ChannelKey key) {
    try {
      final PermissionCheck check = permissionChecker.check(key.channelId());
      return check == null ? PermissionCheck.denied("permission check returned nothing") : check;
    } catch (RuntimeException ex) {
      logger.warn(
          "permission check failed, treating as denied server_scope={} channel_id={}",
          key.serverScope(),
          key.channelId(),
          ex);
      return PermissionCheck.denied("permission check failed: " + ex.getMessage());
    }
  }

  private SendResult send(ChannelKey key, MatchNotification notification) {
    try {
      final SendResult result =
          timeLimiter.callWithTimeout(
              () -> channelSender.send(key.channelId(), notification), properties.sendTimeout());
      return result == null ? SendResult.transientFailure("sender returned no result") : result;
    } catch (TimeoutException ex) {
      return SendResult.transientFailure("send timed out after " + properties.sendTimeout());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return SendResult.transientFailure("send interrupted");
    } catch (ExecutionException | UncheckedExecutionException ex) {
      logger.warn(
          "channel send threw server_scope={} channel_id={} match_id={}",
          key.serverScope(),
          key.channelId(),
          notification.matchId(),
          ex.getCause());
      return SendResult.transientFailure("send failed: " + describe(ex.getCause()));
    }
  }

  private void onSent(ChannelKey key) {
    final DeliveryOutcome previous = outcomes.put(key, DeliveryOutcome.OK);
    ownerNotices.remove(key);
    if (previous == DeliveryOutcome.OK) {
      return;
    }
    // first success since start or since a denial: clear the persisted streak
    audit(
        key,
        () -> permissionErrorRepository.recordSuccessfulSend(
            key.serverScope(), key.channelId(), clock.instant()));
    if (previous == DeliveryOutcome.PERMISSION_DENIED) {
      logger.info(
          "channel recovered from permission error server_scope={} channel_id={}",
          key.serverScope(),
          key.channelId());
    }
  }

  private void onPermissionDenied(
      ChannelKey key, String errorType, String reason, MatchNotification notification) {
    seedFromAudit(key);
    outcomes.put(key, DeliveryOutcome.PERMISSION_DENIED);
    final String truncatedReason = truncate(reason);
    logger.warn(
        "match notification denied server_scope={} channel_id={} match_id={} type={} reason={}",
        key.serverScope(),
        key.channelId(),
        notification.matchId(),
        errorType,
        truncatedReason);
    audit(
        key,
        () -> permissionErrorRepository.recordPermissionError(
            key.serverScope(), key.channelId(), errorType, truncatedReason, clock.instant()));
    final NoticeAttempt attempt = new NoticeAttempt();
    if (ownerNotices.putIfAbsent(key, attempt) != null) {
      metrics.recordOwnerNotice("suppressed");
      return;
    }
    publishOwnerNotice(
        key,
        attempt,
        new OwnerNotice(
            key.channelId(), OwnerNoticeReason.PERMISSION_DENIED, truncatedReason, clock.instant()));
  }

  private void seedFromAudit(ChannelKey key) {
    if (outcomes.containsKey(key)) {
      return;
    }
    // a streak persisted before a restart was already reported to the owner
    try {
      final DeliveryOutcome persisted =
          permissionErrorRepository
              .findLastOutcome(key.serverScope(), key.channelId())
              .orElse(DeliveryOutcome.OK);
      if (persisted == DeliveryOutcome.PERMISSION_DENIED) {
        ownerNotices.putIfAbsent(key, NoticeAttempt.PUBLISHED);
      }
    } catch (DataAccessException ex) {
      logger.warn(
          "permission audit unavailable, assuming OK server_scope={} channel_id={}",
          key.serverScope(),
          key.channelId(),
          ex);
    }
  }

  // a notice that is not published leaves the streak eligible for the next denial
  private void publishOwnerNotice(ChannelKey key, NoticeAttempt attempt, OwnerNotice notice) {
    final String serverScope = key.serverScope();
    if (!ownerNoticeRateLimiter.tryAcquire()) {
      ownerNotices.remove(key, attempt);
      metrics.recordOwnerNotice("rate_limited");
      logger.warn(
          "owner notice deferred by rate limit server_scope={} channel_id={}",
          serverScope,
          notice.channelId());
      return;
    }
    try {
      final Map<String, String> mdcContext = MDC.getCopyOfContextMap();
      CompletableFuture.runAsync(
              () -> {
                // carry cycle_id and match_id over to the notice thread
                if (mdcContext != null) {
                  MDC.setContextMap(mdcContext);
                }
                try {
                  ownerNotifier.notify(serverScope, notice);
                } finally {
                  MDC.clear();
                }
              },
              ownerNoticeExecutor)
          .whenComplete(
              (ignored, ex) -> {
                if (ex == null) {
                  attempt.published = true;
                  metrics.recordOwnerNotice("published");
                  return;
                }
                ownerNotices.remove(key, attempt);
                metrics.recordOwnerNotice("failed");
                logger.warn(
                    "owner notice failed server_scope={} channel_id={}",
                    serverScope,
                    notice.channelId(),
                    ex);
              });
    } catch (RejectedExecutionException ex) {
      ownerNotices.remove(key, attempt);
      metrics.recordOwnerNotice("rejected");
      logger.warn(
          "owner notice rejected server_scope={} channel_id={}",
          serverScope,
          notice.channelId(),
          ex);
    }
  }

  private void audit(ChannelKey key, Runnable write) {
    try {
      write.run();
    } catch (DataAccessException ex) {
      logger.warn(
          "permission audit write failed server_scope={} channel_id={}",
          key.serverScope(),
          key.channelId(),
          ex);
    }
  }

  private String truncate(String reason) {
    if (reason == null) {
      return "unknown";
    }
    final int maxLength = properties.errorReasonMaxLength();
    return reason.length() <= maxLength ? reason : reason.substring(0, maxLength);
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown";
    }
    return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
  }

  @VisibleForTesting
  DeliveryOutcome outcomeOf(String serverScope, String channelId) {
    return outcomes.get(new ChannelKey(serverScope, channelId));
  }

  @VisibleForTesting
  boolean ownerNotified(String serverScope, String channelId) {
    final NoticeAttempt attempt = ownerNotices.get(new ChannelKey(serverScope, channelId));
    return attempt != null && attempt.published;
  }

  private record ChannelKey(String serverScope, String channelId) {}

  // identity matters: a late failure must only clear its own attempt
  private static final class NoticeAttempt {
    static final NoticeAttempt PUBLISHED = new NoticeAttempt(true);

    volatile boolean published;

    NoticeAttempt() {
      this(false);
    }

    private NoticeAttempt(boolean published) {
      this.published = published;
    }
  }
}
