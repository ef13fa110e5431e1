/*
 * Where: Match tracker delivery guard unit test
 * What: permission pre-check, send classification, owner notice suppression and throttling
 * Why: a broken channel must ping its owner once per streak and never block other channels
 */
package com.scoutfeed.tracker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.FakeTimeLimiter;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.RateLimiter;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.TimeLimiter;
import com.scoutfeed.tracker.config.TrackerDeliveryProperties;
import com.scoutfeed.tracker.model.ChannelTarget;
import com.scoutfeed.tracker.model.DeliveryOutcome;
import com.scoutfeed.tracker.model.DeliveryResult;
import com.scoutfeed.tracker.model.MatchNotification;
import com.scoutfeed.tracker.model.OwnerNotice;
import com.scoutfeed.tracker.model.OwnerNoticeReason;
import com.scoutfeed.tracker.model.PermissionCheck;
import com.scoutfeed.tracker.model.SendResult;
import com.scoutfeed.tracker.model.TrackedAccount;
import com.scoutfeed.tracker.repository.ChannelPermissionErrorRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class DeliveryGuardTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final ChannelTarget CHANNEL = new ChannelTarget("123", "server-a");
  private static final ChannelTarget OTHER_CHANNEL = new ChannelTarget("456", "server-a");
  private static final TrackerDeliveryProperties PROPERTIES =
      new TrackerDeliveryProperties(Duration.ofSeconds(5), 100.0d, 200);
  private static final MatchNotification NOTIFICATION =
      new MatchNotification(
          "match-1",
          FIXED_NOW,
          List.of(new TrackedAccount(1L, "server-a", 10L, "ext-1", "euw", "Alias")));

  @Mock private ChannelPermissionChecker permissionChecker;
  @Mock private ChannelSender channelSender;
  @Mock private OwnerNotifier ownerNotifier;
  @Mock private ChannelPermissionErrorRepository permissionErrorRepository;

  private SimpleMeterRegistry registry;
  private DeliveryGuard guard;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    guard = newGuard(PROPERTIES, new FakeTimeLimiter());
  }

  private DeliveryGuard newGuard(TrackerDeliveryProperties properties, TimeLimiter timeLimiter) {
    // owner notices run inline so assertions need no waiting
    return new DeliveryGuard(
        permissionChecker,
        channelSender,
        ownerNotifier,
        permissionErrorRepository,
        new TrackerMetrics(registry),
        timeLimiter,
        MoreExecutors.newDirectExecutorService(),
        properties,
        Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void sentWhenPermittedAndPosted() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.granted());
    when(channelSender.send("123", NOTIFICATION)).thenReturn(SendResult.sent());

    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.SENT);

    assertThat(guard.outcomeOf("server-a", "123")).isEqualTo(DeliveryOutcome.OK);
    verify(permissionErrorRepository).recordSuccessfulSend("server-a", "123", FIXED_NOW);
    assertThat(deliveries("sent")).isEqualTo(1.0d);
    verifyNoInteractions(ownerNotifier);
  }

  @Test
  void repeatedSuccessTouchesTheAuditTableOnce() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.granted());
    when(channelSender.send("123", NOTIFICATION)).thenReturn(SendResult.sent());

    guard.deliver(CHANNEL, NOTIFICATION);
    guard.deliver(CHANNEL, NOTIFICATION);

    verify(permissionErrorRepository, times(1)).recordSuccessfulSend(any(), any(), any());
  }

  @Test
  void deniedPrecheckSkipsTheSendAndNotifiesTheOwner() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.denied("missing SEND_MESSAGES"));

    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.PERMISSION_DENIED);

    verifyNoInteractions(channelSender);
    verify(permissionErrorRepository)
        .recordPermissionError(
            "server-a",
            "123",
            ChannelPermissionErrorRepository.ERROR_TYPE_PROACTIVE_CHECK,
            "missing SEND_MESSAGES",
            FIXED_NOW);
    final ArgumentCaptor<OwnerNotice> notice = ArgumentCaptor.forClass(OwnerNotice.class);
    verify(ownerNotifier).notify(eq("server-a"), notice.capture());
    assertThat(notice.getValue().channelId()).isEqualTo("123");
    assertThat(notice.getValue().reason()).isEqualTo(OwnerNoticeReason.PERMISSION_DENIED);
    assertThat(ownerNotices("published")).isEqualTo(1.0d);
  }

  @Test
  void consecutiveDenialsNotifyTheOwnerOnce() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.denied("missing VIEW_CHANNEL"));

    guard.deliver(CHANNEL, NOTIFICATION);
    guard.deliver(CHANNEL, NOTIFICATION);
    guard.deliver(CHANNEL, NOTIFICATION);

    verify(ownerNotifier, times(1)).notify(anyString(), any());
    verify(permissionErrorRepository, times(3))
        .recordPermissionError(any(), any(), any(), any(), any());
    assertThat(ownerNotices("suppressed")).isEqualTo(2.0d);
  }

  @Test
  void denialAfterRecoveryNotifiesAgain() {
    when(permissionChecker.check("123"))
        .thenReturn(
            PermissionCheck.denied("missing SEND_MESSAGES"),
            PermissionCheck.granted(),
            PermissionCheck.denied("missing SEND_MESSAGES"));
    when(channelSender.send("123", NOTIFICATION)).thenReturn(SendResult.sent());

    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.PERMISSION_DENIED);
    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.SENT);
    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.PERMISSION_DENIED);

    verify(ownerNotifier, times(2)).notify(eq("server-a"), any());
    verify(permissionErrorRepository).recordSuccessfulSend("server-a", "123", FIXED_NOW);
  }

  @Test
  void apiPermissionErrorIsRecordedTruncatedAsApiError() {
    final DeliveryGuard shortReasonGuard =
        newGuard(new TrackerDeliveryProperties(Duration.ofSeconds(5), 100.0d, 20), new FakeTimeLimiter());
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.granted());
    when(channelSender.send("123", NOTIFICATION))
        .thenReturn(SendResult.permissionDenied("50013 Missing Permissions"));

    assertThat(shortReasonGuard.deliver(CHANNEL, NOTIFICATION))
        .isEqualTo(DeliveryResult.PERMISSION_DENIED);

    verify(permissionErrorRepository)
        .recordPermissionError(
            "server-a",
            "123",
            ChannelPermissionErrorRepository.ERROR_TYPE_API_ERROR,
            "50013 Missing Permis",
            FIXED_NOW);
    verify(ownerNotifier).notify(eq("server-a"), any());
  }

  @Test
  void failingPrecheckCountsAsDenied() {
    when(permissionChecker.check("123")).thenThrow(new IllegalStateException("cache cold"));

    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.PERMISSION_DENIED);

    verifyNoInteractions(channelSender);
  }

  @Test
  void missingPrecheckResultCountsAsDenied() {
    when(permissionChecker.check("123")).thenReturn(null);

    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.PERMISSION_DENIED);

    verifyNoInteractions(channelSender);
  }

  @Test
  void throwingSenderIsDroppedWithoutOwnerNotice() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.granted());
    when(channelSender.send("123", NOTIFICATION)).thenThrow(new IllegalStateException("socket reset"));

    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.DROPPED);

    verifyNoInteractions(ownerNotifier);
    assertThat(deliveries("dropped")).isEqualTo(1.0d);
  }

  @Test
  void deletedChannelIsDroppedWithoutOwnerNotice() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.granted());
    when(channelSender.send("123", NOTIFICATION)).thenReturn(SendResult.notFound("10003"));

    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.DROPPED);

    verifyNoInteractions(ownerNotifier);
    verify(permissionErrorRepository, never())
        .recordPermissionError(any(), any(), any(), any(), any());
  }

  @Test
  void slowSendIsDroppedAtTheTimeout() throws Exception {
    final ExecutorService sendPool = Executors.newCachedThreadPool();
    final CountDownLatch release = new CountDownLatch(1);
    try {
      final DeliveryGuard timedGuard =
          newGuard(
              new TrackerDeliveryProperties(Duration.ofMillis(100), 100.0d, 200),
              SimpleTimeLimiter.create(sendPool));
      when(permissionChecker.check("123")).thenReturn(PermissionCheck.granted());
      when(channelSender.send("123", NOTIFICATION))
          .thenAnswer(
              invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return SendResult.sent();
              });

      assertThat(timedGuard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.DROPPED);
    } finally {
      release.countDown();
      sendPool.shutdownNow();
    }
  }

  @Test
  void persistedDenialSuppressesTheFirstNoticeAfterRestart() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.denied("missing SEND_MESSAGES"));
    when(permissionErrorRepository.findLastOutcome("server-a", "123"))
        .thenReturn(Optional.of(DeliveryOutcome.PERMISSION_DENIED));

    guard.deliver(CHANNEL, NOTIFICATION);

    verifyNoInteractions(ownerNotifier);
    assertThat(ownerNotices("suppressed")).isEqualTo(1.0d);
  }

  @Test
  void unreadableAuditTableStillNotifies() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.denied("missing SEND_MESSAGES"));
    when(permissionErrorRepository.findLastOutcome("server-a", "123"))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.PERMISSION_DENIED);

    verify(ownerNotifier).notify(eq("server-a"), any());
  }

  @Test
  void ownerNoticesBeyondTheRateAreDeferred() {
    final DeliveryGuard throttledGuard =
        newGuard(new TrackerDeliveryProperties(Duration.ofSeconds(5), 0.001d, 200), new FakeTimeLimiter());
    when(permissionChecker.check(anyString())).thenReturn(PermissionCheck.denied("missing SEND_MESSAGES"));

    throttledGuard.deliver(CHANNEL, NOTIFICATION);
    throttledGuard.deliver(OTHER_CHANNEL, NOTIFICATION);

    verify(ownerNotifier, times(1)).notify(anyString(), any());
    assertThat(ownerNotices("rate_limited")).isEqualTo(1.0d);
  }

  @Test
  void failingOwnerNotifierDoesNotFailTheDelivery() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.denied("missing SEND_MESSAGES"));
    doThrow(new IllegalStateException("nats down")).when(ownerNotifier).notify(anyString(), any());

    assertThat(guard.deliver(CHANNEL, NOTIFICATION)).isEqualTo(DeliveryResult.PERMISSION_DENIED);

    assertThat(ownerNotices("failed")).isEqualTo(1.0d);
  }

  @Test
  void rateLimitedFirstNoticeIsSentOnTheNextDenial() {
    final RateLimiter rateLimiter = mock(RateLimiter.class);
    when(rateLimiter.tryAcquire()).thenReturn(true, false, true);
    final DeliveryGuard throttledGuard =
        new DeliveryGuard(
            permissionChecker,
            channelSender,
            ownerNotifier,
            permissionErrorRepository,
            new TrackerMetrics(registry),
            new FakeTimeLimiter(),
            MoreExecutors.newDirectExecutorService(),
            PROPERTIES,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
            rateLimiter);
    when(permissionChecker.check(anyString())).thenReturn(PermissionCheck.denied("missing SEND_MESSAGES"));

    throttledGuard.deliver(CHANNEL, NOTIFICATION);
    throttledGuard.deliver(OTHER_CHANNEL, NOTIFICATION);
    assertThat(throttledGuard.ownerNotified("server-a", "456")).isFalse();
    throttledGuard.deliver(OTHER_CHANNEL, NOTIFICATION);
    throttledGuard.deliver(OTHER_CHANNEL, NOTIFICATION);

    final ArgumentCaptor<OwnerNotice> notices = ArgumentCaptor.forClass(OwnerNotice.class);
    verify(ownerNotifier, times(2)).notify(eq("server-a"), notices.capture());
    assertThat(notices.getAllValues()).extracting(OwnerNotice::channelId).containsExactly("123", "456");
    assertThat(throttledGuard.ownerNotified("server-a", "456")).isTrue();
    assertThat(ownerNotices("rate_limited")).isEqualTo(1.0d);
    assertThat(ownerNotices("suppressed")).isEqualTo(1.0d);
  }

  @Test
  void failedOwnerNoticeIsRetriedOnTheNextDenial() {
    when(permissionChecker.check("123")).thenReturn(PermissionCheck.denied("missing SEND_MESSAGES"));
    doThrow(new IllegalStateException("nats down"))
        .doNothing()
        .when(ownerNotifier)
        .notify(anyString(), any());

    guard.deliver(CHANNEL, NOTIFICATION);
    guard.deliver(CHANNEL, NOTIFICATION);
    guard.deliver(CHANNEL, NOTIFICATION);

    verify(ownerNotifier, times(2)).notify(eq("server-a"), any());
    assertThat(ownerNotices("failed")).isEqualTo(1.0d);
    assertThat(ownerNotices("published")).isEqualTo(1.0d);
    assertThat(ownerNotices("suppressed")).isEqualTo(1.0d);
  }

  @Test
  void channelsOnDifferentKeysDoNotWaitForEachOther() throws Exception {
    final CountDownLatch bothSending = new CountDownLatch(2);
    when(permissionChecker.check(anyString())).thenReturn(PermissionCheck.granted());
    when(channelSender.send(anyString(), eq(NOTIFICATION)))
        .thenAnswer(
            invocation -> {
              bothSending.countDown();
              return bothSending.await(2, TimeUnit.SECONDS)
                  ? SendResult.sent()
                  : SendResult.transientFailure("other channel never started");
            });
    final ExecutorService callers = Executors.newFixedThreadPool(2);
    try {
      final Future<DeliveryResult> first = callers.submit(() -> guard.deliver(CHANNEL, NOTIFICATION));
      final Future<DeliveryResult> second = callers.submit(() -> guard.deliver(OTHER_CHANNEL, NOTIFICATION));

      assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(DeliveryResult.SENT);
      assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(DeliveryResult.SENT);
    } finally {
      callers.shutdownNow();
    }
  }

  private double deliveries(String result) {
    return registry.get("tracker.delivery.total").tag("result", result).counter().count();
  }

  private double ownerNotices(String result) {
    return registry.get("tracker.owner.notice.total").tag("result", result).counter().count();
  }
}
