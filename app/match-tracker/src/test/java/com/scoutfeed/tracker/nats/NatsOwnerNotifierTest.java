package com.scoutfeed.tracker.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutfeed.tracker.config.OwnerNoticeNatsProperties;
import com.scoutfeed.tracker.model.OwnerNotice;
import com.scoutfeed.tracker.model.OwnerNoticeReason;
import io.nats.client.JetStream;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.slf4j.MDC;

class NatsOwnerNotifierTest {

  private static final OwnerNoticeNatsProperties PROPERTIES =
      new OwnerNoticeNatsProperties(
          "tracker.owner-notices", "TRACKER_OWNER_NOTICES", Duration.ofMinutes(2));
  private static final OwnerNotice NOTICE =
      new OwnerNotice(
          "123",
          OwnerNoticeReason.PERMISSION_DENIED,
          "missing SEND_MESSAGES",
          Instant.parse("2026-03-01T12:00:00Z"));

  private final ObjectMapper objectMapper = new ObjectMapper();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void publishesNoticeWithMessageIdHeader() throws Exception {
    final JetStream jetStream = Mockito.mock(JetStream.class);
    final NatsOwnerNotifier notifier = new NatsOwnerNotifier(jetStream, objectMapper, PROPERTIES);
    MDC.put("cycle_id", "cycle-abc");

    notifier.notify("server-a", NOTICE);

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream).publish(eq("tracker.owner-notices"), headers.capture(), body.capture());
    final OwnerNoticePayload payload = objectMapper.readValue(body.getValue(), OwnerNoticePayload.class);
    assertThat(headers.getValue().getFirst(NatsOwnerNotifier.MSG_ID_HEADER))
        .isEqualTo(payload.noticeId());
    assertThat(payload.serverScope()).isEqualTo("server-a");
    assertThat(payload.channelId()).isEqualTo("123");
    assertThat(payload.reason()).isEqualTo("PERMISSION_DENIED");
    assertThat(payload.occurredAt()).isEqualTo("2026-03-01T12:00:00Z");
    assertThat(payload.cycleId()).isEqualTo("cycle-abc");
  }

  @Test
  void throwsWhenServerScopeMissing() {
    final JetStream jetStream = Mockito.mock(JetStream.class);
    final NatsOwnerNotifier notifier = new NatsOwnerNotifier(jetStream, objectMapper, PROPERTIES);

    assertThatThrownBy(() -> notifier.notify(" ", NOTICE))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(jetStream);
  }

  @Test
  void wrapsIOException() throws Exception {
    final JetStream jetStream = Mockito.mock(JetStream.class);
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("boom"));
    final NatsOwnerNotifier notifier = new NatsOwnerNotifier(jetStream, objectMapper, PROPERTIES);

    assertThatThrownBy(() -> notifier.notify("server-a", NOTICE))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failed to publish");
  }
}
