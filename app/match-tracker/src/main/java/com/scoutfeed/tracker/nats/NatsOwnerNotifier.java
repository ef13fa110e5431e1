/*
 * Where: Match tracker NATS integration
 * What: publishes owner notices to JetStream for the Discord gateway to deliver as DMs
 * Why: the tracker holds no Discord session; the gateway owns owner lookup and messaging
 */
package com.scoutfeed.tracker.nats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutfeed.common.CorrelationIds;
import com.scoutfeed.tracker.config.OwnerNoticeNatsProperties;
import com.scoutfeed.tracker.model.OwnerNotice;
import com.scoutfeed.tracker.service.OwnerNotifier;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JetStream and ObjectMapper are shared Spring-managed components")
public class NatsOwnerNotifier implements OwnerNotifier {

  private static final Logger logger = LoggerFactory.getLogger(NatsOwnerNotifier.class);
  static final String MSG_ID_HEADER = "Nats-Msg-Id";

  private final JetStream jetStream;
  private final ObjectMapper objectMapper;
  private final OwnerNoticeNatsProperties properties;

  public NatsOwnerNotifier(
      JetStream jetStream, ObjectMapper objectMapper, OwnerNoticeNatsProperties properties) {
    this.jetStream = jetStream;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public void notify(String serverScope, OwnerNotice notice) {
    if (serverScope == null || serverScope.isBlank()) {
      throw new IllegalArgumentException("serverScope is required");
    }
    final String noticeId = CorrelationIds.newNoticeId();
    final OwnerNoticePayload payload =
        new OwnerNoticePayload(
            noticeId,
            serverScope,
            notice.channelId(),
            notice.reason().name(),
            notice.detail(),
            notice.occurredAt() == null ? null : notice.occurredAt().toString(),
            MDC.get("cycle_id"));
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to encode owner notice", ex);
    }
    final Headers headers = new Headers();
    headers.add(MSG_ID_HEADER, noticeId);
    try {
      final PublishAck ack = jetStream.publish(properties.subject(), headers, body);
      logger.info(
          "owner notice published server_scope={} reason={} noticeId={} seq={}",
          serverScope,
          notice.reason(),
          noticeId,
          ack == null ? null : ack.getSeqno());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish owner notice", ex);
    }
  }
}
