/*
 * Where: Match tracker service layer
 * What: owner notifier used when NATS is switched off
 * Why: keeps the permission escalation path observable in local runs and tests
 */
package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.OwnerNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingOwnerNotifier implements OwnerNotifier {

  private static final Logger logger = LoggerFactory.getLogger(LoggingOwnerNotifier.class);

  @Override
  public void notify(String serverScope, OwnerNotice notice) {
    logger.warn(
        "owner notice server_scope={} channel_id={} reason={} detail={}",
        serverScope,
        notice.channelId(),
        notice.reason(),
        notice.detail());
  }
}
