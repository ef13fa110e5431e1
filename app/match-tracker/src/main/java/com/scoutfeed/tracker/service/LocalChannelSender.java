/*
 * Where: Match tracker service layer
 * What: sender that only logs what would have been posted
 * Why: lets the poll cycle run end to end without a Discord bot token
 */
package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.MatchNotification;
import com.scoutfeed.tracker.model.SendResult;
import com.scoutfeed.tracker.model.TrackedAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "tracker.discord.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LocalChannelSender implements ChannelSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalChannelSender.class);

  @Override
  public SendResult send(String channelId, MatchNotification notification) {
    logger.info(
        "match notification simulated send channel_id={} match_id={} accounts={}",
        channelId,
        notification.matchId(),
        notification.accounts().stream().map(TrackedAccount::alias).toList());
    return SendResult.sent();
  }
}
