package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.MatchNotification;
import com.scoutfeed.tracker.model.SendResult;

/**
 * Formats and posts a match notification into one Discord channel. Implementations classify
 * failures into the {@link SendResult} statuses instead of throwing.
 */
public interface ChannelSender {

  SendResult send(String channelId, MatchNotification notification);
}
