package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.PermissionCheck;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "tracker.discord.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class AllowAllChannelPermissionChecker implements ChannelPermissionChecker {

  @Override
  public PermissionCheck check(String channelId) {
    return PermissionCheck.granted();
  }
}
