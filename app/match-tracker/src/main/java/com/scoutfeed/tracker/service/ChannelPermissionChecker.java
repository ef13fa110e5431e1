package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.PermissionCheck;

/** Local capability check against cached channel and member data; never calls the network. */
public interface ChannelPermissionChecker {

  PermissionCheck check(String channelId);
}
