package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.OwnerNotice;

/** Hands a notice for the owner of a Discord server to whatever can reach them. */
public interface OwnerNotifier {

  void notify(String serverScope, OwnerNotice notice);
}
