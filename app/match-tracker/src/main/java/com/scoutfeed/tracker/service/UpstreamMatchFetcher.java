package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.LatestMatch;
import java.util.Optional;

public interface UpstreamMatchFetcher {

  /**
   * Latest match of the account, empty when it has none.
   *
   * @throws FetchTransientException when the call may succeed on a later tick
   * @throws FetchPermanentException when the account cannot be resolved upstream
   */
  Optional<LatestMatch> latestMatch(String externalAccountId, String region);
}
