/*
 * Where: Match tracker service layer
 * What: fetcher used until a real match API client is wired in
 * Why: the service must start and run cycles without upstream credentials
 */
package com.scoutfeed.tracker.service;

import com.scoutfeed.tracker.model.LatestMatch;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "tracker.upstream.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class DisabledUpstreamMatchFetcher implements UpstreamMatchFetcher {

  private static final Logger logger = LoggerFactory.getLogger(DisabledUpstreamMatchFetcher.class);

  @Override
  public Optional<LatestMatch> latestMatch(String externalAccountId, String region) {
    logger.debug(
        "upstream disabled, reporting no match externalAccountId={} region={}",
        externalAccountId,
        region);
    return Optional.empty();
  }
}
