/*
 * Where: Match tracker service layer
 * What: creates players, registers their accounts and exposes per-account polling state
 * Why: a new account starts with empty polling state, seeded with its last match time so the
 *      interval policy does not treat an active player as never seen
 */
package com.scoutfeed.tracker.service;

import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.scoutfeed.tracker.api.AccountNotFoundException;
import com.scoutfeed.tracker.api.DuplicateRegistrationException;
import com.scoutfeed.tracker.api.PlayerNotFoundException;
import com.scoutfeed.tracker.api.request.CreatePlayerRequest;
import com.scoutfeed.tracker.api.request.RegisterAccountRequest;
import com.scoutfeed.tracker.config.TrackerPollingProperties;
import com.scoutfeed.tracker.model.LatestMatch;
import com.scoutfeed.tracker.model.Player;
import com.scoutfeed.tracker.model.PollingState;
import com.scoutfeed.tracker.model.TrackedAccount;
import com.scoutfeed.tracker.repository.PlayerRepository;
import com.scoutfeed.tracker.repository.TrackedAccountRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class AccountRegistrationService {

  private static final Logger logger = LoggerFactory.getLogger(AccountRegistrationService.class);

  private final PlayerRepository playerRepository;
  private final TrackedAccountRepository accountRepository;
  private final MatchStateTracker stateTracker;
  private final UpstreamMatchFetcher matchFetcher;
  private final TimeLimiter timeLimiter;
  private final TrackerPollingProperties pollingProperties;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  public Player createPlayer(CreatePlayerRequest request) {
    try {
      return playerRepository.insert(request.serverScope(), request.alias(), clock.instant());
    } catch (DuplicateKeyException ex) {
      throw new DuplicateRegistrationException(
          "player alias already exists in server: " + request.alias());
    }
  }

  public TrackedAccount registerAccount(long playerId, RegisterAccountRequest request) {
    final Player player =
        playerRepository.findById(playerId).orElseThrow(() -> new PlayerNotFoundException(playerId));
    final Instant now = clock.instant();
    // account row and its empty polling state are created together or not at all
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final TrackedAccount account;
    try {
      account =
          transactionTemplate.execute(
              status -> {
                final long accountId =
                    accountRepository.insert(
                        player.serverScope(),
                        playerId,
                        request.externalAccountId(),
                        request.region(),
                        request.alias(),
                        now);
                stateTracker.initialize(accountId);
                return new TrackedAccount(
                    accountId,
                    player.serverScope(),
                    playerId,
                    request.externalAccountId(),
                    request.region(),
                    request.alias());
              });
    } catch (DuplicateKeyException ex) {
      throw new DuplicateRegistrationException(
          "account already tracked in server: " + request.externalAccountId());
    }
    backfill(account, request.lastMatchTime());
    logger.info(
        "account registered account_id={} player_id={} server_scope={} region={}",
        account.accountId(),
        playerId,
        account.serverScope(),
        account.region());
    return account;
  }

  public PollingState pollingState(long accountId) {
    requireAccount(accountId);
    return stateTracker.currentState(accountId);
  }

  public PollingState resume(long accountId) {
    requireAccount(accountId);
    if (stateTracker.resume(accountId)) {
      logger.info("account resumed account_id={}", accountId);
    }
    return stateTracker.currentState(accountId);
  }

  private void requireAccount(long accountId) {
    if (accountRepository.findById(accountId).isEmpty()) {
      throw new AccountNotFoundException(accountId);
    }
  }

  // best effort: without a seed the account is simply polled at the never-seen interval
  private void backfill(TrackedAccount account, Instant requestedMatchTime) {
    try {
      final Instant seed =
          requestedMatchTime != null
              ? requestedMatchTime
              : latestUpstreamMatch(account).map(LatestMatch::matchTime).orElse(null);
      if (seed != null) {
        stateTracker.backfill(account.accountId(), seed);
      }
    } catch (UpstreamFetchException | StoreUnavailableException ex) {
      logger.warn(
          "backfill skipped account_id={} reason={}", account.accountId(), ex.getMessage());
    }
  }

  private Optional<LatestMatch> latestUpstreamMatch(TrackedAccount account) {
    try {
      final Optional<LatestMatch> latest =
          timeLimiter.callWithTimeout(
              () -> matchFetcher.latestMatch(account.externalAccountId(), account.region()),
              pollingProperties.fetchTimeout());
      return latest == null ? Optional.empty() : latest;
    } catch (TimeoutException ex) {
      throw new FetchTransientException("backfill fetch timed out", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new FetchTransientException("backfill fetch interrupted", ex);
    } catch (ExecutionException | UncheckedExecutionException ex) {
      if (ex.getCause() instanceof UpstreamFetchException fetchException) {
        throw fetchException;
      }
      throw new FetchTransientException("backfill fetch failed: " + ex.getCause(), ex.getCause());
    }
  }
}
