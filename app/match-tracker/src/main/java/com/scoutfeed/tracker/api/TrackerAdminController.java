/*
 * Where: Match tracker admin API
 * What: roster and subscription management plus an on-demand poll cycle
 * Why: the Discord command layer and operators populate the roster through these endpoints
 */
package com.scoutfeed.tracker.api;

import com.scoutfeed.tracker.api.request.CreatePlayerRequest;
import com.scoutfeed.tracker.api.request.RegisterAccountRequest;
import com.scoutfeed.tracker.api.request.SubscriptionRequest;
import com.scoutfeed.tracker.api.response.PollCycleResponse;
import com.scoutfeed.tracker.api.response.PollingStateResponse;
import com.scoutfeed.tracker.model.ChannelTarget;
import com.scoutfeed.tracker.model.Player;
import com.scoutfeed.tracker.model.PollingState;
import com.scoutfeed.tracker.model.TrackedAccount;
import com.scoutfeed.tracker.service.AccountRegistrationService;
import com.scoutfeed.tracker.service.PollCycleDriver;
import com.scoutfeed.tracker.service.PollingIntervalPolicy;
import com.scoutfeed.tracker.service.SubscriptionService;
import jakarta.validation.Valid;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class TrackerAdminController {

  private final AccountRegistrationService registrationService;
  private final SubscriptionService subscriptionService;
  private final PollCycleDriver pollCycleDriver;
  private final PollingIntervalPolicy pollingIntervalPolicy;
  private final Clock clock;

  @PostMapping("/players")
  public ResponseEntity<Player> createPlayer(@Valid @RequestBody CreatePlayerRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(registrationService.createPlayer(request));
  }

  @PostMapping("/players/{playerId}/accounts")
  public ResponseEntity<TrackedAccount> registerAccount(
      @PathVariable("playerId") long playerId,
      @Valid @RequestBody RegisterAccountRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(registrationService.registerAccount(playerId, request));
  }

  @PostMapping("/players/{playerId}/subscriptions")
  public ResponseEntity<ChannelTarget> subscribe(
      @PathVariable("playerId") long playerId, @Valid @RequestBody SubscriptionRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(subscriptionService.subscribe(playerId, request));
  }

  @DeleteMapping("/players/{playerId}/subscriptions")
  public ResponseEntity<Void> unsubscribe(
      @PathVariable("playerId") long playerId,
      @RequestParam("serverScope") String serverScope,
      @RequestParam("channelId") String channelId) {
    subscriptionService.unsubscribe(playerId, serverScope, channelId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/accounts/{accountId}/polling-state")
  public ResponseEntity<PollingStateResponse> pollingState(
      @PathVariable("accountId") long accountId) {
    return ResponseEntity.ok(toResponse(accountId, registrationService.pollingState(accountId)));
  }

  @PostMapping("/accounts/{accountId}/resume")
  public ResponseEntity<PollingStateResponse> resume(@PathVariable("accountId") long accountId) {
    return ResponseEntity.ok(toResponse(accountId, registrationService.resume(accountId)));
  }

  @PostMapping("/poll-cycles")
  public ResponseEntity<PollCycleResponse> runPollCycle() {
    return ResponseEntity.ok(PollCycleResponse.of(pollCycleDriver.runCycle()));
  }

  private PollingStateResponse toResponse(long accountId, PollingState state) {
    return PollingStateResponse.of(
        accountId, state, pollingIntervalPolicy.interval(state.lastMatchTime(), clock.instant()));
  }
}
