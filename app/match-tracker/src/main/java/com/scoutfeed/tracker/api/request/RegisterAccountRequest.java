package com.scoutfeed.tracker.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/** {@code lastMatchTime} is optional; when absent the upstream is asked for the latest match. */
public record RegisterAccountRequest(
    @NotBlank @Size(max = 128) String externalAccountId,
    @NotBlank @Size(max = 16) String region,
    @NotBlank @Size(max = 100) String alias,
    Instant lastMatchTime) {}
