package com.scoutfeed.tracker.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePlayerRequest(
    @NotBlank @Size(max = 64) String serverScope, @NotBlank @Size(max = 100) String alias) {}
