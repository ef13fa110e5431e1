/*
 * Where: Match tracker configuration binding
 * What: schedule and thresholds for abandoned-server detection and permission error cleanup
 */
package com.scoutfeed.tracker.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "tracker.maintenance")
@Validated
public record PermissionErrorMaintenanceProperties(
    boolean enabled,
    @NotNull Duration interval,
    @NotNull Duration abandonAfter,
    @NotNull Duration resolvedRetention) {}
