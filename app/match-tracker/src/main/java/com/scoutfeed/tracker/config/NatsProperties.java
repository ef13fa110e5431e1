/*
 * Where: Match tracker configuration binding
 * What: NATS connection settings
 * Why: owner notices can be switched to log-only where no NATS server is available
 */
package com.scoutfeed.tracker.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Duration connectionTimeout) {}
