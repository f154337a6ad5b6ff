package com.polyfetch.orchestrator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Upper bound for each backend fetch; a fetch still running after {@code timeout} is reported as TIMEOUT.
 */
@ConfigurationProperties(prefix = "polyfetch.fetch")
public record FetchProperties(@DefaultValue("30s") Duration timeout) {
}
