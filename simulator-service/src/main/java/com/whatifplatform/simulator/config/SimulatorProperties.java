package com.whatifplatform.simulator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables under {@code simulator.*}.
 */
@Data
@ConfigurationProperties(prefix = "simulator")
public class SimulatorProperties {

    /** Upper bound on each upstream query; on expiry the data is treated as unavailable. */
    private Duration collaboratorTimeout = Duration.ofSeconds(2);

    private int connectTimeoutMillis = 1_000;

    /** Default for the {@code includeExecutiveSummary} request parameter. */
    private boolean includeExecutiveSummary = true;
}
