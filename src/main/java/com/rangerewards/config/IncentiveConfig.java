package com.rangerewards.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration of the multi-token incentive streams.
 * Properties are read from the {@code rangerewards.incentive} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "rangerewards.incentive")
@Getter
@Setter
public class IncentiveConfig {

    /** Only caller allowed to whitelist tokens and create incentives. */
    private String admin = "governance";

    /** Ledger account holding the incentive balances. */
    private String account = "incentive-ledger";

    /** Length of a stream window; a top-up restarts it. */
    private long durationSeconds = 7 * 86_400;

    /** Upper bound on distinct reward tokens streamed into one pool. */
    private int maxTokensPerPool = 8;
}
