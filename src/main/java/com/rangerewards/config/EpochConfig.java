package com.rangerewards.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration of the single-token daily reward pipeline.
 *
 * <p>Properties are read from the {@code rangerewards.epoch} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "rangerewards.epoch")
@Getter
@Setter
public class EpochConfig {

    /** The single token streamed by the daily pipeline. */
    private String rewardToken = "REWARD";

    /** Only caller allowed to add rewards (the fee-buyback integration). */
    private String depositor = "fee-buyback";

    /** Ledger account holding the pipeline's reward balance. */
    private String account = "epoch-pipeline";

    /** Length of one epoch window. */
    private long dayLengthSeconds = 86_400;
}
