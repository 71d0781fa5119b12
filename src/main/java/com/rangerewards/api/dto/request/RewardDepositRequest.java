package com.rangerewards.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Deposit into a pool: a daily bucket for the epoch pipeline or a stream for incentives. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewardDepositRequest {

    @NotBlank
    private String poolId;

    /** Reward token; required for incentives, ignored by the single-token pipeline. */
    private String token;

    @NotNull
    @Positive
    private BigInteger amount;
}
