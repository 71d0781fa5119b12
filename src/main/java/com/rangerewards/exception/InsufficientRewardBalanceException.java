package com.rangerewards.exception;

import java.math.BigInteger;
import java.util.Map;

/**
 * A payout would exceed what the distributing account holds. Indicates an accounting defect,
 * so the claim is rejected instead of paying a truncated amount.
 */
public class InsufficientRewardBalanceException extends BaseException {

    public InsufficientRewardBalanceException(String token, BigInteger requested, BigInteger available) {
        super(
                ErrorCode.INSUFFICIENT_BALANCE,
                String.format("Payout of %s %s exceeds held balance %s", requested, token, available),
                Map.of("token", token, "requested", requested.toString(), "available", available.toString()));
    }
}
