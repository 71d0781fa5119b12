package com.rangerewards.claim;

import com.rangerewards.domain.PositionKey;
import java.math.BigInteger;
import java.util.Map;

/**
 * Distributor-side operations the {@link ClaimAggregator} drives for each indexed position.
 */
public interface PositionSettler {

    /** Accrues the position against live pool state, then takes and zeroes its accrued balances. */
    Map<String, BigInteger> settle(PositionKey key);

    /** Puts back amounts taken by {@link #settle} when the payout failed. */
    void restore(PositionKey key, Map<String, BigInteger> amounts);

    /** True when the position has no liquidity and nothing left to claim. */
    boolean isSpent(PositionKey key);

    /** Drops the position record once it is spent. */
    void release(PositionKey key);
}
