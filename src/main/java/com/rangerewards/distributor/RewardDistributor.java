package com.rangerewards.distributor;

import com.rangerewards.domain.PositionKey;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * Token-holder facing side of a reward distributor. Amounts are keyed by reward token.
 */
public interface RewardDistributor {

    String getName();

    /** True once the distributor holds accumulator state for the pool. */
    boolean isTracking(String poolId);

    /**
     * Brings the pool's accumulator up to the current time and active tick. Idempotent and safe
     * to call redundantly.
     */
    void pokePool(String poolId);

    /** Claims every position of {@code owner} in the given pools and pays {@code recipient}. */
    Map<String, BigInteger> claim(String owner, Collection<String> poolIds, String recipient);

    /** Claims every position of {@code owner} in every pool. */
    Map<String, BigInteger> claimAllForOwner(String owner, String recipient);

    /** Rewards the position could claim now, without mutating state. */
    Map<String, BigInteger> pendingRewards(PositionKey key);

    /** Sum of {@link #pendingRewards} over every indexed position of {@code owner}. */
    Map<String, BigInteger> pendingRewardsOwner(String owner);
}
