package com.rangerewards.accrual;

import com.rangerewards.domain.PositionKey;
import com.rangerewards.math.FixedPoint128;
import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Reward bookkeeping of one position: its liquidity, and per reward token the range value seen
 * at the last accrual plus the claimable balance accrued so far.
 *
 * <p>{@link #accrue} must run before every liquidity change, before the position leaves the
 * distributor, and before reading pending rewards, each time with a range value derived from
 * the live pool state. A stale range value under-accrues silently.
 */
public class PositionAccrual {

    private final PositionKey key;
    private BigInteger liquidity = BigInteger.ZERO;
    private final Map<String, BigInteger> rewardsPerLiquidityLastX128 = new HashMap<>();
    private final Map<String, BigInteger> rewardsAccrued = new HashMap<>();

    public PositionAccrual(PositionKey key) {
        this.key = key;
    }

    /**
     * Credits the growth of the range value since the last snapshot to the current liquidity
     * and moves the snapshot forward.
     *
     * @return the amount credited by this call
     */
    public BigInteger accrue(String token, BigInteger currentRangeValue) {
        // A token first seen after the position was opened started from a range value of zero
        BigInteger last = snapshot(token);
        rewardsPerLiquidityLastX128.put(token, currentRangeValue);
        if (liquidity.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger delta = FixedPoint128.wrappingSub(currentRangeValue, last);
        BigInteger earned = FixedPoint128.mulDiv(delta, liquidity, FixedPoint128.Q128);
        if (earned.signum() > 0) {
            rewardsAccrued.put(token, FixedPoint128.add(accrued(token), earned));
        }
        return earned;
    }

    /** Returns and zeroes the accrued balance of {@code token}. The snapshot is left untouched. */
    public BigInteger claim(String token) {
        BigInteger amount = accrued(token);
        rewardsAccrued.remove(token);
        return amount;
    }

    /** Re-credits an amount taken by {@link #claim} whose payout did not go through. */
    public void restore(String token, BigInteger amount) {
        if (amount.signum() > 0) {
            rewardsAccrued.put(token, FixedPoint128.add(accrued(token), amount));
        }
    }

    public BigInteger accrued(String token) {
        return rewardsAccrued.getOrDefault(token, BigInteger.ZERO);
    }

    public BigInteger snapshot(String token) {
        return rewardsPerLiquidityLastX128.getOrDefault(token, BigInteger.ZERO);
    }

    public boolean hasAccrued() {
        return rewardsAccrued.values().stream().anyMatch(amount -> amount.signum() > 0);
    }

    /** A position with no liquidity and nothing left to claim can be dropped. */
    public boolean isSpent() {
        return liquidity.signum() == 0 && !hasAccrued();
    }

    public Map<String, BigInteger> getRewardsAccrued() {
        return Collections.unmodifiableMap(rewardsAccrued);
    }

    public PositionKey getKey() {
        return key;
    }

    public BigInteger getLiquidity() {
        return liquidity;
    }

    public void setLiquidity(BigInteger liquidity) {
        this.liquidity = liquidity;
    }

    public int getTickLower() {
        return key.getTickLower();
    }

    public int getTickUpper() {
        return key.getTickUpper();
    }

    public PositionAccrual copy() {
        PositionAccrual copy = new PositionAccrual(key);
        copy.liquidity = liquidity;
        copy.rewardsPerLiquidityLastX128.putAll(rewardsPerLiquidityLastX128);
        copy.rewardsAccrued.putAll(rewardsAccrued);
        return copy;
    }
}
