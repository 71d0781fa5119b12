package com.rangerewards.accumulator;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Boundary of one or more liquidity ranges.
 *
 * <p>{@code liquidityNet} is applied to active liquidity when the active tick crosses this
 * tick upward and subtracted when crossing downward. The per-token outside value is the
 * accumulator growth on the side of this tick away from the active tick.
 */
@Getter
public class TickInfo {

    private BigInteger liquidityGross = BigInteger.ZERO;
    private BigInteger liquidityNet = BigInteger.ZERO;
    private final Map<String, BigInteger> rewardsPerLiquidityOutsideX128 = new HashMap<>();

    public BigInteger outside(String token) {
        return rewardsPerLiquidityOutsideX128.getOrDefault(token, BigInteger.ZERO);
    }

    void setOutside(String token, BigInteger value) {
        rewardsPerLiquidityOutsideX128.put(token, value);
    }

    void setLiquidityGross(BigInteger liquidityGross) {
        this.liquidityGross = liquidityGross;
    }

    void setLiquidityNet(BigInteger liquidityNet) {
        this.liquidityNet = liquidityNet;
    }

    TickInfo copy() {
        TickInfo copy = new TickInfo();
        copy.liquidityGross = liquidityGross;
        copy.liquidityNet = liquidityNet;
        copy.rewardsPerLiquidityOutsideX128.putAll(rewardsPerLiquidityOutsideX128);
        return copy;
    }
}
