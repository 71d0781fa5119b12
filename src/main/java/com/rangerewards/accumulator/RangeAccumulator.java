package com.rangerewards.accumulator;

import com.rangerewards.exception.BusinessException;
import com.rangerewards.exception.ErrorCode;
import com.rangerewards.math.FixedPoint128;
import com.rangerewards.math.LiquidityMath;
import com.rangerewards.math.TickMath;
import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tick-indexed rewards-per-liquidity accumulator of a single pool.
 *
 * <p>Keeps a global Q128 accumulator per reward token, the per-tick "outside" snapshots, a
 * sparse bitmap of initialised ticks and the liquidity currently in range. The value earned by
 * one unit of liquidity inside {@code [lower, upper)} is derived from the global accumulator
 * and the two boundary snapshots, the same way concentrated-liquidity pools derive fee growth
 * inside a range.
 *
 * <p>One instance is owned per pool by a distributor. Not thread-safe: the owner serialises
 * access.
 *
 * <p>Call ordering contract:
 * <ul>
 *   <li>{@link #sync} timestamps never decrease.</li>
 *   <li>{@link #modifyLiquidity} runs after the sync that brings the accumulator to "now" and
 *       before any sync meant to see the new liquidity.</li>
 * </ul>
 */
public class RangeAccumulator {

    private static final Logger log = LoggerFactory.getLogger(RangeAccumulator.class);

    private final String poolId;
    private final int tickSpacing;
    private final Map<Integer, TickInfo> ticks = new HashMap<>();
    private TickBitmap tickBitmap = new TickBitmap();
    private final Map<String, BigInteger> cumulativeRplX128 = new HashMap<>();

    private BigInteger activeLiquidity = BigInteger.ZERO;
    private int activeTick;
    private long lastSyncTimestamp;

    public RangeAccumulator(String poolId, int tickSpacing, int activeTick, long createdAt) {
        if (tickSpacing <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Tick spacing must be positive");
        }
        this.poolId = poolId;
        this.tickSpacing = tickSpacing;
        this.activeTick = activeTick;
        this.lastSyncTimestamp = createdAt;
    }

    // ========================
    // SYNC
    // ========================

    /**
     * Advances the accumulator to {@code timestamp}, accruing each token's rate over the
     * elapsed interval to the liquidity in range, then moves the active tick to
     * {@code newActiveTick}, flipping every initialised tick crossed on the way.
     *
     * <p>The last sync timestamp is updated even when nothing is in range, so an idle interval
     * never accrues retroactively once liquidity returns.
     *
     * @param tokens reward tokens, parallel to {@code ratesPerSecond}
     * @param ratesPerSecond emission rate of each token over the interval
     */
    public void sync(List<String> tokens, List<BigInteger> ratesPerSecond, int newActiveTick, long timestamp) {
        if (tokens.size() != ratesPerSecond.size()) {
            throw new IllegalArgumentException("tokens and rates must have the same length");
        }
        if (timestamp < lastSyncTimestamp) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Sync timestamp moved backwards",
                    Map.of("poolId", poolId, "lastSync", lastSyncTimestamp, "timestamp", timestamp));
        }

        long elapsed = timestamp - lastSyncTimestamp;
        if (elapsed > 0 && activeLiquidity.signum() > 0) {
            BigInteger dt = BigInteger.valueOf(elapsed);
            for (int i = 0; i < tokens.size(); i++) {
                BigInteger rate = ratesPerSecond.get(i);
                if (rate.signum() == 0) {
                    continue;
                }
                BigInteger growth = FixedPoint128.mulDiv(rate.multiply(dt), FixedPoint128.Q128, activeLiquidity);
                String token = tokens.get(i);
                cumulativeRplX128.put(token, FixedPoint128.add(cumulative(token), growth));
            }
        }
        for (String token : tokens) {
            cumulativeRplX128.putIfAbsent(token, BigInteger.ZERO);
        }

        crossTo(newActiveTick);
        lastSyncTimestamp = timestamp;
    }

    private void crossTo(int target) {
        if (target > activeTick) {
            crossUp(target);
        } else if (target < activeTick) {
            crossDown(target);
        }
    }

    /** Crosses initialised ticks k with activeTick < k <= target. */
    private void crossUp(int target) {
        int bound = Math.min(target, TickMath.maxUsableTick(tickSpacing));
        int tick = activeTick;
        while (tick < bound) {
            TickBitmap.Next next = tickBitmap.nextInitializedTickWithinOneWord(tick, tickSpacing, false);
            if (next.tick() > bound) {
                break;
            }
            if (next.initialized()) {
                TickInfo info = ticks.get(next.tick());
                flipOutside(info);
                activeLiquidity = LiquidityMath.addDelta(activeLiquidity, info.getLiquidityNet());
                log.debug("Pool {} crossed tick {} upward, activeLiquidity={}", poolId, next.tick(), activeLiquidity);
            }
            tick = next.tick();
        }
        activeTick = target;
    }

    /** Crosses initialised ticks k with target < k <= activeTick. */
    private void crossDown(int target) {
        int tick = activeTick;
        while (tick > target) {
            TickBitmap.Next next = tickBitmap.nextInitializedTickWithinOneWord(tick, tickSpacing, true);
            if (next.tick() <= target) {
                break;
            }
            if (next.initialized()) {
                TickInfo info = ticks.get(next.tick());
                flipOutside(info);
                activeLiquidity = LiquidityMath.addDelta(activeLiquidity, info.getLiquidityNet().negate());
                log.debug("Pool {} crossed tick {} downward, activeLiquidity={}", poolId, next.tick(), activeLiquidity);
            }
            tick = next.tick() - 1;
        }
        activeTick = target;
    }

    private void flipOutside(TickInfo info) {
        for (Map.Entry<String, BigInteger> entry : cumulativeRplX128.entrySet()) {
            String token = entry.getKey();
            info.setOutside(token, FixedPoint128.wrappingSub(entry.getValue(), info.outside(token)));
        }
    }

    // ========================
    // RANGE VALUE
    // ========================

    /**
     * Rewards per unit of liquidity accumulated inside {@code [tickLower, tickUpper)} since the
     * boundary ticks were initialised. Only differences between two readings are meaningful;
     * the arithmetic wraps modulo 2^256.
     */
    public BigInteger rangeValue(String token, int tickLower, int tickUpper) {
        BigInteger cumulative = cumulative(token);
        BigInteger lowerOutside = outside(tickLower, token);
        BigInteger upperOutside = outside(tickUpper, token);

        BigInteger below = activeTick >= tickLower ? lowerOutside : FixedPoint128.wrappingSub(cumulative, lowerOutside);
        BigInteger above = activeTick < tickUpper ? upperOutside : FixedPoint128.wrappingSub(cumulative, upperOutside);

        return FixedPoint128.wrappingSub(FixedPoint128.wrappingSub(cumulative, below), above);
    }

    // ========================
    // LIQUIDITY
    // ========================

    /**
     * Applies a liquidity change for the range {@code [tickLower, tickUpper)} to both boundary
     * ticks and, when the range contains the active tick, to active liquidity.
     */
    public void modifyLiquidity(int tickLower, int tickUpper, BigInteger liquidityDelta) {
        TickMath.checkRange(tickLower, tickUpper, tickSpacing);
        if (liquidityDelta.signum() == 0) {
            return;
        }

        // Validate every gross, net and active change before touching state so a failure leaves nothing half-applied
        TickInfo lowerInfo = ticks.get(tickLower);
        TickInfo upperInfo = ticks.get(tickUpper);
        LiquidityMath.addDelta(grossOf(lowerInfo), liquidityDelta);
        LiquidityMath.addDelta(grossOf(upperInfo), liquidityDelta);
        LiquidityMath.addSigned(netOf(lowerInfo), liquidityDelta);
        LiquidityMath.addSigned(netOf(upperInfo), liquidityDelta.negate());
        boolean inRange = tickLower <= activeTick && activeTick < tickUpper;
        if (inRange) {
            LiquidityMath.addDelta(activeLiquidity, liquidityDelta);
        }

        updateTick(tickLower, liquidityDelta, false);
        updateTick(tickUpper, liquidityDelta, true);

        if (inRange) {
            activeLiquidity = LiquidityMath.addDelta(activeLiquidity, liquidityDelta);
        }
    }

    private static BigInteger grossOf(TickInfo info) {
        return info != null ? info.getLiquidityGross() : BigInteger.ZERO;
    }

    private static BigInteger netOf(TickInfo info) {
        return info != null ? info.getLiquidityNet() : BigInteger.ZERO;
    }

    private void updateTick(int tick, BigInteger liquidityDelta, boolean upper) {
        TickInfo info = ticks.computeIfAbsent(tick, t -> new TickInfo());
        BigInteger grossBefore = info.getLiquidityGross();
        BigInteger grossAfter = LiquidityMath.addDelta(grossBefore, liquidityDelta);

        if (grossBefore.signum() == 0) {
            // All growth so far is assumed to have happened below the tick
            if (tick <= activeTick) {
                cumulativeRplX128.forEach(info::setOutside);
            }
        }

        info.setLiquidityGross(grossAfter);
        info.setLiquidityNet(LiquidityMath.addSigned(
                info.getLiquidityNet(), upper ? liquidityDelta.negate() : liquidityDelta));

        if ((grossBefore.signum() == 0) != (grossAfter.signum() == 0)) {
            tickBitmap.flipTick(tick, tickSpacing);
        }
        if (grossAfter.signum() == 0) {
            ticks.remove(tick);
        }
    }

    // ========================
    // READ ACCESS
    // ========================

    public BigInteger cumulative(String token) {
        return cumulativeRplX128.getOrDefault(token, BigInteger.ZERO);
    }

    public Map<String, BigInteger> getCumulativeRplX128() {
        return Collections.unmodifiableMap(cumulativeRplX128);
    }

    public BigInteger outside(int tick, String token) {
        TickInfo info = ticks.get(tick);
        return info != null ? info.outside(token) : BigInteger.ZERO;
    }

    public TickInfo getTick(int tick) {
        return ticks.get(tick);
    }

    public Map<Integer, TickInfo> getTicks() {
        return Collections.unmodifiableMap(ticks);
    }

    public boolean isTickInitialized(int tick) {
        return tickBitmap.isInitialized(tick, tickSpacing);
    }

    public String getPoolId() {
        return poolId;
    }

    public int getTickSpacing() {
        return tickSpacing;
    }

    public BigInteger getActiveLiquidity() {
        return activeLiquidity;
    }

    public int getActiveTick() {
        return activeTick;
    }

    public long getLastSyncTimestamp() {
        return lastSyncTimestamp;
    }

    /** Deep copy, used to project pending rewards without mutating live state. */
    public RangeAccumulator copy() {
        RangeAccumulator copy = new RangeAccumulator(poolId, tickSpacing, activeTick, lastSyncTimestamp);
        ticks.forEach((tick, info) -> copy.ticks.put(tick, info.copy()));
        copy.tickBitmap = tickBitmap.copy();
        copy.cumulativeRplX128.putAll(cumulativeRplX128);
        copy.activeLiquidity = activeLiquidity;
        return copy;
    }
}
