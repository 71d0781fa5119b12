package com.rangerewards.incentive;

import com.rangerewards.math.FixedPoint128;
import java.math.BigInteger;
import lombok.Getter;

/**
 * Constant-rate emission of one reward token into one pool.
 *
 * <p>{@code remainingAmount} is what has not been emitted as of {@code lastUpdateTimestamp}.
 * A top-up while the stream runs sums the remainder with the new amount and spreads it over a
 * fresh full duration starting now, so a late top-up never lowers the payout rate below what
 * the remainder alone would have paid over the same window.
 */
@Getter
public class IncentiveStream {

    private final String token;
    private BigInteger ratePerSecond = BigInteger.ZERO;
    private long finishTimestamp;
    private BigInteger remainingAmount = BigInteger.ZERO;
    private long lastUpdateTimestamp;

    public IncentiveStream(String token) {
        this.token = token;
    }

    /** True while the stream emits at {@code timestamp}. */
    public boolean isActive(long timestamp) {
        return finishTimestamp > timestamp;
    }

    /**
     * Starts a fresh stream or extends the running one, restarting the window at {@code now}.
     *
     * @return true when a running stream was extended
     */
    public boolean fund(BigInteger amount, long now, long durationSeconds) {
        boolean extending = isActive(now);
        BigInteger remaining = extending ? FixedPoint128.add(remainingAmount, amount) : amount;
        remainingAmount = remaining;
        ratePerSecond = remaining.divide(BigInteger.valueOf(durationSeconds));
        finishTimestamp = now + durationSeconds;
        lastUpdateTimestamp = now;
        return extending;
    }

    /** Rate to use for an accrual segment ending at {@code segmentEnd}. */
    public BigInteger rateUntil(long segmentEnd) {
        return segmentEnd <= finishTimestamp ? ratePerSecond : BigInteger.ZERO;
    }

    /**
     * Deducts what was emitted between the last update and {@code now} (capped at the finish).
     *
     * @return true the first time this observes the stream as finished
     */
    public boolean advanceTo(long now) {
        long emittedUntil = Math.min(now, finishTimestamp);
        if (emittedUntil > lastUpdateTimestamp) {
            BigInteger emitted = ratePerSecond.multiply(BigInteger.valueOf(emittedUntil - lastUpdateTimestamp));
            remainingAmount = FixedPoint128.sub(remainingAmount, emitted);
        }
        lastUpdateTimestamp = Math.max(lastUpdateTimestamp, now);
        if (now >= finishTimestamp && ratePerSecond.signum() > 0) {
            ratePerSecond = BigInteger.ZERO;
            return true;
        }
        return false;
    }

    public IncentiveStream copy() {
        IncentiveStream copy = new IncentiveStream(token);
        copy.ratePerSecond = ratePerSecond;
        copy.finishTimestamp = finishTimestamp;
        copy.remainingAmount = remainingAmount;
        copy.lastUpdateTimestamp = lastUpdateTimestamp;
        return copy;
    }
}
