package com.rangerewards.epoch;

import com.rangerewards.math.FixedPoint128;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.Getter;

/**
 * Daily reward pipeline of one pool.
 *
 * <p>A deposit made on day N lands in {@code scheduledBucket[N + 2]} and is visible at once as
 * the queued rate. The roll into N + 1 promotes it to the next rate and the roll into N + 2
 * makes it the stream rate, so a deposit never streams before a full day has passed in the
 * queue. Rates are per second and rounded down; the remainder of a bucket stays with the
 * pipeline.
 */
@Getter
public class EpochInfo {

    /** Day boundaries between a deposit and the day it streams. */
    public static final int ACTIVATION_DELAY_DAYS = 2;

    private final long dayLengthSeconds;
    private long windowStart;
    private long windowEnd;
    private BigInteger streamRate = BigInteger.ZERO;
    private BigInteger nextStreamRate = BigInteger.ZERO;
    private BigInteger queuedStreamRate = BigInteger.ZERO;
    private final TreeMap<Long, BigInteger> scheduledBucket = new TreeMap<>();

    public EpochInfo(long dayLengthSeconds, long windowStart) {
        this.dayLengthSeconds = dayLengthSeconds;
        this.windowStart = windowStart;
        this.windowEnd = windowStart + dayLengthSeconds;
    }

    /** Opens the pipeline on the day containing {@code timestamp}. */
    public static EpochInfo startingAt(long timestamp, long dayLengthSeconds) {
        return new EpochInfo(dayLengthSeconds, Math.floorDiv(timestamp, dayLengthSeconds) * dayLengthSeconds);
    }

    public long currentDay() {
        return windowStart / dayLengthSeconds;
    }

    public boolean needsRoll(long timestamp) {
        return timestamp >= windowEnd;
    }

    /**
     * Adds {@code amount} to the bucket activating {@link #ACTIVATION_DELAY_DAYS} after the
     * current day and refreshes the queued rate from it.
     *
     * @return the day the bucket starts streaming
     */
    public long schedule(BigInteger amount) {
        long activationDay = currentDay() + ACTIVATION_DELAY_DAYS;
        BigInteger bucket = FixedPoint128.add(scheduledBucket.getOrDefault(activationDay, BigInteger.ZERO), amount);
        scheduledBucket.put(activationDay, bucket);
        queuedStreamRate = rateOf(bucket);
        return activationDay;
    }

    /** Rotates the rates across the boundary at {@link #getWindowEnd()} and opens the next day. */
    public void roll() {
        windowStart = windowEnd;
        windowEnd = windowStart + dayLengthSeconds;
        long newDay = currentDay();

        streamRate = nextStreamRate;
        nextStreamRate = queuedStreamRate;
        scheduledBucket.remove(newDay + 1);
        queuedStreamRate = rateOf(scheduledBucket.getOrDefault(newDay + ACTIVATION_DELAY_DAYS, BigInteger.ZERO));
    }

    /** True when no rate is running or waiting, so further rolls change nothing but the window. */
    public boolean isIdle() {
        return streamRate.signum() == 0
                && nextStreamRate.signum() == 0
                && queuedStreamRate.signum() == 0
                && scheduledBucket.isEmpty();
    }

    /** Moves an idle pipeline straight to the day containing {@code timestamp}. */
    public void skipTo(long timestamp) {
        windowStart = Math.floorDiv(timestamp, dayLengthSeconds) * dayLengthSeconds;
        windowEnd = windowStart + dayLengthSeconds;
    }

    public Map<Long, BigInteger> getScheduledBucket() {
        return Collections.unmodifiableMap(scheduledBucket);
    }

    private BigInteger rateOf(BigInteger bucket) {
        return bucket.divide(BigInteger.valueOf(dayLengthSeconds));
    }

    public EpochInfo copy() {
        EpochInfo copy = new EpochInfo(dayLengthSeconds, windowStart);
        copy.windowEnd = windowEnd;
        copy.streamRate = streamRate;
        copy.nextStreamRate = nextStreamRate;
        copy.queuedStreamRate = queuedStreamRate;
        copy.scheduledBucket.putAll(scheduledBucket);
        return copy;
    }
}
