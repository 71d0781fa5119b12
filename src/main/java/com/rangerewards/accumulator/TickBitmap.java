package com.rangerewards.accumulator;

import java.util.HashMap;
import java.util.Map;

/**
 * Sparse bitmap of initialised ticks. Ticks are compressed by the pool's tick spacing and
 * packed into 64-bit words keyed by word position, so only words holding at least one
 * initialised tick are stored.
 */
public class TickBitmap {

    private final Map<Integer, Long> words = new HashMap<>();

    /** Result of a single-word scan. {@code tick} is a word boundary when nothing was found. */
    public record Next(int tick, boolean initialized) {}

    public void flipTick(int tick, int tickSpacing) {
        if (tick % tickSpacing != 0) {
            throw new IllegalArgumentException("Tick " + tick + " is not aligned to spacing " + tickSpacing);
        }
        int compressed = tick / tickSpacing;
        int wordPos = compressed >> 6;
        long mask = 1L << (compressed & 63);
        long updated = words.getOrDefault(wordPos, 0L) ^ mask;
        if (updated == 0L) {
            words.remove(wordPos);
        } else {
            words.put(wordPos, updated);
        }
    }

    public boolean isInitialized(int tick, int tickSpacing) {
        if (tick % tickSpacing != 0) {
            return false;
        }
        int compressed = tick / tickSpacing;
        long word = words.getOrDefault(compressed >> 6, 0L);
        return (word & (1L << (compressed & 63))) != 0;
    }

    /**
     * Finds the next initialised tick in the same word as {@code tick}.
     *
     * @param lte when true search at or below {@code tick}, otherwise strictly above it
     */
    public Next nextInitializedTickWithinOneWord(int tick, int tickSpacing, boolean lte) {
        int compressed = Math.floorDiv(tick, tickSpacing);

        if (lte) {
            int wordPos = compressed >> 6;
            int bitPos = compressed & 63;
            long mask = ((1L << bitPos) - 1) + (1L << bitPos);
            long masked = words.getOrDefault(wordPos, 0L) & mask;
            boolean initialized = masked != 0;
            int next = initialized
                    ? (compressed - (bitPos - mostSignificantBit(masked))) * tickSpacing
                    : (compressed - bitPos) * tickSpacing;
            return new Next(next, initialized);
        }

        int start = compressed + 1;
        int wordPos = start >> 6;
        int bitPos = start & 63;
        long mask = ~((1L << bitPos) - 1);
        long masked = words.getOrDefault(wordPos, 0L) & mask;
        boolean initialized = masked != 0;
        int next = initialized
                ? (start + (Long.numberOfTrailingZeros(masked) - bitPos)) * tickSpacing
                : (start + (63 - bitPos)) * tickSpacing;
        return new Next(next, initialized);
    }

    public int wordCount() {
        return words.size();
    }

    public TickBitmap copy() {
        TickBitmap copy = new TickBitmap();
        copy.words.putAll(words);
        return copy;
    }

    private static int mostSignificantBit(long value) {
        return 63 - Long.numberOfLeadingZeros(value);
    }
}
