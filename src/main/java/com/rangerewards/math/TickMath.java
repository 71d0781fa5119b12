package com.rangerewards.math;

import com.rangerewards.exception.BusinessException;
import com.rangerewards.exception.ErrorCode;
import java.util.Map;

public final class TickMath {

    public static final int MIN_TICK = -887272;
    public static final int MAX_TICK = 887272;

    private TickMath() {}

    /**
     * Validates a position range: ordered, aligned to the pool's spacing and inside the tick
     * domain.
     */
    public static void checkRange(int tickLower, int tickUpper, int tickSpacing) {
        if (tickSpacing <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Tick spacing must be positive");
        }
        if (tickLower >= tickUpper) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "tickLower must be below tickUpper",
                    Map.of("tickLower", tickLower, "tickUpper", tickUpper));
        }
        if (tickLower < MIN_TICK || tickUpper > MAX_TICK) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Tick range outside of supported domain",
                    Map.of("tickLower", tickLower, "tickUpper", tickUpper));
        }
        if (tickLower % tickSpacing != 0 || tickUpper % tickSpacing != 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Ticks must be multiples of the tick spacing",
                    Map.of("tickLower", tickLower, "tickUpper", tickUpper, "tickSpacing", tickSpacing));
        }
    }

    /** Largest usable tick for a spacing, used to bound bitmap scans. */
    public static int maxUsableTick(int tickSpacing) {
        return (MAX_TICK / tickSpacing) * tickSpacing;
    }

    public static int minUsableTick(int tickSpacing) {
        return (MIN_TICK / tickSpacing) * tickSpacing;
    }
}
