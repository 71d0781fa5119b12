package com.rangerewards.pool;

/**
 * Read access to the pool manager: where the price currently is and how ticks are spaced.
 */
public interface PoolStateProvider {

    /** @throws com.rangerewards.exception.ResourceNotFoundException for an unknown pool */
    int getActiveTick(String poolId);

    int getTickSpacing(String poolId);
}
