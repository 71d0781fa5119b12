package com.rangerewards.pool;

import com.rangerewards.exception.BusinessException;
import com.rangerewards.exception.ErrorCode;
import com.rangerewards.exception.ResourceNotFoundException;
import com.rangerewards.math.TickMath;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pool state fed by the pool manager. Swaps update the active tick through
 * {@link #updateActiveTick}; the distributors only read it.
 */
@Component
public class InMemoryPoolRegistry implements PoolStateProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPoolRegistry.class);

    private final Map<String, PoolSnapshot> pools = new ConcurrentHashMap<>();

    private record PoolSnapshot(int tickSpacing, int activeTick) {}

    public void registerPool(String poolId, int tickSpacing, int activeTick) {
        if (tickSpacing <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Tick spacing must be positive");
        }
        checkTick(activeTick);
        pools.put(poolId, new PoolSnapshot(tickSpacing, activeTick));
        log.info("Registered pool {} (tickSpacing={}, activeTick={})", poolId, tickSpacing, activeTick);
    }

    public void updateActiveTick(String poolId, int activeTick) {
        checkTick(activeTick);
        PoolSnapshot snapshot = require(poolId);
        pools.put(poolId, new PoolSnapshot(snapshot.tickSpacing(), activeTick));
    }

    public boolean isRegistered(String poolId) {
        return pools.containsKey(poolId);
    }

    @Override
    public int getActiveTick(String poolId) {
        return require(poolId).activeTick();
    }

    @Override
    public int getTickSpacing(String poolId) {
        return require(poolId).tickSpacing();
    }

    private PoolSnapshot require(String poolId) {
        PoolSnapshot snapshot = pools.get(poolId);
        if (snapshot == null) {
            throw new ResourceNotFoundException("Pool", poolId);
        }
        return snapshot;
    }

    private static void checkTick(int tick) {
        if (tick < TickMath.MIN_TICK || tick > TickMath.MAX_TICK) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Active tick outside of supported domain");
        }
    }
}
