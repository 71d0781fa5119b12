package com.rangerewards.pool;

import com.rangerewards.distributor.RewardDistributor;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns pool manager notifications into pokes, so the accumulators follow the active tick on
 * every swap and liquidity change.
 */
@Component
public class PoolEventListener {

    private static final Logger log = LoggerFactory.getLogger(PoolEventListener.class);

    private final InMemoryPoolRegistry poolRegistry;
    private final List<RewardDistributor> rewardDistributors;

    public PoolEventListener(InMemoryPoolRegistry poolRegistry, List<RewardDistributor> rewardDistributors) {
        this.poolRegistry = poolRegistry;
        this.rewardDistributors = rewardDistributors;
    }

    @EventListener
    public void onPoolEvent(PoolEvent event) {
        log.debug("Pool event {} for {} at tick {}", event.getEventType(), event.getPoolId(), event.getActiveTick());
        poolRegistry.updateActiveTick(event.getPoolId(), event.getActiveTick());
        for (RewardDistributor distributor : rewardDistributors) {
            if (distributor.isTracking(event.getPoolId())) {
                distributor.pokePool(event.getPoolId());
            }
        }
    }
}
