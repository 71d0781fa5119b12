package com.rangerewards.pool;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the pool manager integration after every swap or liquidity change.
 * {@link PoolEventListener} records the new active tick and pokes every reward distributor.
 */
public class PoolEvent extends ApplicationEvent {

    private final String poolId;
    private final PoolEventType eventType;
    private final int activeTick;

    public PoolEvent(Object source, String poolId, PoolEventType eventType, int activeTick) {
        super(source);
        this.poolId = poolId;
        this.eventType = eventType;
        this.activeTick = activeTick;
    }

    public String getPoolId() {
        return poolId;
    }

    public PoolEventType getEventType() {
        return eventType;
    }

    public int getActiveTick() {
        return activeTick;
    }
}
