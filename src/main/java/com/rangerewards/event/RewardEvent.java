package com.rangerewards.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the distributors whenever reward state changes in a way off-chain consumers
 * care about: deposits, epoch rolls, stream changes and claims.
 *
 * <p>Details carry event-specific values, e.g. {@code amount} and {@code activationDay} for
 * REWARDS_SCHEDULED or per-token totals for REWARDS_CLAIMED.
 */
public class RewardEvent extends ApplicationEvent {

    private final RewardEventType eventType;
    private final String poolId;
    private final Map<String, Object> details;

    public RewardEvent(Object source, RewardEventType eventType, String poolId, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.poolId = poolId;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RewardEventType getEventType() {
        return eventType;
    }

    /** Pool the event belongs to; null for events spanning several pools (claims, whitelist). */
    public String getPoolId() {
        return poolId;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
