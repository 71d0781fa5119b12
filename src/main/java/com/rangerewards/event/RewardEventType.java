package com.rangerewards.event;

/**
 * Classifies a {@link RewardEvent}.
 */
public enum RewardEventType {

    /** A reward bucket was scheduled into the daily pipeline. */
    REWARDS_SCHEDULED,

    /** A pool's daily pipeline rotated across a day boundary. */
    EPOCH_ROLLED,

    /** A fresh incentive stream started. */
    INCENTIVE_CREATED,

    /** An active incentive stream was topped up and its window restarted. */
    INCENTIVE_EXTENDED,

    /** A poke observed that an incentive stream reached its finish timestamp. */
    STREAM_FINISHED,

    /** An owner claimed accrued rewards. */
    REWARDS_CLAIMED,

    /** A reward token was added to or removed from the incentive whitelist. */
    WHITELIST_UPDATED
}
