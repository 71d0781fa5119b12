package com.rangerewards.pool;

/** Pool manager notifications that may move the active tick or active liquidity. */
public enum PoolEventType {

    /** A swap settled; the active tick may have moved. */
    SWAP,

    /** Liquidity was added to or removed from the pool. */
    LIQUIDITY_MODIFIED
}
