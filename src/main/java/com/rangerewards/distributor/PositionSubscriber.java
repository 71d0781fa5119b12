package com.rangerewards.distributor;

import com.rangerewards.domain.PositionKey;
import java.math.BigInteger;

/**
 * Callbacks from the position manager adapter. Each one brings the pool up to date and accrues
 * the position before its liquidity changes.
 */
public interface PositionSubscriber {

    /** The position starts earning with {@code liquidity}. */
    void notifySubscribe(PositionKey key, BigInteger liquidity);

    /** The position stops earning; already accrued rewards stay claimable. */
    void notifyUnsubscribe(PositionKey key);

    /** Liquidity of a subscribed position changed by {@code liquidityDelta} (signed). */
    void notifyModifyLiquidity(PositionKey key, BigInteger liquidityDelta);

    /** The position was burned; already accrued rewards stay claimable. */
    void notifyBurn(PositionKey key);
}
