package com.rangerewards.math;

import com.rangerewards.exception.ArithmeticOverflowException;
import com.rangerewards.exception.LiquidityUnderflowException;
import java.math.BigInteger;

public final class LiquidityMath {

    public static final BigInteger MAX_UINT128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    public static final BigInteger MAX_INT128 = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

    public static final BigInteger MIN_INT128 = BigInteger.ONE.shiftLeft(127).negate();

    private LiquidityMath() {}

    /**
     * Applies a signed delta to an unsigned liquidity amount. Never wraps.
     *
     * @throws LiquidityUnderflowException if more liquidity is removed than present
     * @throws ArithmeticOverflowException if the result leaves the uint128 range
     */
    public static BigInteger addDelta(BigInteger liquidity, BigInteger delta) {
        BigInteger result = liquidity.add(delta);
        if (result.signum() < 0) {
            throw new LiquidityUnderflowException(liquidity, delta);
        }
        if (result.compareTo(MAX_UINT128) > 0) {
            throw new ArithmeticOverflowException("addDelta", 128, result);
        }
        return result;
    }

    /** Checked int128 addition used for a tick's net liquidity. */
    public static BigInteger addSigned(BigInteger net, BigInteger delta) {
        BigInteger result = net.add(delta);
        if (result.compareTo(MAX_INT128) > 0 || result.compareTo(MIN_INT128) < 0) {
            throw new ArithmeticOverflowException("liquidityNet", "int128", result);
        }
        return result;
    }
}
