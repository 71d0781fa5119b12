package com.rangerewards.exception;

import java.math.BigInteger;
import java.util.Map;

public class LiquidityUnderflowException extends BaseException {

    public LiquidityUnderflowException(BigInteger liquidity, BigInteger delta) {
        super(
                ErrorCode.LIQUIDITY_UNDERFLOW,
                String.format("Cannot apply liquidity delta %s to %s", delta, liquidity),
                Map.of("liquidity", liquidity.toString(), "delta", delta.toString()));
    }
}
