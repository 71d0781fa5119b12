package com.rangerewards.exception;

import java.math.BigInteger;
import java.util.Map;

/**
 * A checked integer operation left its bit range. Always fatal for the triggering operation.
 */
public class ArithmeticOverflowException extends BaseException {

    public ArithmeticOverflowException(String operation, int bits, BigInteger result) {
        this(operation, "uint" + bits, result);
    }

    public ArithmeticOverflowException(String operation, String type, BigInteger result) {
        super(
                ErrorCode.ARITHMETIC_OVERFLOW,
                String.format("%s overflowed %s", operation, type),
                Map.of("operation", operation, "type", type, "result", result.toString()));
    }
}
