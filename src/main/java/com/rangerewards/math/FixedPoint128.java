package com.rangerewards.math;

import com.rangerewards.exception.ArithmeticOverflowException;
import java.math.BigInteger;

/**
 * Q128 fixed-point helpers over unsigned 256-bit values.
 *
 * <p>Accumulators are stored as plain {@link BigInteger}s holding a uint256. Growth values are
 * added with overflow checks; differences between two accumulator readings use wrapping
 * arithmetic, since only the difference of two readings is meaningful.
 */
public final class FixedPoint128 {

    public static final BigInteger Q128 = BigInteger.ONE.shiftLeft(128);

    public static final BigInteger UINT256_MODULUS = BigInteger.ONE.shiftLeft(256);

    public static final BigInteger MAX_UINT256 = UINT256_MODULUS.subtract(BigInteger.ONE);

    private FixedPoint128() {}

    /** floor(a * b / denominator), all operands unsigned. The result must fit in a uint256. */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        if (denominator.signum() <= 0) {
            throw new ArithmeticException("mulDiv denominator must be positive");
        }
        BigInteger result = a.multiply(b).divide(denominator);
        return requireUint256("mulDiv", result);
    }

    /** Checked uint256 addition. */
    public static BigInteger add(BigInteger a, BigInteger b) {
        return requireUint256("add", a.add(b));
    }

    /** Checked uint256 subtraction; a negative result is an overflow of the unsigned range. */
    public static BigInteger sub(BigInteger a, BigInteger b) {
        return requireUint256("sub", a.subtract(b));
    }

    /** a - b modulo 2^256. */
    public static BigInteger wrappingSub(BigInteger a, BigInteger b) {
        return a.subtract(b).mod(UINT256_MODULUS);
    }

    public static BigInteger requireUint256(String operation, BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new ArithmeticOverflowException(operation, 256, value);
        }
        return value;
    }
}
