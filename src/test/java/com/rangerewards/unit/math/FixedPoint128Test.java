package com.rangerewards.unit.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rangerewards.exception.ArithmeticOverflowException;
import com.rangerewards.exception.LiquidityUnderflowException;
import com.rangerewards.math.FixedPoint128;
import com.rangerewards.math.LiquidityMath;
import com.rangerewards.math.TickMath;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FixedPoint128Test {

    @Nested
    @DisplayName("FixedPoint128")
    class FixedPoint {

        @Test
        @DisplayName("mulDiv rounds down")
        void mulDivFloors() {
            assertThat(FixedPoint128.mulDiv(BigInteger.TEN, BigInteger.ONE, BigInteger.valueOf(3)))
                    .isEqualTo(BigInteger.valueOf(3));
        }

        @Test
        @DisplayName("mulDiv keeps full precision of the intermediate product")
        void mulDivWide() {
            BigInteger result =
                    FixedPoint128.mulDiv(FixedPoint128.MAX_UINT256, FixedPoint128.Q128, FixedPoint128.Q128);

            assertThat(result).isEqualTo(FixedPoint128.MAX_UINT256);
        }

        @Test
        @DisplayName("Checked add overflows past 2^256 - 1")
        void addOverflow() {
            assertThatThrownBy(() -> FixedPoint128.add(FixedPoint128.MAX_UINT256, BigInteger.ONE))
                    .isInstanceOf(ArithmeticOverflowException.class);
        }

        @Test
        @DisplayName("Wrapping subtraction stays in range")
        void wrappingSub() {
            assertThat(FixedPoint128.wrappingSub(BigInteger.ONE, BigInteger.TWO)).isEqualTo(FixedPoint128.MAX_UINT256);
            assertThat(FixedPoint128.wrappingSub(BigInteger.TEN, BigInteger.ONE)).isEqualTo(BigInteger.valueOf(9));
        }

        @Test
        @DisplayName("Checked subtraction below zero fails")
        void subUnderflow() {
            assertThatThrownBy(() -> FixedPoint128.sub(BigInteger.ONE, BigInteger.TWO))
                    .isInstanceOf(ArithmeticOverflowException.class);
        }
    }

    @Nested
    @DisplayName("LiquidityMath")
    class Liquidity {

        @Test
        @DisplayName("Removing more than present is an underflow")
        void underflow() {
            assertThatThrownBy(() -> LiquidityMath.addDelta(BigInteger.ONE, BigInteger.valueOf(-2)))
                    .isInstanceOf(LiquidityUnderflowException.class);
        }

        @Test
        @DisplayName("Liquidity above uint128 overflows")
        void overflow() {
            assertThatThrownBy(() -> LiquidityMath.addDelta(LiquidityMath.MAX_UINT128, BigInteger.ONE))
                    .isInstanceOf(ArithmeticOverflowException.class);
        }

        @Test
        @DisplayName("Net liquidity is bounded by int128")
        void netBounds() {
            assertThat(LiquidityMath.addSigned(LiquidityMath.MIN_INT128.add(BigInteger.ONE), BigInteger.ONE.negate()))
                    .isEqualTo(LiquidityMath.MIN_INT128);
            assertThatThrownBy(() -> LiquidityMath.addSigned(LiquidityMath.MAX_INT128, BigInteger.ONE))
                    .isInstanceOf(ArithmeticOverflowException.class);
        }
    }

    @Test
    @DisplayName("Usable tick bounds are aligned to the spacing")
    void usableTicks() {
        assertThat(TickMath.maxUsableTick(60)).isEqualTo(887_220);
        assertThat(TickMath.minUsableTick(60)).isEqualTo(-887_220);
    }
}
