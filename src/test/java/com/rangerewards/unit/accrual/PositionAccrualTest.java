package com.rangerewards.unit.accrual;

import static org.assertj.core.api.Assertions.assertThat;

import com.rangerewards.accrual.PositionAccrual;
import com.rangerewards.domain.PositionKey;
import com.rangerewards.math.FixedPoint128;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionAccrualTest {

    private static final BigInteger Q128 = FixedPoint128.Q128;

    private PositionAccrual position;

    @BeforeEach
    void setUp() {
        position = new PositionAccrual(PositionKey.of("alice", "pool-1", -60, 60, null));
    }

    @Test
    @DisplayName("Zero liquidity moves the snapshot without earning")
    void zeroLiquidity() {
        BigInteger earned = position.accrue("R", Q128);

        assertThat(earned).isZero();
        assertThat(position.snapshot("R")).isEqualTo(Q128);
        assertThat(position.hasAccrued()).isFalse();
    }

    @Test
    @DisplayName("Earns liquidity times range value growth since the snapshot")
    void earnsGrowth() {
        position.accrue("R", Q128);
        position.setLiquidity(BigInteger.valueOf(500));

        BigInteger earned = position.accrue("R", Q128.multiply(BigInteger.valueOf(3)));

        assertThat(earned).isEqualTo(BigInteger.valueOf(1_000));
        assertThat(position.accrued("R")).isEqualTo(BigInteger.valueOf(1_000));
    }

    @Test
    @DisplayName("Growth across the uint256 wrap is still positive")
    void wrapsAround() {
        position.accrue("R", FixedPoint128.MAX_UINT256);
        position.setLiquidity(BigInteger.valueOf(500));

        BigInteger earned = position.accrue("R", Q128.subtract(BigInteger.ONE));

        assertThat(earned).isEqualTo(BigInteger.valueOf(500));
    }

    @Test
    @DisplayName("A token first seen later accrues from a zero snapshot")
    void lateToken() {
        position.setLiquidity(BigInteger.valueOf(500));

        assertThat(position.accrue("X", Q128)).isEqualTo(BigInteger.valueOf(500));
    }

    @Test
    @DisplayName("Claim zeroes the balance and restore puts it back")
    void claimAndRestore() {
        position.setLiquidity(BigInteger.valueOf(2));
        position.accrue("R", Q128.multiply(BigInteger.valueOf(10)));

        BigInteger claimed = position.claim("R");
        assertThat(claimed).isEqualTo(BigInteger.valueOf(20));
        assertThat(position.accrued("R")).isZero();

        position.restore("R", claimed);
        assertThat(position.accrued("R")).isEqualTo(BigInteger.valueOf(20));
    }

    @Test
    @DisplayName("Only a position without liquidity and without balance is spent")
    void spent() {
        position.setLiquidity(BigInteger.ONE);
        position.accrue("R", Q128);
        assertThat(position.isSpent()).isFalse();

        position.setLiquidity(BigInteger.ZERO);
        assertThat(position.isSpent()).isFalse();

        position.claim("R");
        assertThat(position.isSpent()).isTrue();
    }
}
