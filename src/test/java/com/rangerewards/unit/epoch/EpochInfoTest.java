package com.rangerewards.unit.epoch;

import static org.assertj.core.api.Assertions.assertThat;

import com.rangerewards.epoch.EpochInfo;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EpochInfoTest {

    private static final long DAY = 86_400;
    private static final long DAY_100 = 100 * DAY;

    private EpochInfo info;

    @BeforeEach
    void setUp() {
        info = EpochInfo.startingAt(DAY_100 + 3_600, DAY);
    }

    @Test
    @DisplayName("Window is aligned to the day containing the start timestamp")
    void alignedWindow() {
        assertThat(info.getWindowStart()).isEqualTo(DAY_100);
        assertThat(info.getWindowEnd()).isEqualTo(DAY_100 + DAY);
        assertThat(info.currentDay()).isEqualTo(100);
        assertThat(info.isIdle()).isTrue();
    }

    @Test
    @DisplayName("Deposit activates two boundaries later and streams for exactly one day")
    void threeStageRotation() {
        long activationDay = info.schedule(BigInteger.valueOf(8_640_000));

        assertThat(activationDay).isEqualTo(102);
        assertThat(info.getQueuedStreamRate()).isEqualTo(BigInteger.valueOf(100));

        info.roll();
        assertThat(info.getStreamRate()).isZero();
        assertThat(info.getNextStreamRate()).isEqualTo(BigInteger.valueOf(100));
        assertThat(info.getQueuedStreamRate()).isZero();
        assertThat(info.getScheduledBucket()).isEmpty();

        info.roll();
        assertThat(info.currentDay()).isEqualTo(102);
        assertThat(info.getStreamRate()).isEqualTo(BigInteger.valueOf(100));

        info.roll();
        assertThat(info.getStreamRate()).isZero();
        assertThat(info.isIdle()).isTrue();
    }

    @Test
    @DisplayName("Deposits on the same day add up in one bucket")
    void sameDayDeposits() {
        info.schedule(BigInteger.valueOf(DAY));
        info.schedule(BigInteger.valueOf(DAY * 2));

        assertThat(info.getScheduledBucket()).containsEntry(102L, BigInteger.valueOf(DAY * 3));
        assertThat(info.getQueuedStreamRate()).isEqualTo(BigInteger.valueOf(3));
    }

    @Test
    @DisplayName("Rate is floored and the remainder does not stream")
    void flooredRate() {
        info.schedule(BigInteger.valueOf(DAY - 1));

        assertThat(info.getQueuedStreamRate()).isZero();
        assertThat(info.isIdle()).isFalse();
    }

    @Test
    @DisplayName("Skip moves an idle pipeline straight to the current day")
    void skipTo() {
        info.skipTo(DAY_100 + 10 * DAY + 5);

        assertThat(info.currentDay()).isEqualTo(110);
        assertThat(info.needsRoll(DAY_100 + 11 * DAY - 1)).isFalse();
        assertThat(info.needsRoll(DAY_100 + 11 * DAY)).isTrue();
    }

    @Test
    @DisplayName("Copy keeps its own bucket map")
    void copyIsIndependent() {
        EpochInfo copy = info.copy();
        copy.schedule(BigInteger.valueOf(DAY));

        assertThat(info.getScheduledBucket()).isEmpty();
        assertThat(copy.getScheduledBucket()).hasSize(1);
    }
}
