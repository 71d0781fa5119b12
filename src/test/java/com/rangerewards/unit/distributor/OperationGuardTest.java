package com.rangerewards.unit.distributor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rangerewards.distributor.OperationGuard;
import com.rangerewards.exception.OperationInProgressException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OperationGuardTest {

    private final OperationGuard operationGuard = new OperationGuard();

    @Test
    @DisplayName("Nested entry fails while the outer operation runs")
    void nestedEntryFails() {
        assertThatThrownBy(() -> operationGuard.run("claim", () -> operationGuard.run("claim", () -> 1)))
                .isInstanceOf(OperationInProgressException.class)
                .hasMessageContaining("claim");
        assertThat(operationGuard.isInFlight()).isFalse();
    }

    @Test
    @DisplayName("Guard is released after a failure")
    void releasedAfterFailure() {
        assertThatThrownBy(() -> operationGuard.run("claim", () -> {
                    throw new IllegalStateException("boom");
                }))
                .isInstanceOf(IllegalStateException.class);

        assertThat(operationGuard.run("claim", () -> 42)).isEqualTo(42);
    }
}
