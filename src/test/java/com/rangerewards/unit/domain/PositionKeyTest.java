package com.rangerewards.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.rangerewards.domain.PositionKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionKeyTest {

    @Test
    @DisplayName("Id is a stable SHA-256 hex of the identifying fields")
    void stableId() {
        PositionKey first = PositionKey.of("alice", "pool-1", -60, 60, "a");
        PositionKey second = PositionKey.of("alice", "pool-1", -60, 60, "a");

        assertThat(first).isEqualTo(second);
        assertThat(first.getId()).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("Null salt is the same as an empty salt")
    void nullSalt() {
        assertThat(PositionKey.of("alice", "pool-1", -60, 60, null))
                .isEqualTo(PositionKey.of("alice", "pool-1", -60, 60, ""));
    }

    @Test
    @DisplayName("Different ranges of one owner get different ids")
    void distinctRanges() {
        assertThat(PositionKey.of("alice", "pool-1", -60, 60, null).getId())
                .isNotEqualTo(PositionKey.of("alice", "pool-1", -120, 60, null).getId());
    }
}
