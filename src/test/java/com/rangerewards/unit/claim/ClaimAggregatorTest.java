package com.rangerewards.unit.claim;

import static org.assertj.core.api.Assertions.assertThat;

import com.rangerewards.claim.ClaimAggregator;
import com.rangerewards.claim.ClaimBatch;
import com.rangerewards.claim.PositionSettler;
import com.rangerewards.domain.PositionKey;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ClaimAggregator: owner index, batch collection across pools, restore after a
 * failed payout and pruning of spent positions.
 */
class ClaimAggregatorTest {

    private static final PositionKey ALICE_A1 = PositionKey.of("alice", "pool-a", -60, 60, "1");
    private static final PositionKey ALICE_A2 = PositionKey.of("alice", "pool-a", 0, 120, "2");
    private static final PositionKey ALICE_B = PositionKey.of("alice", "pool-b", -60, 60, null);
    private static final PositionKey BOB_A = PositionKey.of("bob", "pool-a", -60, 60, null);

    private ClaimAggregator claimAggregator;
    private FakeSettler settler;

    @BeforeEach
    void setUp() {
        claimAggregator = new ClaimAggregator();
        settler = new FakeSettler();
        List.of(ALICE_A1, ALICE_A2, ALICE_B, BOB_A).forEach(claimAggregator::track);
    }

    @Nested
    @DisplayName("Index")
    class Index {

        @Test
        @DisplayName("Groups positions by owner and pool in insertion order")
        void groupsByOwnerAndPool() {
            assertThat(claimAggregator.pools("alice")).containsExactly("pool-a", "pool-b");
            assertThat(claimAggregator.positions("alice", "pool-a")).containsExactly(ALICE_A1, ALICE_A2);
            assertThat(claimAggregator.positions("alice")).containsExactly(ALICE_A1, ALICE_A2, ALICE_B);
            assertThat(claimAggregator.positions("carol")).isEmpty();
        }

        @Test
        @DisplayName("Tracking twice keeps a single entry")
        void idempotentTrack() {
            claimAggregator.track(ALICE_A1);

            assertThat(claimAggregator.positions("alice", "pool-a")).hasSize(2);
            assertThat(claimAggregator.isTracked(ALICE_A1)).isTrue();
        }
    }

    @Nested
    @DisplayName("Collect")
    class Collect {

        @Test
        @DisplayName("Sums settled amounts of the requested pools only")
        void sumsRequestedPools() {
            settler.balances.put(ALICE_A1, Map.of("R", BigInteger.valueOf(10)));
            settler.balances.put(ALICE_A2, Map.of("R", BigInteger.valueOf(5), "X", BigInteger.ONE));
            settler.balances.put(ALICE_B, Map.of("R", BigInteger.valueOf(100)));

            ClaimBatch batch = claimAggregator.collect("alice", List.of("pool-a"), settler);

            assertThat(batch.total("R")).isEqualTo(BigInteger.valueOf(15));
            assertThat(batch.total("X")).isEqualTo(BigInteger.ONE);
            assertThat(settler.settled).containsExactly(ALICE_A1, ALICE_A2);
        }

        @Test
        @DisplayName("Restore hands every settled amount back")
        void restore() {
            settler.balances.put(ALICE_A1, Map.of("R", BigInteger.valueOf(10)));
            ClaimBatch batch = claimAggregator.collect("alice", List.of("pool-a"), settler);

            claimAggregator.restore(batch, settler);

            assertThat(settler.restored).containsEntry(ALICE_A1, Map.of("R", BigInteger.valueOf(10)));
        }

        @Test
        @DisplayName("Restore skips tokens that reached the recipient")
        void restoreSkipsDelivered() {
            settler.balances.put(ALICE_A1, Map.of("R", BigInteger.valueOf(10), "X", BigInteger.valueOf(3)));
            settler.balances.put(ALICE_A2, Map.of("X", BigInteger.valueOf(4)));
            ClaimBatch batch = claimAggregator.collect("alice", List.of("pool-a"), settler);

            claimAggregator.restore(batch, settler, Set.of("R"));

            assertThat(settler.restored)
                    .containsEntry(ALICE_A1, Map.of("X", BigInteger.valueOf(3)))
                    .containsEntry(ALICE_A2, Map.of("X", BigInteger.valueOf(4)));
        }
    }

    @Nested
    @DisplayName("Prune")
    class Prune {

        @Test
        @DisplayName("Removes only spent positions and drops empty pools")
        void prunesSpent() {
            settler.spent.add(ALICE_A1);
            settler.spent.add(ALICE_A2);
            ClaimBatch batch = claimAggregator.collect("alice", List.of("pool-a", "pool-b"), settler);

            int pruned = claimAggregator.prune(batch, settler);

            assertThat(pruned).isEqualTo(2);
            assertThat(settler.released).containsExactly(ALICE_A1, ALICE_A2);
            assertThat(claimAggregator.pools("alice")).containsExactly("pool-b");
            assertThat(claimAggregator.positions("bob", "pool-a")).containsExactly(BOB_A);
        }

        @Test
        @DisplayName("An owner with nothing left disappears from the index")
        void dropsOwner() {
            settler.spent.add(BOB_A);
            ClaimBatch batch = claimAggregator.collect("bob", List.of("pool-a"), settler);

            claimAggregator.prune(batch, settler);

            assertThat(claimAggregator.pools("bob")).isEmpty();
        }
    }

    private static class FakeSettler implements PositionSettler {

        private final Map<PositionKey, Map<String, BigInteger>> balances = new HashMap<>();
        private final Map<PositionKey, Map<String, BigInteger>> restored = new HashMap<>();
        private final Set<PositionKey> spent = new HashSet<>();
        private final List<PositionKey> settled = new ArrayList<>();
        private final List<PositionKey> released = new ArrayList<>();

        @Override
        public Map<String, BigInteger> settle(PositionKey key) {
            settled.add(key);
            return balances.getOrDefault(key, Map.of());
        }

        @Override
        public void restore(PositionKey key, Map<String, BigInteger> amounts) {
            restored.put(key, amounts);
        }

        @Override
        public boolean isSpent(PositionKey key) {
            return spent.contains(key);
        }

        @Override
        public void release(PositionKey key) {
            released.add(key);
        }
    }
}
