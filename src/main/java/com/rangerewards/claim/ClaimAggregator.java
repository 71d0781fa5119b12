package com.rangerewards.claim;

import com.rangerewards.domain.PositionKey;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner to pool to position-key index of one distributor, and the loop that claims across all
 * of an owner's positions in a single call.
 *
 * <p>Entries are appended when a position subscribes or first receives liquidity. They are
 * never removed on unsubscribe or burn: a withdrawn position keeps its accrued rewards and its
 * entry is pruned only after a successful claim has paid it out.
 */
public class ClaimAggregator {

    private static final Logger log = LoggerFactory.getLogger(ClaimAggregator.class);

    private final Map<String, Map<String, Set<PositionKey>>> index = new HashMap<>();

    public void track(PositionKey key) {
        index.computeIfAbsent(key.getOwner(), owner -> new LinkedHashMap<>())
                .computeIfAbsent(key.getPoolId(), pool -> new LinkedHashSet<>())
                .add(key);
    }

    public boolean isTracked(PositionKey key) {
        return positions(key.getOwner(), key.getPoolId()).contains(key);
    }

    public Set<PositionKey> positions(String owner, String poolId) {
        Map<String, Set<PositionKey>> byPool = index.get(owner);
        if (byPool == null || !byPool.containsKey(poolId)) {
            return Set.of();
        }
        return Collections.unmodifiableSet(byPool.get(poolId));
    }

    public Set<String> pools(String owner) {
        Map<String, Set<PositionKey>> byPool = index.get(owner);
        return byPool != null ? Collections.unmodifiableSet(byPool.keySet()) : Set.of();
    }

    public List<PositionKey> positions(String owner) {
        List<PositionKey> keys = new ArrayList<>();
        Map<String, Set<PositionKey>> byPool = index.get(owner);
        if (byPool != null) {
            byPool.values().forEach(keys::addAll);
        }
        return keys;
    }

    /**
     * Settles every indexed position of {@code owner} in the requested pools. Nothing is paid
     * here; the caller transfers {@link ClaimBatch#getTotals()} and then calls {@link #prune},
     * or {@link #restore} if the transfer failed.
     */
    public ClaimBatch collect(String owner, Collection<String> poolIds, PositionSettler settler) {
        ClaimBatch batch = new ClaimBatch(owner);
        for (String poolId : poolIds) {
            for (PositionKey key : positions(owner, poolId)) {
                batch.add(key, settler.settle(key));
            }
        }
        return batch;
    }

    public void restore(ClaimBatch batch, PositionSettler settler) {
        restore(batch, settler, Set.of());
    }

    /** Re-credits every settled amount except those of the {@code delivered} tokens. */
    public void restore(ClaimBatch batch, PositionSettler settler, Set<String> delivered) {
        batch.getSettled().forEach((key, amounts) -> {
            Map<String, BigInteger> undelivered = new LinkedHashMap<>(amounts);
            undelivered.keySet().removeAll(delivered);
            settler.restore(key, undelivered);
        });
    }

    /**
     * Removes the settled positions that are now spent from the index and releases them.
     *
     * @return number of entries pruned
     */
    public int prune(ClaimBatch batch, PositionSettler settler) {
        Map<String, Set<PositionKey>> byPool = index.get(batch.getOwner());
        if (byPool == null) {
            return 0;
        }
        int pruned = 0;
        for (PositionKey key : batch.getSettled().keySet()) {
            if (!settler.isSpent(key)) {
                continue;
            }
            Set<PositionKey> keys = byPool.get(key.getPoolId());
            if (keys != null && keys.remove(key)) {
                settler.release(key);
                pruned++;
            }
        }
        for (Iterator<Map.Entry<String, Set<PositionKey>>> it = byPool.entrySet().iterator(); it.hasNext(); ) {
            if (it.next().getValue().isEmpty()) {
                it.remove();
            }
        }
        if (byPool.isEmpty()) {
            index.remove(batch.getOwner());
        }
        if (pruned > 0) {
            log.debug("Pruned {} spent positions of owner {}", pruned, batch.getOwner());
        }
        return pruned;
    }
}
