package com.rangerewards.distributor;

import com.rangerewards.accrual.PositionAccrual;
import com.rangerewards.accumulator.RangeAccumulator;
import com.rangerewards.claim.ClaimAggregator;
import com.rangerewards.claim.ClaimBatch;
import com.rangerewards.claim.PositionSettler;
import com.rangerewards.domain.PositionKey;
import com.rangerewards.event.RewardEvent;
import com.rangerewards.event.RewardEventType;
import com.rangerewards.exception.BusinessException;
import com.rangerewards.exception.ErrorCode;
import com.rangerewards.exception.InsufficientRewardBalanceException;
import com.rangerewards.exception.ResourceNotFoundException;
import com.rangerewards.ledger.TokenLedger;
import com.rangerewards.math.LiquidityMath;
import com.rangerewards.pool.PoolStateProvider;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Common machinery of the reward distributors: per-pool {@link RangeAccumulator}s, per-position
 * {@link PositionAccrual}s, the owner index, position callbacks and the claim flow.
 *
 * <p>Subclasses decide which tokens a pool streams and at what rate, by implementing
 * {@link #advance}: bring a pool's schedule and its accumulator up to a timestamp.
 *
 * <p><b>Execution model:</b> public operations are {@code synchronized}, so each distributor
 * runs one operation at a time. Token transfers are the only points where external code runs;
 * all internal state is committed before them and rolled back if they fail. Claim and deposit
 * paths are additionally wrapped in an {@link OperationGuard}, so a token callback that
 * re-enters them fails with {@link com.rangerewards.exception.OperationInProgressException}.
 */
public abstract class AbstractRewardDistributor implements RewardDistributor, PositionSubscriber, PositionSettler {

    private static final Logger log = LoggerFactory.getLogger(AbstractRewardDistributor.class);

    protected final Clock clock;
    protected final PoolStateProvider poolStateProvider;
    protected final TokenLedger tokenLedger;
    protected final ApplicationEventPublisher applicationEventPublisher;

    protected final OperationGuard operationGuard = new OperationGuard();
    protected final ClaimAggregator claimAggregator = new ClaimAggregator();
    protected final Map<String, RangeAccumulator> accumulators = new HashMap<>();
    protected final Map<PositionKey, PositionAccrual> positions = new HashMap<>();

    protected AbstractRewardDistributor(
            Clock clock,
            PoolStateProvider poolStateProvider,
            TokenLedger tokenLedger,
            ApplicationEventPublisher applicationEventPublisher) {
        this.clock = clock;
        this.poolStateProvider = poolStateProvider;
        this.tokenLedger = tokenLedger;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // ABSTRACT METHODS
    // ========================

    /** Ledger account holding this distributor's reward balances. */
    protected abstract String account();

    /** Reward tokens the pool accrues, in a stable order. */
    protected abstract List<String> rewardTokens(String poolId);

    /** Creates the subclass's schedule state for a pool seen for the first time. */
    protected abstract void onPoolCreated(String poolId, long now);

    /**
     * Brings the pool's schedule and {@code accumulator} up to {@code now}, ending with a sync
     * at {@code activeTick}.
     *
     * @param live when false, {@code accumulator} is a copy and the subclass must work on a copy
     *     of its own schedule state too, publishing nothing
     */
    protected abstract void advance(
            String poolId, RangeAccumulator accumulator, int activeTick, long now, boolean live);

    // ========================
    // POKE
    // ========================

    @Override
    public synchronized boolean isTracking(String poolId) {
        return accumulators.containsKey(poolId);
    }

    @Override
    public synchronized void pokePool(String poolId) {
        RangeAccumulator accumulator = accumulatorFor(poolId);
        advance(poolId, accumulator, poolStateProvider.getActiveTick(poolId), now(), true);
    }

    protected RangeAccumulator accumulatorFor(String poolId) {
        RangeAccumulator accumulator = accumulators.get(poolId);
        if (accumulator == null) {
            long now = now();
            accumulator = new RangeAccumulator(
                    poolId, poolStateProvider.getTickSpacing(poolId), poolStateProvider.getActiveTick(poolId), now);
            accumulators.put(poolId, accumulator);
            onPoolCreated(poolId, now);
            log.info("{}: tracking pool {} from t={}", getName(), poolId, now);
        }
        return accumulator;
    }

    protected long now() {
        return clock.instant().getEpochSecond();
    }

    // ========================
    // POSITION CALLBACKS
    // ========================

    @Override
    public synchronized void notifySubscribe(PositionKey key, BigInteger liquidity) {
        if (liquidity.signum() < 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Subscribed liquidity must not be negative");
        }
        pokePool(key.getPoolId());
        PositionAccrual position = positions.computeIfAbsent(key, PositionAccrual::new);
        applyLiquidityChange(position, liquidity);
        claimAggregator.track(key);
        log.debug("{}: position {} subscribed with liquidity {}", getName(), key.getId(), liquidity);
    }

    @Override
    public synchronized void notifyModifyLiquidity(PositionKey key, BigInteger liquidityDelta) {
        pokePool(key.getPoolId());
        PositionAccrual position = positions.get(key);
        if (position == null) {
            if (liquidityDelta.signum() <= 0) {
                throw new ResourceNotFoundException("Position", key.getId());
            }
            position = new PositionAccrual(key);
            positions.put(key, position);
        }
        applyLiquidityChange(position, liquidityDelta);
        claimAggregator.track(key);
    }

    @Override
    public synchronized void notifyUnsubscribe(PositionKey key) {
        withdrawAll(key);
        log.debug("{}: position {} unsubscribed", getName(), key.getId());
    }

    @Override
    public synchronized void notifyBurn(PositionKey key) {
        withdrawAll(key);
        log.debug("{}: position {} burned", getName(), key.getId());
    }

    /** Removes the whole liquidity of a position; its accrued balance stays until claimed. */
    private void withdrawAll(PositionKey key) {
        pokePool(key.getPoolId());
        PositionAccrual position = requirePosition(key);
        applyLiquidityChange(position, position.getLiquidity().negate());
    }

    /**
     * Accrues the position at its current liquidity and applies the delta to both the position
     * and the pool's accumulator. New ticks are initialised before reading the range value, and
     * the range value is read before ticks can be cleared.
     */
    private void applyLiquidityChange(PositionAccrual position, BigInteger liquidityDelta) {
        PositionKey key = position.getKey();
        RangeAccumulator accumulator = accumulatorFor(key.getPoolId());
        BigInteger liquidityAfter = LiquidityMath.addDelta(position.getLiquidity(), liquidityDelta);

        if (liquidityDelta.signum() > 0) {
            accumulator.modifyLiquidity(key.getTickLower(), key.getTickUpper(), liquidityDelta);
            accrueAll(accumulator, position);
        } else {
            accrueAll(accumulator, position);
            accumulator.modifyLiquidity(key.getTickLower(), key.getTickUpper(), liquidityDelta);
        }
        position.setLiquidity(liquidityAfter);
    }

    protected void accrueAll(RangeAccumulator accumulator, PositionAccrual position) {
        for (String token : rewardTokens(position.getKey().getPoolId())) {
            position.accrue(token, accumulator.rangeValue(token, position.getTickLower(), position.getTickUpper()));
        }
    }

    // ========================
    // CLAIM
    // ========================

    @Override
    public synchronized Map<String, BigInteger> claim(String owner, Collection<String> poolIds, String recipient) {
        return operationGuard.run("claim", () -> doClaim(owner, new ArrayList<>(poolIds), recipient));
    }

    @Override
    public synchronized Map<String, BigInteger> claimAllForOwner(String owner, String recipient) {
        return claim(owner, new ArrayList<>(claimAggregator.pools(owner)), recipient);
    }

    private Map<String, BigInteger> doClaim(String owner, List<String> poolIds, String recipient) {
        for (String poolId : poolIds) {
            if (accumulators.containsKey(poolId)) {
                pokePool(poolId);
            }
        }

        ClaimBatch batch = claimAggregator.collect(owner, poolIds, this);
        Map<String, BigInteger> totals = batch.getTotals();

        for (Map.Entry<String, BigInteger> entry : totals.entrySet()) {
            BigInteger available = tokenLedger.balanceOf(entry.getKey(), account());
            if (entry.getValue().compareTo(available) > 0) {
                claimAggregator.restore(batch, this);
                log.error(
                        "{}: claim by {} needs {} {} but only {} is held",
                        getName(),
                        owner,
                        entry.getValue(),
                        entry.getKey(),
                        available);
                throw new InsufficientRewardBalanceException(entry.getKey(), entry.getValue(), available);
            }
        }

        payOut(batch, recipient);

        int pruned = claimAggregator.prune(batch, this);
        if (!batch.isEmpty()) {
            log.info("{}: {} claimed {} to {} ({} positions pruned)", getName(), owner, totals, recipient, pruned);
            publish(RewardEventType.REWARDS_CLAIMED, null, Map.of(
                    "owner", owner, "recipient", recipient, "amounts", new LinkedHashMap<>(totals)));
        }
        return new LinkedHashMap<>(totals);
    }

    /**
     * Transfers every token total. If any transfer fails, the ones already made are pulled back
     * one by one and the settled balances restored. A token whose pull-back also fails stays
     * with the recipient and is not re-credited, since it has been paid.
     */
    private void payOut(ClaimBatch batch, String recipient) {
        List<Map.Entry<String, BigInteger>> paid = new ArrayList<>();
        try {
            for (Map.Entry<String, BigInteger> entry : batch.getTotals().entrySet()) {
                if (entry.getValue().signum() == 0) {
                    continue;
                }
                tokenLedger.transfer(entry.getKey(), account(), recipient, entry.getValue());
                paid.add(entry);
            }
        } catch (RuntimeException e) {
            Set<String> delivered = new LinkedHashSet<>();
            for (Map.Entry<String, BigInteger> entry : paid) {
                try {
                    tokenLedger.transfer(entry.getKey(), recipient, account(), entry.getValue());
                } catch (RuntimeException pullBackFailure) {
                    delivered.add(entry.getKey());
                    log.error(
                            "{}: could not pull back {} {} from {}, keeping it as paid: {}",
                            getName(),
                            entry.getValue(),
                            entry.getKey(),
                            recipient,
                            pullBackFailure.getMessage());
                }
            }
            claimAggregator.restore(batch, this, delivered);
            log.warn("{}: claim by {} reverted: {}", getName(), batch.getOwner(), e.getMessage());
            throw e;
        }
    }

    // ========================
    // POSITION SETTLER (driven by ClaimAggregator)
    // ========================

    @Override
    public Map<String, BigInteger> settle(PositionKey key) {
        PositionAccrual position = positions.get(key);
        if (position == null) {
            return Map.of();
        }
        accrueAll(accumulatorFor(key.getPoolId()), position);
        Map<String, BigInteger> amounts = new LinkedHashMap<>();
        for (String token : new ArrayList<>(position.getRewardsAccrued().keySet())) {
            BigInteger amount = position.claim(token);
            if (amount.signum() > 0) {
                amounts.put(token, amount);
            }
        }
        return amounts;
    }

    @Override
    public void restore(PositionKey key, Map<String, BigInteger> amounts) {
        PositionAccrual position = positions.get(key);
        if (position != null) {
            amounts.forEach(position::restore);
        }
    }

    @Override
    public boolean isSpent(PositionKey key) {
        PositionAccrual position = positions.get(key);
        return position == null || position.isSpent();
    }

    @Override
    public void release(PositionKey key) {
        positions.remove(key);
    }

    // ========================
    // READ-ONLY PROJECTIONS
    // ========================

    @Override
    public synchronized Map<String, BigInteger> pendingRewards(PositionKey key) {
        PositionAccrual position = requirePosition(key);
        RangeAccumulator projected = project(key.getPoolId());
        return projectPosition(projected, position);
    }

    @Override
    public synchronized Map<String, BigInteger> pendingRewardsOwner(String owner) {
        Map<String, BigInteger> totals = new LinkedHashMap<>();
        for (String poolId : claimAggregator.pools(owner)) {
            RangeAccumulator projected = project(poolId);
            for (PositionKey key : claimAggregator.positions(owner, poolId)) {
                PositionAccrual position = positions.get(key);
                if (position != null) {
                    projectPosition(projected, position)
                            .forEach((token, amount) -> totals.merge(token, amount, BigInteger::add));
                }
            }
        }
        return totals;
    }

    private Map<String, BigInteger> projectPosition(RangeAccumulator projected, PositionAccrual position) {
        PositionAccrual copy = position.copy();
        accrueAll(projected, copy);
        Map<String, BigInteger> pending = new LinkedHashMap<>();
        for (String token : rewardTokens(position.getKey().getPoolId())) {
            pending.put(token, copy.accrued(token));
        }
        copy.getRewardsAccrued().forEach(pending::putIfAbsent);
        return pending;
    }

    /** Copy of the pool's accumulator advanced to now, leaving live state untouched. */
    protected RangeAccumulator project(String poolId) {
        RangeAccumulator accumulator = accumulators.get(poolId);
        if (accumulator == null) {
            throw new ResourceNotFoundException("Pool", poolId);
        }
        RangeAccumulator copy = accumulator.copy();
        advance(poolId, copy, poolStateProvider.getActiveTick(poolId), now(), false);
        return copy;
    }

    public synchronized Optional<PositionAccrual> getPosition(PositionKey key) {
        return Optional.ofNullable(positions.get(key)).map(PositionAccrual::copy);
    }

    public synchronized Optional<RangeAccumulator> getAccumulator(String poolId) {
        return Optional.ofNullable(accumulators.get(poolId)).map(RangeAccumulator::copy);
    }

    public synchronized List<PositionKey> getOwnerPositions(String owner) {
        return claimAggregator.positions(owner);
    }

    protected PositionAccrual requirePosition(PositionKey key) {
        PositionAccrual position = positions.get(key);
        if (position == null) {
            throw new ResourceNotFoundException("Position", key.getId());
        }
        return position;
    }

    protected void publish(RewardEventType eventType, String poolId, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RewardEvent(this, eventType, poolId, details));
    }
}
