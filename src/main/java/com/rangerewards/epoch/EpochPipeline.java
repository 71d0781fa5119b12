package com.rangerewards.epoch;

import com.rangerewards.accumulator.RangeAccumulator;
import com.rangerewards.config.EpochConfig;
import com.rangerewards.distributor.AbstractRewardDistributor;
import com.rangerewards.event.RewardEventType;
import com.rangerewards.exception.BusinessException;
import com.rangerewards.exception.ErrorCode;
import com.rangerewards.exception.ResourceNotFoundException;
import com.rangerewards.exception.UnauthorizedException;
import com.rangerewards.ledger.TokenLedger;
import com.rangerewards.pool.PoolStateProvider;
import java.math.BigInteger;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Single-token reward distributor fed by the fee-buyback integration through
 * {@link #addRewards}. Deposits go through the day-quantized delay of {@link EpochInfo} before
 * they stream to in-range liquidity.
 *
 * <p>Day rolls happen lazily: every operation first calls {@link #rollIfNeeded}, which rotates
 * once per day boundary crossed since the last call. Before each rotation the accumulator is
 * synced up to the boundary with the outgoing rate, so each day's rate is paid over exactly
 * that day.
 */
@Service
public class EpochPipeline extends AbstractRewardDistributor {

    private static final Logger log = LoggerFactory.getLogger(EpochPipeline.class);

    private final EpochConfig epochConfig;
    private final Map<String, EpochInfo> epochs = new HashMap<>();

    public EpochPipeline(
            EpochConfig epochConfig,
            Clock clock,
            PoolStateProvider poolStateProvider,
            TokenLedger tokenLedger,
            ApplicationEventPublisher applicationEventPublisher) {
        super(clock, poolStateProvider, tokenLedger, applicationEventPublisher);
        this.epochConfig = epochConfig;
    }

    @Override
    public String getName() {
        return "epoch-pipeline";
    }

    @Override
    protected String account() {
        return epochConfig.getAccount();
    }

    @Override
    protected List<String> rewardTokens(String poolId) {
        return List.of(epochConfig.getRewardToken());
    }

    @Override
    protected void onPoolCreated(String poolId, long now) {
        epochs.put(poolId, EpochInfo.startingAt(now, epochConfig.getDayLengthSeconds()));
    }

    // ========================
    // DEPOSITS
    // ========================

    /**
     * Schedules {@code amount} of the reward token for {@code poolId}, two day boundaries out,
     * and pulls it from the depositor. Only the configured depositor may call this.
     *
     * @return the day the amount starts streaming
     */
    public synchronized long addRewards(String caller, String poolId, BigInteger amount) {
        if (!epochConfig.getDepositor().equals(caller)) {
            log.warn("Rejected addRewards from {} for pool {}", caller, poolId);
            throw new UnauthorizedException("addRewards", caller);
        }
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Reward amount must be positive");
        }
        return operationGuard.run("addRewards", () -> doAddRewards(caller, poolId, amount));
    }

    private long doAddRewards(String caller, String poolId, BigInteger amount) {
        rollIfNeeded(poolId);
        EpochInfo before = epochs.get(poolId).copy();
        EpochInfo info = epochs.get(poolId);
        long activationDay = info.schedule(amount);

        try {
            tokenLedger.transfer(epochConfig.getRewardToken(), caller, account(), amount);
        } catch (RuntimeException e) {
            epochs.put(poolId, before);
            log.warn("addRewards for pool {} reverted: {}", poolId, e.getMessage());
            throw e;
        }

        log.info(
                "Scheduled {} {} for pool {} on day {} (queuedStreamRate={})",
                amount,
                epochConfig.getRewardToken(),
                poolId,
                activationDay,
                info.getQueuedStreamRate());
        publish(RewardEventType.REWARDS_SCHEDULED, poolId, Map.of(
                "amount", amount,
                "activationDay", activationDay,
                "queuedStreamRate", info.getQueuedStreamRate()));
        return activationDay;
    }

    // ========================
    // ROLL + POKE
    // ========================

    /** Rotates the pool's pipeline across every day boundary passed since the last call. */
    public synchronized void rollIfNeeded(String poolId) {
        RangeAccumulator accumulator = accumulatorFor(poolId);
        roll(poolId, epochs.get(poolId), accumulator, now(), true);
    }

    @Override
    protected void advance(String poolId, RangeAccumulator accumulator, int activeTick, long now, boolean live) {
        EpochInfo info = live ? epochs.get(poolId) : epochs.get(poolId).copy();
        roll(poolId, info, accumulator, now, live);
        accumulator.sync(rewardTokens(poolId), List.of(info.getStreamRate()), activeTick, now);
    }

    private void roll(String poolId, EpochInfo info, RangeAccumulator accumulator, long now, boolean live) {
        List<String> tokens = rewardTokens(poolId);
        int rolled = 0;
        while (info.needsRoll(now)) {
            if (info.isIdle()) {
                // Nothing streams or waits: every remaining rotation is a no-op
                accumulator.sync(tokens, List.of(BigInteger.ZERO), accumulator.getActiveTick(), now);
                info.skipTo(now);
                rolled++;
                break;
            }
            accumulator.sync(
                    tokens, List.of(info.getStreamRate()), accumulator.getActiveTick(), info.getWindowEnd());
            info.roll();
            rolled++;
        }
        if (rolled > 0 && live) {
            log.info(
                    "Pool {} rolled to day {} (streamRate={}, nextStreamRate={}, queuedStreamRate={})",
                    poolId,
                    info.currentDay(),
                    info.getStreamRate(),
                    info.getNextStreamRate(),
                    info.getQueuedStreamRate());
            publish(RewardEventType.EPOCH_ROLLED, poolId, Map.of(
                    "day", info.currentDay(),
                    "streamRate", info.getStreamRate(),
                    "nextStreamRate", info.getNextStreamRate(),
                    "queuedStreamRate", info.getQueuedStreamRate()));
        }
    }

    // ========================
    // READ-ONLY
    // ========================

    /** The pool's pipeline as it would look after rolling to now. Live state is untouched. */
    public synchronized EpochInfo getEpochInfo(String poolId) {
        RangeAccumulator accumulator = accumulators.get(poolId);
        if (accumulator == null) {
            throw new ResourceNotFoundException("Pool", poolId);
        }
        EpochInfo info = epochs.get(poolId).copy();
        roll(poolId, info, accumulator.copy(), now(), false);
        return info;
    }
}
