package com.rangerewards.incentive;

import com.rangerewards.accumulator.RangeAccumulator;
import com.rangerewards.config.IncentiveConfig;
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Multi-token reward distributor: each whitelisted token streams into a pool at a constant
 * rate for a fixed duration, independently of the other tokens.
 *
 * <p>Streams end at arbitrary instants between pokes. A poke therefore syncs the accumulator
 * in segments: one segment up to each finish timestamp passed since the last sync, carrying
 * the rates of the streams still running in it, then a last segment up to now that also moves
 * the active tick.
 */
@Service
public class MultiStreamLedger extends AbstractRewardDistributor {

    private static final Logger log = LoggerFactory.getLogger(MultiStreamLedger.class);

    private final IncentiveConfig incentiveConfig;
    private final Set<String> whitelist = new LinkedHashSet<>();
    private final Map<String, Map<String, IncentiveStream>> streams = new HashMap<>();

    public MultiStreamLedger(
            IncentiveConfig incentiveConfig,
            Clock clock,
            PoolStateProvider poolStateProvider,
            TokenLedger tokenLedger,
            ApplicationEventPublisher applicationEventPublisher) {
        super(clock, poolStateProvider, tokenLedger, applicationEventPublisher);
        this.incentiveConfig = incentiveConfig;
    }

    @Override
    public String getName() {
        return "incentive-ledger";
    }

    @Override
    protected String account() {
        return incentiveConfig.getAccount();
    }

    @Override
    protected List<String> rewardTokens(String poolId) {
        Map<String, IncentiveStream> poolStreams = streams.get(poolId);
        return poolStreams != null ? new ArrayList<>(poolStreams.keySet()) : List.of();
    }

    @Override
    protected void onPoolCreated(String poolId, long now) {
        streams.put(poolId, new LinkedHashMap<>());
    }

    // ========================
    // WHITELIST
    // ========================

    public synchronized void whitelistToken(String caller, String token) {
        requireAdmin("whitelistToken", caller);
        if (whitelist.add(token)) {
            log.info("Whitelisted reward token {}", token);
            publish(RewardEventType.WHITELIST_UPDATED, null, Map.of("token", token, "whitelisted", true));
        }
    }

    /** Running streams of a removed token keep streaming until they finish. */
    public synchronized void removeFromWhitelist(String caller, String token) {
        requireAdmin("removeFromWhitelist", caller);
        if (whitelist.remove(token)) {
            log.info("Removed reward token {} from whitelist", token);
            publish(RewardEventType.WHITELIST_UPDATED, null, Map.of("token", token, "whitelisted", false));
        }
    }

    public synchronized boolean isWhitelisted(String token) {
        return whitelist.contains(token);
    }

    public synchronized Set<String> getWhitelist() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(whitelist));
    }

    // ========================
    // INCENTIVES
    // ========================

    /**
     * Funds a stream of {@code token} into {@code poolId}: a fresh one when none runs, else an
     * extension of the running one. Pulls {@code amount} from the caller.
     */
    public synchronized IncentiveStream createIncentive(String caller, String poolId, String token, BigInteger amount) {
        requireAdmin("createIncentive", caller);
        if (!whitelist.contains(token)) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "Token is not whitelisted", Map.of("token", token));
        }
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Incentive amount must be positive");
        }
        return operationGuard.run("createIncentive", () -> doCreateIncentive(caller, poolId, token, amount));
    }

    private IncentiveStream doCreateIncentive(String caller, String poolId, String token, BigInteger amount) {
        pokePool(poolId);
        long now = now();
        Map<String, IncentiveStream> poolStreams = streams.get(poolId);

        IncentiveStream existing = poolStreams.get(token);
        // Finished streams stay listed for accrual but no longer take a slot
        long running = poolStreams.values().stream().filter(stream -> stream.isActive(now)).count();
        if (existing == null && running >= incentiveConfig.getMaxTokensPerPool()) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Pool already streams the maximum number of reward tokens",
                    Map.of("poolId", poolId, "maxTokensPerPool", incentiveConfig.getMaxTokensPerPool()));
        }

        IncentiveStream stream = existing != null ? existing.copy() : new IncentiveStream(token);
        boolean extended = stream.fund(amount, now, incentiveConfig.getDurationSeconds());
        if (stream.getRatePerSecond().signum() == 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Incentive amount is too small to stream over the configured duration",
                    Map.of("amount", amount, "durationSeconds", incentiveConfig.getDurationSeconds()));
        }

        poolStreams.put(token, stream);
        try {
            tokenLedger.transfer(token, caller, account(), amount);
        } catch (RuntimeException e) {
            if (existing != null) {
                poolStreams.put(token, existing);
            } else {
                poolStreams.remove(token);
            }
            log.warn("createIncentive {} for pool {} reverted: {}", token, poolId, e.getMessage());
            throw e;
        }

        log.info(
                "{} incentive {} for pool {}: remaining={}, rate={}/s, finish={}",
                extended ? "Extended" : "Created",
                token,
                poolId,
                stream.getRemainingAmount(),
                stream.getRatePerSecond(),
                stream.getFinishTimestamp());
        publish(extended ? RewardEventType.INCENTIVE_EXTENDED : RewardEventType.INCENTIVE_CREATED, poolId, Map.of(
                "token", token,
                "amount", amount,
                "remainingAmount", stream.getRemainingAmount(),
                "ratePerSecond", stream.getRatePerSecond(),
                "finishTimestamp", stream.getFinishTimestamp()));
        return stream.copy();
    }

    // ========================
    // POKE
    // ========================

    @Override
    protected void advance(String poolId, RangeAccumulator accumulator, int activeTick, long now, boolean live) {
        Map<String, IncentiveStream> poolStreams = live ? streams.get(poolId) : copyOf(streams.get(poolId));
        List<String> tokens = new ArrayList<>(poolStreams.keySet());

        TreeSet<Long> segmentEnds = new TreeSet<>();
        long from = accumulator.getLastSyncTimestamp();
        for (IncentiveStream stream : poolStreams.values()) {
            long finish = stream.getFinishTimestamp();
            if (finish > from && finish <= now && stream.getRatePerSecond().signum() > 0) {
                segmentEnds.add(finish);
            }
        }
        for (long segmentEnd : segmentEnds) {
            List<BigInteger> segmentRates = rates(tokens, poolStreams, stream -> stream.rateUntil(segmentEnd));
            accumulator.sync(tokens, segmentRates, accumulator.getActiveTick(), segmentEnd);
        }
        List<BigInteger> currentRates =
                rates(tokens, poolStreams, stream -> stream.isActive(now) ? stream.getRatePerSecond() : BigInteger.ZERO);
        accumulator.sync(tokens, currentRates, activeTick, now);

        for (IncentiveStream stream : poolStreams.values()) {
            boolean finished = stream.advanceTo(now);
            if (finished && live) {
                log.info(
                        "Incentive {} for pool {} finished with {} undistributed",
                        stream.getToken(),
                        poolId,
                        stream.getRemainingAmount());
                publish(RewardEventType.STREAM_FINISHED, poolId, Map.of(
                        "token", stream.getToken(), "remainingAmount", stream.getRemainingAmount()));
            }
        }
    }

    private static List<BigInteger> rates(
            List<String> tokens,
            Map<String, IncentiveStream> poolStreams,
            Function<IncentiveStream, BigInteger> rateOf) {
        List<BigInteger> rates = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            rates.add(rateOf.apply(poolStreams.get(token)));
        }
        return rates;
    }

    private static Map<String, IncentiveStream> copyOf(Map<String, IncentiveStream> poolStreams) {
        Map<String, IncentiveStream> copy = new LinkedHashMap<>();
        poolStreams.forEach((token, stream) -> copy.put(token, stream.copy()));
        return copy;
    }

    // ========================
    // READ-ONLY
    // ========================

    /** Streams of the pool as they would look after a poke now. Live state is untouched. */
    public synchronized Map<String, IncentiveStream> getStreams(String poolId) {
        RangeAccumulator accumulator = accumulators.get(poolId);
        if (accumulator == null) {
            throw new ResourceNotFoundException("Pool", poolId);
        }
        Map<String, IncentiveStream> projected = copyOf(streams.get(poolId));
        long now = now();
        projected.values().forEach(stream -> stream.advanceTo(now));
        return projected;
    }

    private void requireAdmin(String operation, String caller) {
        if (!incentiveConfig.getAdmin().equals(caller)) {
            log.warn("Rejected {} from {}", operation, caller);
            throw new UnauthorizedException(operation, caller);
        }
    }
}
