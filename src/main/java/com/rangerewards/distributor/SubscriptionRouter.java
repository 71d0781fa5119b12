package com.rangerewards.distributor;

import com.rangerewards.domain.PositionKey;
import java.math.BigInteger;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the position manager adapter. Forwards each position callback to every
 * registered {@link PositionSubscriber}, in bean order.
 */
@Service
public class SubscriptionRouter {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRouter.class);

    private final List<PositionSubscriber> positionSubscribers;

    public SubscriptionRouter(List<PositionSubscriber> positionSubscribers) {
        this.positionSubscribers = positionSubscribers;
    }

    public void subscribe(PositionKey key, BigInteger liquidity) {
        log.info(
                "Subscribe {} ({} [{}, {})) liquidity={}",
                key.getId(),
                key.getPoolId(),
                key.getTickLower(),
                key.getTickUpper(),
                liquidity);
        positionSubscribers.forEach(subscriber -> subscriber.notifySubscribe(key, liquidity));
    }

    public void unsubscribe(PositionKey key) {
        log.info("Unsubscribe {}", key.getId());
        positionSubscribers.forEach(subscriber -> subscriber.notifyUnsubscribe(key));
    }

    public void modifyLiquidity(PositionKey key, BigInteger liquidityDelta) {
        log.info("Modify liquidity {} by {}", key.getId(), liquidityDelta);
        positionSubscribers.forEach(subscriber -> subscriber.notifyModifyLiquidity(key, liquidityDelta));
    }

    public void burn(PositionKey key) {
        log.info("Burn {}", key.getId());
        positionSubscribers.forEach(subscriber -> subscriber.notifyBurn(key));
    }
}
