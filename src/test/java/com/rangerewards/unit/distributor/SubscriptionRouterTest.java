package com.rangerewards.unit.distributor;

import static org.mockito.Mockito.inOrder;

import com.rangerewards.distributor.PositionSubscriber;
import com.rangerewards.distributor.SubscriptionRouter;
import com.rangerewards.domain.PositionKey;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubscriptionRouterTest {

    private static final PositionKey KEY = PositionKey.of("alice", "pool-1", -60, 60, null);

    @Mock
    private PositionSubscriber epochSubscriber;

    @Mock
    private PositionSubscriber incentiveSubscriber;

    private SubscriptionRouter subscriptionRouter;

    @BeforeEach
    void setUp() {
        subscriptionRouter = new SubscriptionRouter(List.of(epochSubscriber, incentiveSubscriber));
    }

    @Test
    @DisplayName("Every callback reaches every subscriber in order")
    void fansOut() {
        subscriptionRouter.subscribe(KEY, BigInteger.TEN);
        subscriptionRouter.modifyLiquidity(KEY, BigInteger.valueOf(-5));
        subscriptionRouter.unsubscribe(KEY);
        subscriptionRouter.burn(KEY);

        InOrder order = inOrder(epochSubscriber, incentiveSubscriber);
        order.verify(epochSubscriber).notifySubscribe(KEY, BigInteger.TEN);
        order.verify(incentiveSubscriber).notifySubscribe(KEY, BigInteger.TEN);
        order.verify(epochSubscriber).notifyModifyLiquidity(KEY, BigInteger.valueOf(-5));
        order.verify(incentiveSubscriber).notifyModifyLiquidity(KEY, BigInteger.valueOf(-5));
        order.verify(epochSubscriber).notifyUnsubscribe(KEY);
        order.verify(incentiveSubscriber).notifyUnsubscribe(KEY);
        order.verify(epochSubscriber).notifyBurn(KEY);
        order.verify(incentiveSubscriber).notifyBurn(KEY);
    }
}
