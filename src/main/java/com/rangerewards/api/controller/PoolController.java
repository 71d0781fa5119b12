package com.rangerewards.api.controller;

import com.rangerewards.api.dto.request.PoolActivityRequest;
import com.rangerewards.api.dto.request.PoolRegistrationRequest;
import com.rangerewards.api.dto.request.PositionRequest;
import com.rangerewards.api.dto.response.PositionResponse;
import com.rangerewards.distributor.SubscriptionRouter;
import com.rangerewards.domain.PositionKey;
import com.rangerewards.exception.BusinessException;
import com.rangerewards.exception.ErrorCode;
import com.rangerewards.mapper.RewardDtoMapper;
import com.rangerewards.pool.InMemoryPoolRegistry;
import com.rangerewards.pool.PoolEvent;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound side of the pool manager and position manager integrations.
 *
 * <ul>
 *   <li>POST /api/pools -- register a pool</li>
 *   <li>POST /api/pools/{poolId}/activity -- swap / liquidity notification with the new tick</li>
 *   <li>POST /api/pools/positions/subscribe | unsubscribe | modify | burn -- position callbacks</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/pools")
public class PoolController {

    private final InMemoryPoolRegistry poolRegistry;
    private final SubscriptionRouter subscriptionRouter;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final RewardDtoMapper rewardDtoMapper = Mappers.getMapper(RewardDtoMapper.class);

    public PoolController(
            InMemoryPoolRegistry poolRegistry,
            SubscriptionRouter subscriptionRouter,
            ApplicationEventPublisher applicationEventPublisher) {
        this.poolRegistry = poolRegistry;
        this.subscriptionRouter = subscriptionRouter;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> registerPool(@Valid @RequestBody PoolRegistrationRequest request) {
        poolRegistry.registerPool(request.getPoolId(), request.getTickSpacing(), request.getActiveTick());
        return ResponseEntity.ok(Map.of(
                "poolId", request.getPoolId(),
                "tickSpacing", request.getTickSpacing(),
                "activeTick", request.getActiveTick()));
    }

    @PostMapping("/{poolId}/activity")
    public ResponseEntity<Map<String, Object>> reportActivity(
            @PathVariable String poolId, @Valid @RequestBody PoolActivityRequest request) {
        applicationEventPublisher.publishEvent(
                new PoolEvent(this, poolId, request.getEventType(), request.getActiveTick()));
        return ResponseEntity.ok(Map.of("poolId", poolId, "activeTick", request.getActiveTick()));
    }

    @PostMapping("/positions/subscribe")
    public ResponseEntity<PositionResponse> subscribe(@Valid @RequestBody PositionRequest request) {
        PositionKey key = request.toKey();
        subscriptionRouter.subscribe(key, requireLiquidity(request));
        return ResponseEntity.ok(rewardDtoMapper.toResponse(key));
    }

    @PostMapping("/positions/modify")
    public ResponseEntity<PositionResponse> modifyLiquidity(@Valid @RequestBody PositionRequest request) {
        PositionKey key = request.toKey();
        subscriptionRouter.modifyLiquidity(key, requireLiquidity(request));
        return ResponseEntity.ok(rewardDtoMapper.toResponse(key));
    }

    @PostMapping("/positions/unsubscribe")
    public ResponseEntity<PositionResponse> unsubscribe(@Valid @RequestBody PositionRequest request) {
        PositionKey key = request.toKey();
        subscriptionRouter.unsubscribe(key);
        return ResponseEntity.ok(rewardDtoMapper.toResponse(key));
    }

    @PostMapping("/positions/burn")
    public ResponseEntity<PositionResponse> burn(@Valid @RequestBody PositionRequest request) {
        PositionKey key = request.toKey();
        subscriptionRouter.burn(key);
        return ResponseEntity.ok(rewardDtoMapper.toResponse(key));
    }

    private static BigInteger requireLiquidity(PositionRequest request) {
        if (request.getLiquidity() == null) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "liquidity is required");
        }
        return request.getLiquidity();
    }
}
