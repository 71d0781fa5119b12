package com.rangerewards.api.controller;

import com.rangerewards.api.dto.request.RewardDepositRequest;
import com.rangerewards.api.dto.response.EpochInfoResponse;
import com.rangerewards.epoch.EpochPipeline;
import com.rangerewards.mapper.RewardDtoMapper;
import jakarta.validation.Valid;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Daily pipeline endpoints.
 *
 * <ul>
 *   <li>POST /api/epoch/rewards -- schedule a reward bucket (depositor only)</li>
 *   <li>POST /api/epoch/pools/{poolId}/roll -- roll the pipeline across passed day boundaries</li>
 *   <li>GET /api/epoch/pools/{poolId} -- pipeline state as of now</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/epoch")
public class EpochController {

    private final EpochPipeline epochPipeline;
    private final RewardDtoMapper rewardDtoMapper = Mappers.getMapper(RewardDtoMapper.class);

    public EpochController(EpochPipeline epochPipeline) {
        this.epochPipeline = epochPipeline;
    }

    @PostMapping("/rewards")
    public ResponseEntity<Map<String, Object>> addRewards(
            @RequestHeader("X-Caller") String caller, @Valid @RequestBody RewardDepositRequest request) {
        long activationDay = epochPipeline.addRewards(caller, request.getPoolId(), request.getAmount());
        return ResponseEntity.ok(Map.of(
                "poolId", request.getPoolId(), "amount", request.getAmount(), "activationDay", activationDay));
    }

    @PostMapping("/pools/{poolId}/roll")
    public ResponseEntity<EpochInfoResponse> rollIfNeeded(@PathVariable String poolId) {
        epochPipeline.rollIfNeeded(poolId);
        return ResponseEntity.ok(rewardDtoMapper.toResponse(poolId, epochPipeline.getEpochInfo(poolId)));
    }

    @GetMapping("/pools/{poolId}")
    public ResponseEntity<EpochInfoResponse> getEpochInfo(@PathVariable String poolId) {
        return ResponseEntity.ok(rewardDtoMapper.toResponse(poolId, epochPipeline.getEpochInfo(poolId)));
    }
}
