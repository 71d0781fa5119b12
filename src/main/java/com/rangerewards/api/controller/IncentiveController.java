package com.rangerewards.api.controller;

import com.rangerewards.api.dto.request.RewardDepositRequest;
import com.rangerewards.api.dto.response.IncentiveStreamResponse;
import com.rangerewards.exception.BusinessException;
import com.rangerewards.exception.ErrorCode;
import com.rangerewards.incentive.IncentiveStream;
import com.rangerewards.incentive.MultiStreamLedger;
import com.rangerewards.mapper.RewardDtoMapper;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Incentive administration and stream queries.
 *
 * <ul>
 *   <li>GET /api/incentives/whitelist -- whitelisted reward tokens</li>
 *   <li>POST /api/incentives/whitelist/{token} -- whitelist a token (admin)</li>
 *   <li>DELETE /api/incentives/whitelist/{token} -- remove a token (admin)</li>
 *   <li>POST /api/incentives/streams -- create or extend a stream (admin)</li>
 *   <li>GET /api/incentives/pools/{poolId}/streams -- streams of a pool as of now</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/incentives")
public class IncentiveController {

    private final MultiStreamLedger multiStreamLedger;
    private final RewardDtoMapper rewardDtoMapper = Mappers.getMapper(RewardDtoMapper.class);

    public IncentiveController(MultiStreamLedger multiStreamLedger) {
        this.multiStreamLedger = multiStreamLedger;
    }

    @GetMapping("/whitelist")
    public ResponseEntity<Set<String>> getWhitelist() {
        return ResponseEntity.ok(multiStreamLedger.getWhitelist());
    }

    @PostMapping("/whitelist/{token}")
    public ResponseEntity<Set<String>> whitelistToken(
            @RequestHeader("X-Caller") String caller, @PathVariable String token) {
        multiStreamLedger.whitelistToken(caller, token);
        return ResponseEntity.ok(multiStreamLedger.getWhitelist());
    }

    @DeleteMapping("/whitelist/{token}")
    public ResponseEntity<Set<String>> removeFromWhitelist(
            @RequestHeader("X-Caller") String caller, @PathVariable String token) {
        multiStreamLedger.removeFromWhitelist(caller, token);
        return ResponseEntity.ok(multiStreamLedger.getWhitelist());
    }

    @PostMapping("/streams")
    public ResponseEntity<IncentiveStreamResponse> createIncentive(
            @RequestHeader("X-Caller") String caller, @Valid @RequestBody RewardDepositRequest request) {
        if (request.getToken() == null || request.getToken().isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Incentive token is required");
        }
        IncentiveStream stream = multiStreamLedger.createIncentive(
                caller, request.getPoolId(), request.getToken(), request.getAmount());
        return ResponseEntity.ok(rewardDtoMapper.toResponse(stream));
    }

    @GetMapping("/pools/{poolId}/streams")
    public ResponseEntity<List<IncentiveStreamResponse>> getStreams(@PathVariable String poolId) {
        return ResponseEntity.ok(rewardDtoMapper.toStreamResponseList(
                multiStreamLedger.getStreams(poolId).values()));
    }
}
