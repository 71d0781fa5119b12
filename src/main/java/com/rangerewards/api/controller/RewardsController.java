package com.rangerewards.api.controller;

import com.rangerewards.api.dto.request.ClaimRequest;
import com.rangerewards.api.dto.request.PositionRequest;
import com.rangerewards.distributor.RewardDistributor;
import com.rangerewards.exception.ResourceNotFoundException;
import com.rangerewards.exception.UnauthorizedException;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Token-holder endpoints shared by every distributor, addressed by distributor name
 * ({@code epoch-pipeline}, {@code incentive-ledger}).
 *
 * <ul>
 *   <li>GET /api/rewards/{distributor}/owners/{owner}/pending -- pending rewards of all positions</li>
 *   <li>POST /api/rewards/{distributor}/positions/pending -- pending rewards of one position</li>
 *   <li>POST /api/rewards/{distributor}/owners/{owner}/claim -- claim (caller must be the owner)</li>
 *   <li>POST /api/rewards/{distributor}/pools/{poolId}/poke -- bring a pool up to date</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/rewards")
public class RewardsController {

    private static final Logger log = LoggerFactory.getLogger(RewardsController.class);

    private final Map<String, RewardDistributor> distributorsByName = new LinkedHashMap<>();

    public RewardsController(List<RewardDistributor> rewardDistributors) {
        rewardDistributors.forEach(distributor -> distributorsByName.put(distributor.getName(), distributor));
    }

    @GetMapping("/{distributor}/owners/{owner}/pending")
    public ResponseEntity<Map<String, BigInteger>> getPendingRewards(
            @PathVariable String distributor, @PathVariable String owner) {
        return ResponseEntity.ok(resolve(distributor).pendingRewardsOwner(owner));
    }

    @PostMapping("/{distributor}/positions/pending")
    public ResponseEntity<Map<String, BigInteger>> getPositionPendingRewards(
            @PathVariable String distributor, @Valid @RequestBody PositionRequest request) {
        return ResponseEntity.ok(resolve(distributor).pendingRewards(request.toKey()));
    }

    @PostMapping("/{distributor}/owners/{owner}/claim")
    public ResponseEntity<Map<String, BigInteger>> claim(
            @PathVariable String distributor,
            @PathVariable String owner,
            @RequestHeader("X-Caller") String caller,
            @Valid @RequestBody ClaimRequest request) {
        if (!owner.equals(caller)) {
            throw new UnauthorizedException("claim for " + owner, caller);
        }
        RewardDistributor rewardDistributor = resolve(distributor);
        Map<String, BigInteger> claimed = request.getPoolIds() == null || request.getPoolIds().isEmpty()
                ? rewardDistributor.claimAllForOwner(owner, request.getRecipient())
                : rewardDistributor.claim(owner, request.getPoolIds(), request.getRecipient());
        log.info("Claim via API on {} for {}: {}", distributor, owner, claimed);
        return ResponseEntity.ok(claimed);
    }

    @PostMapping("/{distributor}/pools/{poolId}/poke")
    public ResponseEntity<Map<String, Object>> pokePool(@PathVariable String distributor, @PathVariable String poolId) {
        resolve(distributor).pokePool(poolId);
        return ResponseEntity.ok(Map.of("poolId", poolId, "distributor", distributor, "poked", true));
    }

    private RewardDistributor resolve(String name) {
        RewardDistributor distributor = distributorsByName.get(name);
        if (distributor == null) {
            throw new ResourceNotFoundException("Distributor", name);
        }
        return distributor;
    }
}
