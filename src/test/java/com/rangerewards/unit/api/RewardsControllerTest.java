package com.rangerewards.unit.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.rangerewards.api.controller.RewardsController;
import com.rangerewards.config.ApiResponseAdvice;
import com.rangerewards.distributor.RewardDistributor;
import com.rangerewards.domain.PositionKey;
import com.rangerewards.exception.GlobalExceptionHandler;
import com.rangerewards.exception.OperationInProgressException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for RewardsController: pending queries, claims with caller checks and pokes,
 * routed by distributor name.
 */
@ExtendWith(MockitoExtension.class)
class RewardsControllerTest {

    @Mock
    private RewardDistributor epochPipeline;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        when(epochPipeline.getName()).thenReturn("epoch-pipeline");
        RewardsController rewardsController = new RewardsController(List.of(epochPipeline));
        mockMvc = MockMvcBuilders.standaloneSetup(rewardsController)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    // ========================
    // PENDING
    // ========================

    @Nested
    @DisplayName("Pending rewards")
    class Pending {

        @Test
        @DisplayName("GET owner pending returns per-token totals")
        void ownerPending() throws Exception {
            when(epochPipeline.pendingRewardsOwner("alice")).thenReturn(Map.of("REWARD", BigInteger.valueOf(1_500)));

            mockMvc.perform(get("/api/rewards/epoch-pipeline/owners/alice/pending"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.REWARD").value(1_500));
        }

        @Test
        @DisplayName("POST position pending resolves the position key from the body")
        void positionPending() throws Exception {
            PositionKey key = PositionKey.of("alice", "pool-1", -60, 60, null);
            when(epochPipeline.pendingRewards(key)).thenReturn(Map.of("REWARD", BigInteger.TEN));

            mockMvc.perform(post("/api/rewards/epoch-pipeline/positions/pending")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"owner": "alice", "poolId": "pool-1", "tickLower": -60, "tickUpper": 60}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.REWARD").value(10));
        }

        @Test
        @DisplayName("Unknown distributor returns 404")
        void unknownDistributor() throws Exception {
            mockMvc.perform(get("/api/rewards/nope/owners/alice/pending"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
        }
    }

    // ========================
    // CLAIM
    // ========================

    @Nested
    @DisplayName("POST /api/rewards/{distributor}/owners/{owner}/claim")
    class Claim {

        @Test
        @DisplayName("Claims every pool when no pool list is given")
        void claimAll() throws Exception {
            when(epochPipeline.claimAllForOwner("alice", "alice-wallet"))
                    .thenReturn(Map.of("REWARD", BigInteger.valueOf(700)));

            mockMvc.perform(post("/api/rewards/epoch-pipeline/owners/alice/claim")
                            .header("X-Caller", "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"recipient": "alice-wallet"}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.REWARD").value(700));
        }

        @Test
        @DisplayName("Claims only the listed pools")
        void claimPools() throws Exception {
            when(epochPipeline.claim("alice", List.of("pool-1"), "alice-wallet"))
                    .thenReturn(Map.of("REWARD", BigInteger.valueOf(300)));

            mockMvc.perform(post("/api/rewards/epoch-pipeline/owners/alice/claim")
                            .header("X-Caller", "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"recipient": "alice-wallet", "poolIds": ["pool-1"]}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.REWARD").value(300));
        }

        @Test
        @DisplayName("Claiming for someone else is unauthorized")
        void otherOwner() throws Exception {
            mockMvc.perform(post("/api/rewards/epoch-pipeline/owners/alice/claim")
                            .header("X-Caller", "mallory")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"recipient": "mallory-wallet"}
                                    """))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));

            verify(epochPipeline, never()).claimAllForOwner(anyString(), anyString());
        }

        @Test
        @DisplayName("Missing recipient fails validation")
        void missingRecipient() throws Exception {
            mockMvc.perform(post("/api/rewards/epoch-pipeline/owners/alice/claim")
                            .header("X-Caller", "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("Concurrent claim maps to 409")
        void inProgress() throws Exception {
            when(epochPipeline.claimAllForOwner(any(), any())).thenThrow(new OperationInProgressException("claim"));

            mockMvc.perform(post("/api/rewards/epoch-pipeline/owners/alice/claim")
                            .header("X-Caller", "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"recipient": "alice-wallet"}
                                    """))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("OPERATION_IN_PROGRESS"));
        }
    }

    @Test
    @DisplayName("POST poke brings the pool up to date")
    void poke() throws Exception {
        mockMvc.perform(post("/api/rewards/epoch-pipeline/pools/pool-1/poke"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.poked").value(true));

        verify(epochPipeline).pokePool("pool-1");
    }
}
