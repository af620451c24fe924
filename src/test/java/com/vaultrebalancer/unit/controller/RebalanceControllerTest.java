package com.vaultrebalancer.unit.controller;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vaultrebalancer.api.controller.RebalanceController;
import com.vaultrebalancer.config.ApiResponseAdvice;
import com.vaultrebalancer.config.RebalanceConfig;
import com.vaultrebalancer.domain.enums.RoundTrigger;
import com.vaultrebalancer.domain.enums.TransferDirection;
import com.vaultrebalancer.domain.enums.TransferReason;
import com.vaultrebalancer.domain.enums.TransferStatus;
import com.vaultrebalancer.domain.model.DepositPlan;
import com.vaultrebalancer.domain.model.RebalanceRoundResult;
import com.vaultrebalancer.domain.model.TransferAction;
import com.vaultrebalancer.domain.model.TransferBatchResult;
import com.vaultrebalancer.exception.GlobalExceptionHandler;
import com.vaultrebalancer.exception.RoundInProgressException;
import com.vaultrebalancer.observability.RoundHistoryService;
import com.vaultrebalancer.rebalance.RebalanceOrchestrator;
import com.vaultrebalancer.rebalance.RebalanceScheduler;
import com.vaultrebalancer.rebalance.TransferExecutor;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
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
 * Tests for RebalanceController: response envelope, manual runs, plan preview and the
 * confirmation guard on withdrawals.
 */
@ExtendWith(MockitoExtension.class)
class RebalanceControllerTest {

    private MockMvc mockMvc;

    @Mock
    private RebalanceScheduler rebalanceScheduler;

    @Mock
    private RebalanceOrchestrator rebalanceOrchestrator;

    @Mock
    private TransferExecutor transferExecutor;

    @Mock
    private RoundHistoryService roundHistoryService;

    private RebalanceConfig rebalanceConfig;

    @BeforeEach
    void setUp() {
        rebalanceConfig = new RebalanceConfig();
        RebalanceController controller = new RebalanceController(
                rebalanceScheduler, rebalanceOrchestrator, transferExecutor, roundHistoryService, rebalanceConfig);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Nested
    @DisplayName("Read endpoints")
    class ReadEndpoints {

        @Test
        @DisplayName("GET /status reports scheduler state and the last round")
        void statusEndpoint() throws Exception {
            when(roundHistoryService.getLast())
                    .thenReturn(Optional.of(RebalanceRoundResult.builder()
                            .roundId("r-last")
                            .error("ledger down")
                            .build()));
            when(rebalanceScheduler.isStarted()).thenReturn(true);
            when(rebalanceScheduler.isRunning()).thenReturn(false);
            when(rebalanceScheduler.getNextRunAt()).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/rebalance/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.started").value(true))
                    .andExpect(jsonPath("$.data.dryRun").value(true))
                    .andExpect(jsonPath("$.data.lastRoundId").value("r-last"))
                    .andExpect(jsonPath("$.data.lastRoundError").value("ledger down"));
        }

        @Test
        @DisplayName("GET /rounds returns recent rounds")
        void rounds() throws Exception {
            when(roundHistoryService.getRecent(5))
                    .thenReturn(List.of(round("r2"), round("r1")));

            mockMvc.perform(get("/api/rebalance/rounds").param("limit", "5"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.length()").value(2))
                    .andExpect(jsonPath("$.data[0].roundId").value("r2"));
        }

        @Test
        @DisplayName("GET /rounds/{id} for an unknown round is 404")
        void unknownRound() throws Exception {
            when(roundHistoryService.findById("nope")).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/rebalance/rounds/nope"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("GET /plan previews the plan with the cached ranking")
        void plan() throws Exception {
            when(rebalanceOrchestrator.previewPlan(false))
                    .thenReturn(DepositPlan.builder()
                            .totalCapitalUsd(new BigDecimal("600"))
                            .build());

            mockMvc.perform(get("/api/rebalance/plan"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.totalCapitalUsd").value(600));
        }
    }

    @Nested
    @DisplayName("Manual run")
    class ManualRun {

        @Test
        @DisplayName("POST /run without a body uses the configured dry-run and a fresh ranking")
        void runWithDefaults() throws Exception {
            when(rebalanceScheduler.runManual(true, true)).thenReturn(round("r-manual"));

            mockMvc.perform(post("/api/rebalance/run"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.roundId").value("r-manual"));
        }

        @Test
        @DisplayName("POST /run honours an explicit live run")
        void runLive() throws Exception {
            when(rebalanceScheduler.runManual(false, false)).thenReturn(round("r-live"));

            mockMvc.perform(post("/api/rebalance/run")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"dryRun":false,"refreshRecommendations":false}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.roundId").value("r-live"));
        }

        @Test
        @DisplayName("POST /run while a round is running is 409")
        void runConflict() throws Exception {
            when(rebalanceScheduler.runManual(anyBoolean(), anyBoolean())).thenThrow(new RoundInProgressException());

            mockMvc.perform(post("/api/rebalance/run"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("ROUND_IN_PROGRESS"));
        }
    }

    @Nested
    @DisplayName("Withdrawals")
    class Withdrawals {

        @Test
        @DisplayName("POST /withdraw-all without CONFIRM is rejected")
        void withdrawAllNeedsConfirmation() throws Exception {
            mockMvc.perform(post("/api/rebalance/withdraw-all")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"confirm":"yes","dryRun":false}
                            """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));

            verify(rebalanceOrchestrator, never()).withdrawAll(anyBoolean(), anyBoolean());
        }

        @Test
        @DisplayName("POST /withdraw-all with a blank confirmation fails validation")
        void withdrawAllBlankConfirmation() throws Exception {
            mockMvc.perform(post("/api/rebalance/withdraw-all")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("POST /withdraw-all defaults to dry-run")
        void withdrawAllDefaultsToDryRun() throws Exception {
            when(rebalanceOrchestrator.withdrawAll(true, false)).thenReturn(TransferBatchResult.empty(true));

            mockMvc.perform(post("/api/rebalance/withdraw-all")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"confirm":"CONFIRM"}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.dryRun").value(true));
        }

        @Test
        @DisplayName("POST /vaults/{address}/withdraw exits a single vault")
        void withdrawSingleVault() throws Exception {
            when(transferExecutor.withdrawFromVault("0xabc", false, false))
                    .thenReturn(TransferAction.builder()
                            .vaultAddress("0xabc")
                            .direction(TransferDirection.WITHDRAWAL)
                            .status(TransferStatus.SUBMITTED)
                            .reason(TransferReason.WITHDRAW_ALL)
                            .usdMicros(99_900_000L)
                            .build());

            mockMvc.perform(post("/api/rebalance/vaults/0xabc/withdraw")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"confirm":"CONFIRM","dryRun":false}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("SUBMITTED"))
                    .andExpect(jsonPath("$.data.reason").value("withdraw-all"));
        }
    }

    private static RebalanceRoundResult round(String id) {
        return RebalanceRoundResult.builder()
                .roundId(id)
                .trigger(RoundTrigger.MANUAL)
                .dryRun(true)
                .build();
    }
}
