package com.vaultrebalancer.unit.rebalance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.vaultrebalancer.config.LedgerConfig;
import com.vaultrebalancer.config.RebalanceConfig;
import com.vaultrebalancer.domain.enums.ConfidenceBucket;
import com.vaultrebalancer.domain.enums.RoundTrigger;
import com.vaultrebalancer.domain.enums.TransferDirection;
import com.vaultrebalancer.domain.enums.TransferReason;
import com.vaultrebalancer.domain.enums.TransferStatus;
import com.vaultrebalancer.domain.model.Position;
import com.vaultrebalancer.domain.model.RebalanceRoundResult;
import com.vaultrebalancer.domain.model.RecommendationSet;
import com.vaultrebalancer.domain.model.TransferAction;
import com.vaultrebalancer.domain.model.TransferBatchResult;
import com.vaultrebalancer.event.RebalanceRoundEvent;
import com.vaultrebalancer.exception.LedgerTransportException;
import com.vaultrebalancer.ledger.LedgerClient;
import com.vaultrebalancer.rebalance.AllocationPlanner;
import com.vaultrebalancer.rebalance.RebalanceOrchestrator;
import com.vaultrebalancer.rebalance.Sleeper;
import com.vaultrebalancer.rebalance.TransferExecutor;
import com.vaultrebalancer.recommendation.RecommendationProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Tests for RebalanceOrchestrator: rule precedence in the withdrawal phase, exit thresholds,
 * the settle delay and round failure reporting.
 *
 * <p>Uses a real AllocationPlanner so take-profit targets come from the same barbell math as
 * deposits. Lenient strictness because the shared ledger stubs are not read by every test.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RebalanceOrchestratorTest {

    private static final String WALLET = "0xwallet";
    private static final String RECOMMENDED = "0xrec";
    private static final String OTHER = "0xother";

    @Mock
    private RecommendationProvider recommendationProvider;

    @Mock
    private LedgerClient ledgerClient;

    @Mock
    private TransferExecutor transferExecutor;

    @Mock
    private Sleeper sleeper;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private RebalanceConfig rebalanceConfig;
    private RebalanceOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        rebalanceConfig = new RebalanceConfig();
        LedgerConfig ledgerConfig = new LedgerConfig();
        ledgerConfig.setWallet(WALLET);
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);

        orchestrator = new RebalanceOrchestrator(
                recommendationProvider,
                ledgerClient,
                new AllocationPlanner(rebalanceConfig, clock),
                transferExecutor,
                rebalanceConfig,
                ledgerConfig,
                sleeper,
                applicationEventPublisher,
                clock);

        RecommendationSet recs = AllocationPlannerTest.recommendations(
                List.of(AllocationPlannerTest.rec(RECOMMENDED, ConfidenceBucket.HIGH, "90")),
                List.of(AllocationPlannerTest.rec("0xlow", ConfidenceBucket.LOW, "40")),
                null);
        when(recommendationProvider.getRecommendations(anyBoolean())).thenReturn(recs);
        when(ledgerClient.getAvailableBalance(WALLET)).thenReturn(new BigDecimal("500"));
        when(transferExecutor.withdrawFull(any(), any(), anyBoolean(), anyBoolean()))
                .thenReturn(action(TransferStatus.PREPARED));
        when(transferExecutor.withdrawPartial(any(), any(), anyBoolean(), anyBoolean()))
                .thenReturn(action(TransferStatus.PREPARED));
        when(transferExecutor.executeDeposits(any(), anyBoolean())).thenReturn(TransferBatchResult.empty(true));
    }

    @Nested
    @DisplayName("Withdrawal rules")
    class WithdrawalRules {

        @Test
        @DisplayName("Inactive vault is exited in full even when recommended and in profit")
        void inactiveBeatsEverything() {
            Position dormant = position(RECOMMENDED, "1500", "50", 0, 0);
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(dormant));

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.MANUAL, true, false);

            verify(transferExecutor).withdrawFull(dormant, TransferReason.INACTIVE_VAULT, true, false);
            verify(transferExecutor, never()).withdrawPartial(any(), any(), anyBoolean(), anyBoolean());
            assertThat(result.getInactiveWithdrawals()).hasSize(1);
            assertThat(result.getTpWithdrawals()).isEmpty();
        }

        @Test
        @DisplayName("Inactive non-recommended vault above the exit ROE is exited as inactive")
        void inactiveBeatsNotRecommended() {
            Position dormant = position(OTHER, "800", "5", 0, 0);
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(dormant));

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.MANUAL, true, false);

            verify(transferExecutor).withdrawFull(dormant, TransferReason.INACTIVE_VAULT, true, false);
            verify(transferExecutor, never())
                    .withdrawFull(any(), eq(TransferReason.NOT_RECOMMENDED), anyBoolean(), anyBoolean());
            assertThat(result.getInactiveWithdrawals()).hasSize(1);
            assertThat(result.getWithdrawals()).isEmpty();
        }

        @Test
        @DisplayName("Non-recommended vault below 2% ROE is kept")
        void belowExitThresholdKept() {
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(position(OTHER, "100", "1.9", 2, 5)));

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.MANUAL, true, false);

            verify(transferExecutor, never()).withdrawFull(any(), any(), anyBoolean(), anyBoolean());
            assertThat(result.getWithdrawals()).isEmpty();
        }

        @Test
        @DisplayName("Non-recommended vault at 2% ROE is exited")
        void atExitThresholdWithdrawn() {
            Position position = position(OTHER, "100", "2.0", 2, 5);
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(position));

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.MANUAL, true, false);

            verify(transferExecutor).withdrawFull(position, TransferReason.NOT_RECOMMENDED, true, false);
            assertThat(result.getWithdrawals()).hasSize(1);
        }

        @Test
        @DisplayName("Unknown ROE never triggers an exit")
        void unknownRoeKept() {
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(position(OTHER, "100", null, 2, 5)));

            orchestrator.runRound(RoundTrigger.MANUAL, true, false);

            verify(transferExecutor, never()).withdrawFull(any(), any(), anyBoolean(), anyBoolean());
        }

        @Test
        @DisplayName("A zero exit threshold exits on any positive PnL")
        void zeroThresholdUsesPnl() {
            rebalanceConfig.getExit().setMinExitRoePct(BigDecimal.ZERO);
            Position winner = position(OTHER, "100", "0.5", 2, 5);
            winner.setPnlUsd(new BigDecimal("0.50"));
            Position loser = position("0xloser", "100", "-3", 2, 5);
            loser.setPnlUsd(new BigDecimal("-3"));
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(winner, loser));

            orchestrator.runRound(RoundTrigger.MANUAL, true, false);

            verify(transferExecutor).withdrawFull(winner, TransferReason.NOT_RECOMMENDED, true, false);
            verify(transferExecutor, never()).withdrawFull(eq(loser), any(), anyBoolean(), anyBoolean());
        }

        @Test
        @DisplayName("Recommended vault below take-profit ROE is kept")
        void belowTakeProfitKept() {
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(position(RECOMMENDED, "1500", "9.9", 2, 5)));

            orchestrator.runRound(RoundTrigger.MANUAL, true, false);

            verify(transferExecutor, never()).withdrawPartial(any(), any(), anyBoolean(), anyBoolean());
            verify(transferExecutor, never()).withdrawFull(any(), any(), anyBoolean(), anyBoolean());
        }

        @Test
        @DisplayName("Recommended vault at take-profit ROE is trimmed to its barbell target")
        void takeProfitTrimsToTarget() {
            Position position = position(RECOMMENDED, "1500", "10.0", 2, 5);
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(position));

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.MANUAL, true, false);

            // Total capital 2000, one high vault at 70%
            verify(transferExecutor)
                    .withdrawPartial(
                            eq(position),
                            argThat(target -> target.compareTo(new BigDecimal("1400")) == 0),
                            eq(true),
                            eq(false));
            assertThat(result.getTpWithdrawals()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Settle delay")
    class SettleDelay {

        @Test
        @DisplayName("Waits after a submitted withdrawal before planning deposits")
        void waitsAfterSubmittedWithdrawal() {
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(position(OTHER, "100", "5", 2, 5)));
            when(transferExecutor.withdrawFull(any(), any(), anyBoolean(), anyBoolean()))
                    .thenReturn(action(TransferStatus.SUBMITTED));

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.SCHEDULED, false, true);

            verify(sleeper).sleep(60_000L);
            assertThat(result.isSettleDelayApplied()).isTrue();
        }

        @Test
        @DisplayName("No wait when nothing was submitted")
        void noWaitWithoutSubmission() {
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(position(OTHER, "100", "5", 2, 5)));

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.MANUAL, true, false);

            verify(sleeper, never()).sleep(anyLong());
            assertThat(result.isSettleDelayApplied()).isFalse();
        }
    }

    @Nested
    @DisplayName("Round outcome")
    class RoundOutcome {

        @Test
        @DisplayName("A failed withdrawal does not stop the deposit phase")
        void withdrawalErrorIsolated() {
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of(position(OTHER, "100", "5", 2, 5)));
            when(transferExecutor.withdrawFull(any(), any(), anyBoolean(), anyBoolean()))
                    .thenReturn(action(TransferStatus.ERROR));

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.MANUAL, false, false);

            verify(transferExecutor).executeDeposits(any(), eq(false));
            assertThat(result.getError()).isNull();
            assertThat(result.getPlan()).isNotNull();
        }

        @Test
        @DisplayName("Successful round publishes its result")
        void publishesResult() {
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of());

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.SCHEDULED, true, true);

            ArgumentCaptor<RebalanceRoundEvent> event = ArgumentCaptor.forClass(RebalanceRoundEvent.class);
            verify(applicationEventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().getResult()).isSameAs(result);
            assertThat(result.getRecommended()).containsExactly(RECOMMENDED, "0xlow");
            assertThat(result.getFinishedAt()).isNotNull();
        }

        @Test
        @DisplayName("Ledger failure fails the round, publishes the error and rethrows")
        void ledgerFailurePublishedAndRethrown() {
            when(ledgerClient.getPositions(WALLET))
                    .thenThrow(new LedgerTransportException("info endpoint down", null));

            assertThatThrownBy(() -> orchestrator.runRound(RoundTrigger.SCHEDULED, true, true))
                    .isInstanceOf(LedgerTransportException.class);

            ArgumentCaptor<RebalanceRoundEvent> event = ArgumentCaptor.forClass(RebalanceRoundEvent.class);
            verify(applicationEventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().getResult().getError()).isEqualTo("info endpoint down");
            assertThat(event.getValue().getResult().isFailed()).isTrue();
        }

        @Test
        @DisplayName("Configured dry-run applies when the caller does not choose")
        void usesConfiguredDryRun() {
            rebalanceConfig.setDryRun(false);
            when(ledgerClient.getPositions(WALLET)).thenReturn(List.of());

            RebalanceRoundResult result = orchestrator.runRound(RoundTrigger.SCHEDULED, true);

            assertThat(result.isDryRun()).isFalse();
            verify(transferExecutor).executeDeposits(any(), eq(false));
        }
    }

    private static Position position(String address, String equity, String roe, int openPositions, int trades) {
        return Position.builder()
                .vaultAddress(address)
                .equityUsd(new BigDecimal(equity))
                .roePct(roe != null ? new BigDecimal(roe) : null)
                .pnlUsd(roe != null ? new BigDecimal(roe) : null)
                .activePositionCount(openPositions)
                .tradesLast7d(trades)
                .build();
    }

    private static TransferAction action(TransferStatus status) {
        return TransferAction.builder()
                .direction(TransferDirection.WITHDRAWAL)
                .status(status)
                .build();
    }
}
