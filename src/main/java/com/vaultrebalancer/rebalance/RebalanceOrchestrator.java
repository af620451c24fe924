package com.vaultrebalancer.rebalance;

import com.vaultrebalancer.config.LedgerConfig;
import com.vaultrebalancer.config.RebalanceConfig;
import com.vaultrebalancer.domain.enums.ConfidenceBucket;
import com.vaultrebalancer.domain.enums.RoundTrigger;
import com.vaultrebalancer.domain.enums.TransferReason;
import com.vaultrebalancer.domain.model.DepositPlan;
import com.vaultrebalancer.domain.model.Position;
import com.vaultrebalancer.domain.model.RebalanceRoundResult;
import com.vaultrebalancer.domain.model.RecommendationSet;
import com.vaultrebalancer.domain.model.TransferBatchResult;
import com.vaultrebalancer.event.RebalanceRoundEvent;
import com.vaultrebalancer.ledger.LedgerClient;
import com.vaultrebalancer.recommendation.RecommendationProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs one end-to-end rebalance round.
 *
 * <p>Positions are classified by the first rule that matches, in this order:
 * <ol>
 *   <li><b>Inactive vault</b>: no open positions and no trades in 7 days. Full withdrawal,
 *       whatever the PnL or recommendation status.</li>
 *   <li><b>Take-profit</b>: still recommended, ROE at or above {@code takeProfitRoePct}.
 *       Withdraw the excess above the vault's barbell target.</li>
 *   <li><b>Not recommended</b>: full withdrawal once ROE reaches {@code minExitRoePct}
 *       (or any positive PnL when that threshold is zero or below). Below the threshold the
 *       position is left alone.</li>
 * </ol>
 *
 * <p>If any withdrawal was submitted, the round waits {@code withdrawalSettleDelayMs} so the
 * ledger reflects the freed balance, then re-reads balances, plans and executes deposits.
 *
 * <p>Per-vault failures are recorded on their action and never stop the round. A failure
 * outside the per-vault steps (ledger reads, ranking) aborts the round: the partial result
 * is published with {@code error} set and the exception is rethrown to the caller.
 */
@Service
public class RebalanceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RebalanceOrchestrator.class);

    private final RecommendationProvider recommendationProvider;
    private final LedgerClient ledgerClient;
    private final AllocationPlanner allocationPlanner;
    private final TransferExecutor transferExecutor;
    private final RebalanceConfig rebalanceConfig;
    private final LedgerConfig ledgerConfig;
    private final Sleeper sleeper;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public RebalanceOrchestrator(
            RecommendationProvider recommendationProvider,
            LedgerClient ledgerClient,
            AllocationPlanner allocationPlanner,
            TransferExecutor transferExecutor,
            RebalanceConfig rebalanceConfig,
            LedgerConfig ledgerConfig,
            Sleeper sleeper,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.recommendationProvider = recommendationProvider;
        this.ledgerClient = ledgerClient;
        this.allocationPlanner = allocationPlanner;
        this.transferExecutor = transferExecutor;
        this.rebalanceConfig = rebalanceConfig;
        this.ledgerConfig = ledgerConfig;
        this.sleeper = sleeper;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /**
     * Runs a round with the configured dry-run switch.
     *
     * @param trigger who started the round
     * @param refreshRecommendations bypass the cached ranking
     */
    public RebalanceRoundResult runRound(RoundTrigger trigger, boolean refreshRecommendations) {
        return runRound(trigger, rebalanceConfig.isDryRun(), refreshRecommendations);
    }

    public RebalanceRoundResult runRound(RoundTrigger trigger, boolean dryRun, boolean refreshRecommendations) {
        RebalanceRoundResult result = RebalanceRoundResult.builder()
                .roundId(UUID.randomUUID().toString())
                .trigger(trigger)
                .startedAt(clock.instant())
                .dryRun(dryRun)
                .build();
        log.info("Rebalance round starting: roundId={}, trigger={}, dryRun={}", result.getRoundId(), trigger, dryRun);

        try {
            execute(result, dryRun, refreshRecommendations);
        } catch (RuntimeException e) {
            result.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            result.setFinishedAt(clock.instant());
            log.error("Rebalance round failed: roundId={}, error={}", result.getRoundId(), result.getError());
            applicationEventPublisher.publishEvent(new RebalanceRoundEvent(this, result));
            throw e;
        }

        result.setFinishedAt(clock.instant());
        TransferBatchResult deposits = result.getDeposits();
        log.info(
                "Rebalance round completed: roundId={}, inactiveExits={}, takeProfits={}, exits={}, "
                        + "depositsSubmitted={}, depositErrors={}, dryRun={}",
                result.getRoundId(),
                result.getInactiveWithdrawals().size(),
                result.getTpWithdrawals().size(),
                result.getWithdrawals().size(),
                deposits.getSubmitted(),
                deposits.getErrors(),
                dryRun);
        applicationEventPublisher.publishEvent(new RebalanceRoundEvent(this, result));
        return result;
    }

    /** Builds the deposit plan from fresh reads without moving any funds. */
    public DepositPlan previewPlan(boolean refreshRecommendations) {
        String wallet = ledgerConfig.getWallet();
        RecommendationSet recommendations = recommendationProvider.getRecommendations(refreshRecommendations);
        return allocationPlanner.buildPlan(
                recommendations, ledgerClient.getPositions(wallet), ledgerClient.getAvailableBalance(wallet));
    }

    /** Emergency exit from every held vault, outside the round cadence. */
    public TransferBatchResult withdrawAll(boolean dryRun, boolean includeLocked) {
        List<Position> positions = ledgerClient.getPositions(ledgerConfig.getWallet());
        log.warn(
                "Withdraw-all requested: vaults={}, dryRun={}, includeLocked={}",
                positions.size(),
                dryRun,
                includeLocked);
        return transferExecutor.withdrawAll(positions, dryRun, includeLocked);
    }

    private void execute(RebalanceRoundResult result, boolean dryRun, boolean refreshRecommendations) {
        String wallet = ledgerConfig.getWallet();
        boolean includeLocked = rebalanceConfig.isIncludeLocked();

        RecommendationSet recommendations = recommendationProvider.getRecommendations(refreshRecommendations);
        Set<String> recommended = recommendations.getRecommendedAddresses();
        result.setRecommended(new ArrayList<>(recommended));

        List<Position> positions = ledgerClient.getPositions(wallet);
        BigDecimal availableBalance = ledgerClient.getAvailableBalance(wallet);
        BarbellTargets barbell = allocationPlanner.computeTargets(
                recommendations, availableBalance.add(investedEquity(positions)));

        // Withdrawal phase: first matching rule wins
        for (Position position : positions) {
            String address = RecommendationSet.normalize(position.getVaultAddress());

            if (position.isInactive()) {
                log.info("Inactive vault, exiting: vault={}, equity={}", address, position.getEquityUsd());
                result.getInactiveWithdrawals()
                        .add(transferExecutor.withdrawFull(
                                position, TransferReason.INACTIVE_VAULT, dryRun, includeLocked));
                continue;
            }

            Optional<ConfidenceBucket> bucket = allocationPlanner.bucketOf(recommendations, address);
            if (bucket.isPresent()) {
                if (isTakeProfit(position)) {
                    BigDecimal target = barbell.perVaultTarget(bucket.get());
                    log.info(
                            "Take-profit: vault={}, roe={}, equity={}, target={}",
                            address,
                            position.getRoePct(),
                            position.getEquityUsd(),
                            target);
                    result.getTpWithdrawals()
                            .add(transferExecutor.withdrawPartial(position, target, dryRun, includeLocked));
                }
                continue;
            }

            if (shouldExitNonRecommended(position)) {
                log.info("Exiting non-recommended vault: vault={}, roe={}", address, position.getRoePct());
                result.getWithdrawals()
                        .add(transferExecutor.withdrawFull(
                                position, TransferReason.NOT_RECOMMENDED, dryRun, includeLocked));
            } else {
                log.debug(
                        "Keeping non-recommended vault below exit threshold: vault={}, roe={}, pnl={}",
                        address,
                        position.getRoePct(),
                        position.getPnlUsd());
            }
        }

        long settleDelayMs = rebalanceConfig.getWithdrawalSettleDelayMs();
        if (result.hasSubmittedWithdrawal() && settleDelayMs > 0) {
            log.info("Waiting {} ms for withdrawals to settle", settleDelayMs);
            sleeper.sleep(settleDelayMs);
            result.setSettleDelayApplied(true);
        }

        // Deposit phase on fresh balances
        DepositPlan plan = allocationPlanner.buildPlan(
                recommendations, ledgerClient.getPositions(wallet), ledgerClient.getAvailableBalance(wallet));
        result.setPlan(plan);
        result.setDeposits(transferExecutor.executeDeposits(plan, dryRun));
    }

    boolean isTakeProfit(Position position) {
        BigDecimal roe = position.getRoePct();
        return roe != null && roe.compareTo(rebalanceConfig.getExit().getTakeProfitRoePct()) >= 0;
    }

    /**
     * ROE at or above {@code minExitRoePct}. A threshold of zero or below switches to
     * "any positive PnL".
     */
    boolean shouldExitNonRecommended(Position position) {
        BigDecimal threshold = rebalanceConfig.getExit().getMinExitRoePct();
        if (threshold == null || threshold.signum() <= 0) {
            return position.getPnlUsd() != null && position.getPnlUsd().signum() > 0;
        }
        BigDecimal roe = position.getRoePct();
        return roe != null && roe.compareTo(threshold) >= 0;
    }

    private static BigDecimal investedEquity(List<Position> positions) {
        BigDecimal invested = BigDecimal.ZERO;
        for (Position position : positions) {
            if (position.getEquityUsd() != null && position.getEquityUsd().signum() > 0) {
                invested = invested.add(position.getEquityUsd());
            }
        }
        return invested;
    }
}
