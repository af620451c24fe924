package com.vaultrebalancer.rebalance;

import com.vaultrebalancer.config.LedgerConfig;
import com.vaultrebalancer.config.RebalanceConfig;
import com.vaultrebalancer.domain.enums.TransferDirection;
import com.vaultrebalancer.domain.enums.TransferReason;
import com.vaultrebalancer.domain.enums.TransferStatus;
import com.vaultrebalancer.domain.model.DepositPlan;
import com.vaultrebalancer.domain.model.DepositTarget;
import com.vaultrebalancer.domain.model.Position;
import com.vaultrebalancer.domain.model.RecommendationSet;
import com.vaultrebalancer.domain.model.TransferAction;
import com.vaultrebalancer.domain.model.TransferBatchResult;
import com.vaultrebalancer.event.TransferEvent;
import com.vaultrebalancer.exception.InsufficientEquityException;
import com.vaultrebalancer.ledger.LedgerClient;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Executes single deposits and withdrawals against the ledger.
 *
 * <p>Every call ends in exactly one terminal {@link TransferAction}:
 * <ul>
 *   <li>{@code SKIPPED}: never attempted (zero or sub-minimum amount, locked stake, already at
 *       target, nothing deposited)</li>
 *   <li>{@code PREPARED}: dry-run, amount computed but not submitted</li>
 *   <li>{@code SUBMITTED}: the ledger accepted the transfer</li>
 *   <li>{@code ERROR}: the ledger refused, or the retry ladder ran out</li>
 * </ul>
 * No method throws for a ledger failure, so callers can loop over vaults without try/catch.
 *
 * <p>Withdrawals request the equity minus a small buffer ({@code usdBufferBps}) so rounding
 * never asks for more than the vault holds. When the ledger still answers "insufficient
 * equity", the withdrawal is retried at 95, 90, 85, 80, 75, 70, 60 and 50 percent of the
 * original amount, stopping at the first success, the first other error, or when the next
 * amount would fall below {@code minWithdrawalUsd}. Deposits are submitted once.
 */
@Service
public class TransferExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransferExecutor.class);

    /** Fractions of the original withdrawal tried after an insufficient-equity rejection, in percent. */
    static final int[] WITHDRAWAL_RETRY_PERCENTAGES = {95, 90, 85, 80, 75, 70, 60, 50};

    static final BigDecimal MICROS_PER_USD = BigDecimal.valueOf(1_000_000);
    private static final BigDecimal BPS_DENOMINATOR = BigDecimal.valueOf(10_000);

    private final LedgerClient ledgerClient;
    private final RebalanceConfig rebalanceConfig;
    private final LedgerConfig ledgerConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public TransferExecutor(
            LedgerClient ledgerClient,
            RebalanceConfig rebalanceConfig,
            LedgerConfig ledgerConfig,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.ledgerClient = ledgerClient;
        this.rebalanceConfig = rebalanceConfig;
        this.ledgerConfig = ledgerConfig;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    // ---- Deposits ----

    /**
     * Deposits {@code amountUsd} into a vault. Amounts that are zero or below
     * {@code minDepositUsd} are skipped without calling the ledger.
     */
    public TransferAction deposit(String vaultAddress, BigDecimal amountUsd, boolean dryRun) {
        BigDecimal amount = amountUsd != null ? amountUsd : BigDecimal.ZERO;
        long usdMicros = toMicros(amount);

        TransferAction.TransferActionBuilder action = TransferAction.builder()
                .vaultAddress(vaultAddress)
                .direction(TransferDirection.DEPOSIT)
                .usdMicros(usdMicros)
                .reason(TransferReason.PLANNED_DEPOSIT);

        if (usdMicros <= 0) {
            return finish(action.status(TransferStatus.SKIPPED).reason(TransferReason.ZERO_AMOUNT), dryRun);
        }
        if (amount.compareTo(rebalanceConfig.getTransfer().getMinDepositUsd()) < 0) {
            log.debug("Deposit below minimum skipped: vault={}, usd={}", vaultAddress, amount);
            return finish(action.status(TransferStatus.SKIPPED).reason(TransferReason.BELOW_MINIMUM), dryRun);
        }
        if (dryRun) {
            log.info("[dry-run] Deposit prepared: vault={}, usd={}", vaultAddress, amount);
            return finish(action.status(TransferStatus.PREPARED), dryRun);
        }

        try {
            ledgerClient.transfer(vaultAddress, true, usdMicros);
            log.info("Deposit submitted: vault={}, usd={}", vaultAddress, amount);
            return finish(action.status(TransferStatus.SUBMITTED).attempts(1), dryRun);
        } catch (RuntimeException e) {
            log.warn("Deposit failed: vault={}, usd={}, error={}", vaultAddress, amount, e.getMessage());
            return finish(action.status(TransferStatus.ERROR).error(e.getMessage()).attempts(1), dryRun);
        }
    }

    /** Executes every target of the plan in order. One failed deposit never stops the rest. */
    public TransferBatchResult executeDeposits(DepositPlan plan, boolean dryRun) {
        TransferBatchResult result = TransferBatchResult.empty(dryRun);
        for (DepositTarget target : plan.getTargets()) {
            result.record(deposit(target.getVaultAddress(), target.getDepositUsd(), dryRun));
        }
        log.info(
                "Deposits done: total={}, submitted={}, skipped={}, errors={}, dryRun={}",
                result.getTotal(),
                result.getSubmitted(),
                result.getSkipped(),
                result.getErrors(),
                dryRun);
        return result;
    }

    // ---- Withdrawals ----

    /** Withdraws everything held in the position's vault (minus the rounding buffer). */
    public TransferAction withdrawFull(
            Position position, TransferReason reason, boolean dryRun, boolean includeLocked) {
        TransferAction.TransferActionBuilder action = withdrawal(position, reason);
        if (position.isLockedAt(clock.instant()) && !includeLocked) {
            log.info(
                    "Withdrawal skipped, vault locked: vault={}, until={}",
                    position.getVaultAddress(),
                    position.getLockedUntil());
            return finish(action.status(TransferStatus.SKIPPED).reason(TransferReason.LOCKED), dryRun);
        }
        return submitWithdrawal(action, position.getVaultAddress(), position.getEquityUsd(), dryRun);
    }

    /**
     * Withdraws the part of the position above {@code targetUsd}. Positions at or below
     * target are skipped.
     */
    public TransferAction withdrawPartial(
            Position position, BigDecimal targetUsd, boolean dryRun, boolean includeLocked) {
        TransferAction.TransferActionBuilder action = withdrawal(position, TransferReason.TAKE_PROFIT);
        if (position.isLockedAt(clock.instant()) && !includeLocked) {
            return finish(action.status(TransferStatus.SKIPPED).reason(TransferReason.LOCKED), dryRun);
        }
        BigDecimal equity = position.getEquityUsd() != null ? position.getEquityUsd() : BigDecimal.ZERO;
        BigDecimal target = targetUsd != null && targetUsd.signum() > 0 ? targetUsd : BigDecimal.ZERO;
        if (equity.compareTo(target) <= 0) {
            return finish(action.status(TransferStatus.SKIPPED).reason(TransferReason.ALREADY_AT_TARGET), dryRun);
        }
        return submitWithdrawal(action, position.getVaultAddress(), equity.subtract(target), dryRun);
    }

    /**
     * Withdraws everything from one vault, looked up by address on a fresh position read.
     * Returns {@code SKIPPED/not-deposited} when the account holds nothing there.
     */
    public TransferAction withdrawFromVault(String vaultAddress, boolean dryRun, boolean includeLocked) {
        String wanted = RecommendationSet.normalize(vaultAddress);
        return ledgerClient.getPositions(ledgerConfig.getWallet()).stream()
                .filter(p -> RecommendationSet.normalize(p.getVaultAddress()).equals(wanted))
                .filter(p -> p.getEquityUsd() != null && p.getEquityUsd().signum() > 0)
                .findFirst()
                .map(p -> withdrawFull(p, TransferReason.WITHDRAW_ALL, dryRun, includeLocked))
                .orElseGet(() -> finish(
                        TransferAction.builder()
                                .vaultAddress(vaultAddress)
                                .direction(TransferDirection.WITHDRAWAL)
                                .status(TransferStatus.SKIPPED)
                                .reason(TransferReason.NOT_DEPOSITED),
                        dryRun));
    }

    /** Emergency exit: full withdrawal from every vault with equity. */
    public TransferBatchResult withdrawAll(List<Position> positions, boolean dryRun, boolean includeLocked) {
        TransferBatchResult result = TransferBatchResult.empty(dryRun);
        for (Position position : positions) {
            if (position.getEquityUsd() == null || position.getEquityUsd().signum() <= 0) {
                continue;
            }
            result.record(withdrawFull(position, TransferReason.WITHDRAW_ALL, dryRun, includeLocked));
        }
        log.info(
                "Withdraw-all done: total={}, submitted={}, skipped={}, errors={}, dryRun={}",
                result.getTotal(),
                result.getSubmitted(),
                result.getSkipped(),
                result.getErrors(),
                dryRun);
        return result;
    }

    private TransferAction submitWithdrawal(
            TransferAction.TransferActionBuilder action, String vaultAddress, BigDecimal amountUsd, boolean dryRun) {
        long usdMicros = bufferedMicros(amountUsd);
        action.usdMicros(usdMicros);
        if (usdMicros <= 0) {
            return finish(action.status(TransferStatus.SKIPPED).reason(TransferReason.ZERO_AMOUNT), dryRun);
        }
        if (dryRun) {
            log.info("[dry-run] Withdrawal prepared: vault={}, usdMicros={}", vaultAddress, usdMicros);
            return finish(action.status(TransferStatus.PREPARED), dryRun);
        }
        return finish(withdrawWithRetry(action, vaultAddress, usdMicros), dryRun);
    }

    /**
     * Submits the withdrawal, walking down the retry ladder on insufficient-equity rejections.
     * Attempted amounts are strictly decreasing and never below the configured floor.
     */
    TransferAction.TransferActionBuilder withdrawWithRetry(
            TransferAction.TransferActionBuilder action, String vaultAddress, long originalMicros) {
        long floorMicros = toMicros(rebalanceConfig.getTransfer().getMinWithdrawalUsd());
        long amount = originalMicros;
        int attempts = 0;
        int rung = 0;

        while (true) {
            attempts++;
            try {
                ledgerClient.transfer(vaultAddress, false, amount);
                log.info(
                        "Withdrawal submitted: vault={}, usdMicros={}, attempts={}", vaultAddress, amount, attempts);
                return action.status(TransferStatus.SUBMITTED).usdMicros(amount).attempts(attempts);
            } catch (InsufficientEquityException e) {
                // Rungs that round to the current amount or above are skipped
                long next = -1;
                while (rung < WITHDRAWAL_RETRY_PERCENTAGES.length) {
                    long candidate = originalMicros * WITHDRAWAL_RETRY_PERCENTAGES[rung++] / 100;
                    if (candidate < amount) {
                        next = candidate;
                        break;
                    }
                }
                if (next < 0 || next < floorMicros) {
                    log.warn(
                            "Withdrawal retry ladder exhausted: vault={}, lastUsdMicros={}, attempts={}",
                            vaultAddress,
                            amount,
                            attempts);
                    return action.status(TransferStatus.ERROR)
                            .usdMicros(amount)
                            .error(e.getMessage())
                            .attempts(attempts);
                }
                log.info(
                        "Insufficient equity, retrying smaller withdrawal: vault={}, usdMicros={} -> {}",
                        vaultAddress,
                        amount,
                        next);
                amount = next;
            } catch (RuntimeException e) {
                log.warn(
                        "Withdrawal failed: vault={}, usdMicros={}, error={}", vaultAddress, amount, e.getMessage());
                return action.status(TransferStatus.ERROR)
                        .usdMicros(amount)
                        .error(e.getMessage())
                        .attempts(attempts);
            }
        }
    }

    // ---- Amounts ----

    /**
     * Micro-USD to request for {@code amountUsd}, minus the safety buffer. Falls back to the
     * unbuffered amount when the buffer would round it to zero.
     */
    long bufferedMicros(BigDecimal amountUsd) {
        if (amountUsd == null || amountUsd.signum() <= 0) {
            return 0;
        }
        BigDecimal keep = BigDecimal.ONE.subtract(
                BigDecimal.valueOf(rebalanceConfig.getTransfer().getUsdBufferBps()).divide(BPS_DENOMINATOR));
        long buffered = toMicros(amountUsd.multiply(keep));
        return buffered > 0 ? buffered : toMicros(amountUsd);
    }

    static long toMicros(BigDecimal usd) {
        if (usd == null || usd.signum() <= 0) {
            return 0;
        }
        return usd.multiply(MICROS_PER_USD).setScale(0, RoundingMode.FLOOR).longValueExact();
    }

    // ---- Helpers ----

    private static TransferAction.TransferActionBuilder withdrawal(Position position, TransferReason reason) {
        return TransferAction.builder()
                .vaultAddress(position.getVaultAddress())
                .direction(TransferDirection.WITHDRAWAL)
                .equityUsd(position.getEquityUsd())
                .lockedUntil(position.getLockedUntil())
                .reason(reason);
    }

    private TransferAction finish(TransferAction.TransferActionBuilder builder, boolean dryRun) {
        TransferAction action = builder.build();
        applicationEventPublisher.publishEvent(new TransferEvent(this, action, dryRun));
        return action;
    }
}
