package com.vaultrebalancer.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables of the rebalancing engine, loaded from application.yml.
 *
 * <p>Properties prefix: {@code rebalance.*}. Every value can be overridden from the
 * environment through relaxed binding, e.g. {@code REBALANCE_DRY_RUN=false} or
 * {@code REBALANCE_ALLOCATION_MAX_ACTIVE=8}.
 *
 * <p>Defaults are the production values: a round every 2 days, dry-run on until an operator
 * turns it off, 70/30 barbell across at most 10 vaults.
 */
@Data
@Component
@ConfigurationProperties(prefix = "rebalance")
public class RebalanceConfig {

    public static final long DEFAULT_INTERVAL_MS = Duration.ofDays(2).toMillis();

    private boolean enabled = true;
    private long intervalMs = DEFAULT_INTERVAL_MS;
    private boolean dryRun = true;
    private long withdrawalSettleDelayMs = 60_000;

    /** Withdraw from vaults whose lock-up has not expired yet. The ledger normally refuses. */
    private boolean includeLocked = false;

    private Allocation allocation = new Allocation();
    private Exit exit = new Exit();
    private Transfer transfer = new Transfer();

    @Data
    public static class Allocation {
        private int maxActive = 10;
        private BigDecimal highPct = new BigDecimal("70");
        private BigDecimal lowPct = new BigDecimal("30");

        /** Give an empty bucket's share to the other bucket instead of leaving it unspent. */
        private boolean reassignEmptyBucket = true;

        /** Positions below this equity do not count as held vaults or as existing exposure. */
        private BigDecimal dustThresholdUsd = BigDecimal.ONE;
    }

    @Data
    public static class Exit {
        /** Recommended positions at or above this ROE are trimmed back to their barbell target. */
        private BigDecimal takeProfitRoePct = BigDecimal.TEN;

        /**
         * Non-recommended positions are exited only at or above this ROE.
         * Zero or below switches to "exit on any positive PnL".
         */
        private BigDecimal minExitRoePct = new BigDecimal("2.0");
    }

    @Data
    public static class Transfer {
        private BigDecimal minDepositUsd = new BigDecimal("5");

        /** Withdrawals request equity minus this buffer so rounding never exceeds the balance. */
        private int usdBufferBps = 10;

        /** The retry ladder never submits a withdrawal smaller than this. */
        private BigDecimal minWithdrawalUsd = BigDecimal.ONE;
    }
}
