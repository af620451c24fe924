package com.vaultrebalancer.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A vault the account currently holds equity in.
 *
 * <p>Read from the ledger at the start of a round and treated as a read-only snapshot
 * for the rest of it. Activity fields (activePositionCount, tradesLast7d) describe the
 * vault's own trading, not the account's, and drive the inactive-vault exit rule.
 *
 * <p>pnlUsd and roePct may be null when the ledger could not report follower performance;
 * rules gated on ROE then leave the position alone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String vaultAddress;
    private String vaultName;

    /** Current USD value held in the vault. */
    private BigDecimal equityUsd;

    /** Withdrawals are refused by the ledger before this instant. Null = never locked. */
    private Instant lockedUntil;

    private BigDecimal pnlUsd;

    /** Unrealized PnL over capital basis, as a percentage. */
    private BigDecimal roePct;

    /** Number of open positions the vault itself currently holds. Null when not observed. */
    private Integer activePositionCount;

    /** Fills executed by the vault over the last 7 days. */
    private int tradesLast7d;

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    /** Zero observed activity. An unknown position count never counts as inactive. */
    public boolean isInactive() {
        return activePositionCount != null && activePositionCount == 0 && tradesLast7d == 0;
    }
}
