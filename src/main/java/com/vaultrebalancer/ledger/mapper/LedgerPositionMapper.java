package com.vaultrebalancer.ledger.mapper;

import com.vaultrebalancer.domain.model.Position;
import com.vaultrebalancer.ledger.dto.ClearinghouseStateDto;
import com.vaultrebalancer.ledger.dto.VaultDetailsDto;
import com.vaultrebalancer.ledger.dto.VaultEquityDto;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Assembles a domain {@link Position} from the three ledger reads that describe one stake:
 * the equity row, the vault details (name, follower PnL) and the vault's own clearinghouse
 * state (open positions).
 *
 * <p>ROE is PnL over the capital basis, {@code pnl / (equity - pnl) * 100}. When the follower
 * state is missing, or the basis is not positive, PnL and ROE stay null and the ROE-gated
 * exit rules leave the position alone. A missing vault state leaves the open-position count
 * unknown, so the position is never treated as inactive.
 */
@Component
public class LedgerPositionMapper {

    static final int ROE_SCALE = 4;

    public Position toDomain(
            VaultEquityDto equity, VaultDetailsDto details, ClearinghouseStateDto vaultState, int tradesLast7d) {
        if (equity == null) {
            return null;
        }

        BigDecimal equityUsd = equity.getEquity() != null ? equity.getEquity() : BigDecimal.ZERO;
        BigDecimal pnl = details != null && details.getFollowerState() != null
                ? details.getFollowerState().getPnl()
                : null;

        return Position.builder()
                .vaultAddress(equity.getVaultAddress())
                .vaultName(details != null ? details.getName() : null)
                .equityUsd(equityUsd)
                .lockedUntil(toLockInstant(equity.getLockedUntilTimestamp()))
                .pnlUsd(pnl)
                .roePct(roePct(equityUsd, pnl))
                .activePositionCount(vaultState != null ? vaultState.countOpenPositions() : null)
                .tradesLast7d(tradesLast7d)
                .build();
    }

    BigDecimal roePct(BigDecimal equityUsd, BigDecimal pnlUsd) {
        if (pnlUsd == null) {
            return null;
        }
        BigDecimal basis = equityUsd.subtract(pnlUsd);
        if (basis.signum() <= 0) {
            return null;
        }
        return pnlUsd.multiply(BigDecimal.valueOf(100)).divide(basis, ROE_SCALE, RoundingMode.HALF_UP);
    }

    private Instant toLockInstant(Long lockedUntilMillis) {
        if (lockedUntilMillis == null || lockedUntilMillis <= 0) {
            return null;
        }
        return Instant.ofEpochMilli(lockedUntilMillis);
    }
}
