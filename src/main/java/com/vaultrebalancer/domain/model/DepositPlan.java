package com.vaultrebalancer.domain.model;

import com.vaultrebalancer.domain.enums.ConfidenceBucket;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The deposit plan for a single round, built by
 * {@link com.vaultrebalancer.rebalance.AllocationPlanner}.
 *
 * <p>Invariant: the sum of all target depositUsd never exceeds availableBalanceUsd
 * (within cent rounding). scaleFactor is 1 unless the balance could not cover every target.
 *
 * <p>When a bucket had no selected vaults its share is either moved to the other bucket
 * (reassignedBucket names the bucket that received it) or left unspent and reported in
 * unallocatedUsd.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepositPlan {

    private Instant generatedAt;
    private BigDecimal availableBalanceUsd;
    private BigDecimal currentInvestedUsd;
    private BigDecimal totalCapitalUsd;

    /** Normalized bucket percentages actually applied. */
    private BigDecimal highPct;
    private BigDecimal lowPct;

    private BigDecimal highTargetPerVaultUsd;
    private BigDecimal lowTargetPerVaultUsd;

    private BigDecimal totalAllocationNeededUsd;
    private BigDecimal availableForDepositUsd;
    private BigDecimal scaleFactor;

    private ConfidenceBucket reassignedBucket;

    @Builder.Default
    private BigDecimal unallocatedUsd = BigDecimal.ZERO;

    @Builder.Default
    private List<DepositTarget> targets = new ArrayList<>();

    public BigDecimal getTotalDepositUsd() {
        BigDecimal total = BigDecimal.ZERO;
        if (targets != null) {
            for (DepositTarget target : targets) {
                total = total.add(target.getDepositUsd());
            }
        }
        return total;
    }
}
