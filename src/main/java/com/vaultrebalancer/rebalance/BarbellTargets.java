package com.vaultrebalancer.rebalance;

import com.vaultrebalancer.domain.enums.ConfidenceBucket;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Per-vault USD targets of the barbell split for one round.
 *
 * <p>Computed once from the recommendation set and the total capital, and shared by the
 * take-profit rule and the deposit planner so both size vaults identically. Per-vault values
 * are unrounded.
 */
@Value
@Builder
public class BarbellTargets {

    BigDecimal totalCapitalUsd;

    /** Effective bucket percentages after normalisation and empty-bucket handling. */
    BigDecimal highPct;

    BigDecimal lowPct;

    BigDecimal highTargetPerVaultUsd;
    BigDecimal lowTargetPerVaultUsd;

    /** Bucket that had no selected recommendation and gave its share away, if any. */
    ConfidenceBucket reassignedBucket;

    /** Share of an empty bucket that was not reassigned. */
    BigDecimal unallocatedUsd;

    public BigDecimal perVaultTarget(ConfidenceBucket bucket) {
        return bucket == ConfidenceBucket.HIGH ? highTargetPerVaultUsd : lowTargetPerVaultUsd;
    }
}
