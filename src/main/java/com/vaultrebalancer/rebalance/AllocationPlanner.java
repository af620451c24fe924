package com.vaultrebalancer.rebalance;

import com.vaultrebalancer.config.RebalanceConfig;
import com.vaultrebalancer.domain.enums.ConfidenceBucket;
import com.vaultrebalancer.domain.model.DepositPlan;
import com.vaultrebalancer.domain.model.DepositTarget;
import com.vaultrebalancer.domain.model.Position;
import com.vaultrebalancer.domain.model.Recommendation;
import com.vaultrebalancer.domain.model.RecommendationSet;
import com.vaultrebalancer.domain.model.SuggestedAllocations;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a recommendation set and the account's balances into a {@link DepositPlan} using
 * barbell weighting.
 *
 * <p>Planning steps:
 * <ol>
 *   <li>Select up to {@code maxActive} recommendations, high bucket first (capped by the
 *       suggested high count), then low with the remaining slots (capped by the suggested low
 *       count). Each bucket is ranked by score, best first.</li>
 *   <li>Drop recommendations the account already holds non-dust equity in.</li>
 *   <li>Fit what remains into {@code maxActive - heldVaults} free slots, high first.</li>
 *   <li>Per-vault target = total capital x bucket pct / 100 / full bucket size. Total capital
 *       is the available balance plus invested equity.</li>
 *   <li>If the available balance cannot cover every selected target, all targets shrink by the
 *       same ratio.</li>
 * </ol>
 *
 * <p>A bucket with no selected recommendation in step 1 is "empty". Its share either moves to
 * the other bucket ({@code reassignEmptyBucket=true}) or is reported as
 * {@link DepositPlan#getUnallocatedUsd()}.
 *
 * <p>The planner is pure: it reads nothing from the ledger and never applies the minimum
 * deposit. Sub-minimum targets are skipped later by {@link TransferExecutor}.
 */
@Service
public class AllocationPlanner {

    private static final Logger log = LoggerFactory.getLogger(AllocationPlanner.class);

    static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final BigDecimal FALLBACK_HIGH_PCT = BigDecimal.valueOf(70);
    static final BigDecimal FALLBACK_LOW_PCT = BigDecimal.valueOf(30);

    /** Working precision for unrounded per-vault amounts. */
    private static final int WORK_SCALE = 10;

    private static final int USD_SCALE = 2;
    private static final int PCT_SCALE = 4;
    private static final int RATIO_SCALE = 6;

    private static final Comparator<Recommendation> BY_SCORE_DESC = Comparator.comparing(
            Recommendation::getScore, Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()));

    private final RebalanceConfig rebalanceConfig;
    private final Clock clock;

    public AllocationPlanner(RebalanceConfig rebalanceConfig, Clock clock) {
        this.rebalanceConfig = rebalanceConfig;
        this.clock = clock;
    }

    /**
     * Builds the deposit plan for the current round.
     *
     * @param recommendations ranking for this round
     * @param positions fresh ledger positions (after the withdrawal phase)
     * @param availableBalanceUsd USD the wallet can deposit right now
     */
    public DepositPlan buildPlan(
            RecommendationSet recommendations, List<Position> positions, BigDecimal availableBalanceUsd) {
        BigDecimal available = nonNegative(availableBalanceUsd);
        BigDecimal dust = rebalanceConfig.getAllocation().getDustThresholdUsd();

        BigDecimal invested = BigDecimal.ZERO;
        Set<String> heldVaults = new HashSet<>();
        for (Position position : positions) {
            BigDecimal equity = nonNegative(position.getEquityUsd());
            invested = invested.add(equity);
            if (equity.compareTo(dust) >= 0) {
                heldVaults.add(RecommendationSet.normalize(position.getVaultAddress()));
            }
        }
        BigDecimal totalCapital = available.add(invested);

        Selection selection = select(recommendations);
        BarbellTargets barbell = computeTargets(recommendations, selection, totalCapital);

        // Step 2: no new deposits where the account already has exposure
        List<Recommendation> highCandidates = withoutExposure(selection.high(), heldVaults);
        List<Recommendation> lowCandidates = withoutExposure(selection.low(), heldVaults);
        int skippedForExposure = selection.high().size() - highCandidates.size()
                + selection.low().size() - lowCandidates.size();
        if (skippedForExposure > 0) {
            log.info("Skipping {} recommended vaults with existing exposure", skippedForExposure);
        }

        // Step 3: fit into free slots, high bucket first
        int availableSlots = Math.max(0, rebalanceConfig.getAllocation().getMaxActive() - heldVaults.size());
        int newHigh = Math.min(highCandidates.size(), availableSlots);
        int newLow = Math.min(lowCandidates.size(), availableSlots - newHigh);
        List<Recommendation> highSelected = highCandidates.subList(0, newHigh);
        List<Recommendation> lowSelected = lowCandidates.subList(0, newLow);

        BigDecimal highPerVault = barbell.getHighTargetPerVaultUsd();
        BigDecimal lowPerVault = barbell.getLowTargetPerVaultUsd();
        BigDecimal totalNeeded = highPerVault
                .multiply(BigDecimal.valueOf(newHigh))
                .add(lowPerVault.multiply(BigDecimal.valueOf(newLow)));
        BigDecimal availableForDeposit = available.min(totalNeeded);
        boolean scaled = availableForDeposit.compareTo(totalNeeded) < 0;
        BigDecimal scaleFactor = scaled
                ? availableForDeposit.divide(totalNeeded, RATIO_SCALE, RoundingMode.DOWN)
                : BigDecimal.ONE;

        List<DepositTarget> targets = new ArrayList<>(newHigh + newLow);
        for (Recommendation rec : highSelected) {
            targets.add(toTarget(rec, ConfidenceBucket.HIGH, highPerVault, scaled, availableForDeposit, totalNeeded));
        }
        for (Recommendation rec : lowSelected) {
            targets.add(toTarget(rec, ConfidenceBucket.LOW, lowPerVault, scaled, availableForDeposit, totalNeeded));
        }

        DepositPlan plan = DepositPlan.builder()
                .generatedAt(clock.instant())
                .availableBalanceUsd(available)
                .currentInvestedUsd(invested)
                .totalCapitalUsd(totalCapital)
                .highPct(barbell.getHighPct())
                .lowPct(barbell.getLowPct())
                .highTargetPerVaultUsd(usd(highPerVault))
                .lowTargetPerVaultUsd(usd(lowPerVault))
                .totalAllocationNeededUsd(usd(totalNeeded))
                .availableForDepositUsd(usd(availableForDeposit))
                .scaleFactor(scaleFactor)
                .reassignedBucket(barbell.getReassignedBucket())
                .unallocatedUsd(barbell.getUnallocatedUsd())
                .targets(targets)
                .build();

        log.info(
                "Deposit plan ready: totalCapital={}, available={}, needed={}, scale={}, high={}x{}, low={}x{}",
                totalCapital,
                available,
                plan.getTotalAllocationNeededUsd(),
                scaleFactor,
                newHigh,
                plan.getHighTargetPerVaultUsd(),
                newLow,
                plan.getLowTargetPerVaultUsd());
        return plan;
    }

    /**
     * Barbell per-vault targets for {@code totalCapitalUsd}, using the same selection and
     * bucket percentages as {@link #buildPlan}. Used by the take-profit rule.
     */
    public BarbellTargets computeTargets(RecommendationSet recommendations, BigDecimal totalCapitalUsd) {
        return computeTargets(recommendations, select(recommendations), nonNegative(totalCapitalUsd));
    }

    /** Bucket of a recommended vault, or empty when the vault is not recommended. */
    public Optional<ConfidenceBucket> bucketOf(RecommendationSet recommendations, String vaultAddress) {
        String address = RecommendationSet.normalize(vaultAddress);
        if (contains(recommendations.getHighConfidence(), address)) {
            return Optional.of(ConfidenceBucket.HIGH);
        }
        if (contains(recommendations.getLowConfidence(), address)) {
            return Optional.of(ConfidenceBucket.LOW);
        }
        return Optional.empty();
    }

    // ---- Selection ----

    Selection select(RecommendationSet recommendations) {
        int maxActive = Math.max(0, rebalanceConfig.getAllocation().getMaxActive());
        SuggestedAllocations hints = recommendations.getSuggestedAllocations();

        int highCap = maxActive;
        if (hints != null && hints.getHighCount() != null) {
            highCap = Math.min(highCap, Math.max(0, hints.getHighCount()));
        }
        List<Recommendation> high = ranked(recommendations.getHighConfidence(), highCap);

        int lowCap = maxActive - high.size();
        if (hints != null && hints.getLowCount() != null) {
            lowCap = Math.min(lowCap, Math.max(0, hints.getLowCount()));
        }
        List<Recommendation> low = ranked(recommendations.getLowConfidence(), lowCap);

        return new Selection(high, low);
    }

    private static List<Recommendation> ranked(List<Recommendation> bucket, int limit) {
        if (bucket == null || limit <= 0) {
            return List.of();
        }
        return bucket.stream().sorted(BY_SCORE_DESC).limit(limit).toList();
    }

    // ---- Targets ----

    private BarbellTargets computeTargets(
            RecommendationSet recommendations, Selection selection, BigDecimal totalCapital) {
        BigDecimal[] pcts = bucketPcts(recommendations.getSuggestedAllocations());
        BigDecimal highPct = pcts[0];
        BigDecimal lowPct = pcts[1];

        ConfidenceBucket emptyBucket = null;
        BigDecimal unallocated = BigDecimal.ZERO;
        boolean highEmpty = selection.high().isEmpty();
        boolean lowEmpty = selection.low().isEmpty();

        if (highEmpty != lowEmpty) {
            emptyBucket = highEmpty ? ConfidenceBucket.HIGH : ConfidenceBucket.LOW;
            BigDecimal emptyPct = highEmpty ? highPct : lowPct;
            if (rebalanceConfig.getAllocation().isReassignEmptyBucket()) {
                highPct = highEmpty ? BigDecimal.ZERO : HUNDRED;
                lowPct = highEmpty ? HUNDRED : BigDecimal.ZERO;
            } else {
                unallocated = usd(totalCapital.multiply(emptyPct).divide(HUNDRED, WORK_SCALE, RoundingMode.HALF_UP));
                if (highEmpty) {
                    highPct = BigDecimal.ZERO;
                } else {
                    lowPct = BigDecimal.ZERO;
                }
                log.warn(
                        "{} bucket has no selected vaults and reassignment is disabled; {} USD left unallocated",
                        emptyBucket,
                        unallocated);
                emptyBucket = null;
            }
        }

        return BarbellTargets.builder()
                .totalCapitalUsd(totalCapital)
                .highPct(highPct)
                .lowPct(lowPct)
                .highTargetPerVaultUsd(perVault(totalCapital, highPct, size(recommendations.getHighConfidence())))
                .lowTargetPerVaultUsd(perVault(totalCapital, lowPct, size(recommendations.getLowConfidence())))
                .reassignedBucket(emptyBucket)
                .unallocatedUsd(unallocated)
                .build();
    }

    /**
     * Suggested percentages override the configured ones. The pair is normalised to sum to
     * 100; a pair that sums to zero or less falls back to 70/30.
     */
    BigDecimal[] bucketPcts(SuggestedAllocations hints) {
        BigDecimal high = rebalanceConfig.getAllocation().getHighPct();
        BigDecimal low = rebalanceConfig.getAllocation().getLowPct();
        if (hints != null && hints.getHighPct() != null) {
            high = hints.getHighPct();
        }
        if (hints != null && hints.getLowPct() != null) {
            low = hints.getLowPct();
        }
        high = nonNegative(high);
        low = nonNegative(low);

        BigDecimal total = high.add(low);
        if (total.signum() <= 0) {
            return new BigDecimal[] {FALLBACK_HIGH_PCT, FALLBACK_LOW_PCT};
        }
        BigDecimal normalizedHigh = high.multiply(HUNDRED).divide(total, PCT_SCALE, RoundingMode.HALF_UP);
        return new BigDecimal[] {normalizedHigh, HUNDRED.subtract(normalizedHigh)};
    }

    private static BigDecimal perVault(BigDecimal totalCapital, BigDecimal pct, int bucketSize) {
        if (bucketSize == 0 || pct.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return totalCapital
                .multiply(pct)
                .divide(HUNDRED.multiply(BigDecimal.valueOf(bucketSize)), WORK_SCALE, RoundingMode.HALF_UP);
    }

    private static DepositTarget toTarget(
            Recommendation rec,
            ConfidenceBucket bucket,
            BigDecimal perVault,
            boolean scaled,
            BigDecimal availableForDeposit,
            BigDecimal totalNeeded) {
        BigDecimal targetUsd = usd(perVault);
        // Rounding down keeps the scaled sum within the available balance
        BigDecimal depositUsd = scaled
                ? perVault.multiply(availableForDeposit).divide(totalNeeded, USD_SCALE, RoundingMode.DOWN)
                : targetUsd;
        return DepositTarget.builder()
                .vaultAddress(rec.getVaultAddress())
                .name(rec.getName())
                .confidenceBucket(bucket)
                .targetUsd(targetUsd)
                .depositUsd(depositUsd)
                .build();
    }

    // ---- Helpers ----

    private static List<Recommendation> withoutExposure(List<Recommendation> selected, Set<String> heldVaults) {
        return selected.stream()
                .filter(rec -> !heldVaults.contains(RecommendationSet.normalize(rec.getVaultAddress())))
                .toList();
    }

    private static boolean contains(List<Recommendation> bucket, String normalizedAddress) {
        return bucket != null
                && bucket.stream()
                        .anyMatch(rec -> RecommendationSet.normalize(rec.getVaultAddress())
                                .equals(normalizedAddress));
    }

    private static int size(List<Recommendation> bucket) {
        return bucket != null ? bucket.size() : 0;
    }

    private static BigDecimal usd(BigDecimal value) {
        return value.setScale(USD_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value == null || value.signum() < 0 ? BigDecimal.ZERO : value;
    }

    /** Step-1 selection per bucket, best score first. */
    record Selection(List<Recommendation> high, List<Recommendation> low) {}
}
