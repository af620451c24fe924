package com.vaultrebalancer.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vaultrebalancer.domain.enums.RoundTrigger;
import com.vaultrebalancer.domain.enums.TransferStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Record of one rebalancing round, in priority order of the withdrawal phase.
 *
 * <p>inactiveWithdrawals and withdrawals are both full exits (dormant vaults and
 * non-recommended vaults respectively); tpWithdrawals are partial take-profit exits.
 * A round that failed before finishing carries the error message and whatever actions
 * completed before the failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalanceRoundResult {

    private String roundId;
    private RoundTrigger trigger;
    private Instant startedAt;
    private Instant finishedAt;
    private boolean dryRun;

    @Builder.Default
    private List<String> recommended = new ArrayList<>();

    @Builder.Default
    private List<TransferAction> inactiveWithdrawals = new ArrayList<>();

    @Builder.Default
    private List<TransferAction> tpWithdrawals = new ArrayList<>();

    @Builder.Default
    private List<TransferAction> withdrawals = new ArrayList<>();

    private boolean settleDelayApplied;

    private DepositPlan plan;
    private TransferBatchResult deposits;

    private String error;

    @JsonIgnore
    public List<TransferAction> getAllWithdrawals() {
        return Stream.of(inactiveWithdrawals, tpWithdrawals, withdrawals)
                .flatMap(List::stream)
                .toList();
    }

    @JsonIgnore
    public boolean hasSubmittedWithdrawal() {
        return getAllWithdrawals().stream().anyMatch(a -> a.getStatus() == TransferStatus.SUBMITTED);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
