package com.vaultrebalancer.domain.model;

import com.vaultrebalancer.domain.enums.TransferStatus;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated outcome of a sequential batch of transfers (plan deposits or a withdraw-all).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferBatchResult {

    private boolean dryRun;
    private int total;
    private int submitted;
    private int skipped;
    private int errors;

    @Builder.Default
    private List<TransferAction> actions = new ArrayList<>();

    public static TransferBatchResult empty(boolean dryRun) {
        return TransferBatchResult.builder().dryRun(dryRun).build();
    }

    public void record(TransferAction action) {
        actions.add(action);
        total++;
        if (action.getStatus() == TransferStatus.SUBMITTED) {
            submitted++;
        } else if (action.getStatus() == TransferStatus.SKIPPED) {
            skipped++;
        } else if (action.getStatus() == TransferStatus.ERROR) {
            errors++;
        }
    }
}
