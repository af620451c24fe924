package com.vaultrebalancer.event;

import com.vaultrebalancer.domain.model.RebalanceRoundResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the orchestrator when a round finishes, successfully or not. A failed round
 * carries a result with {@code error} set and whatever was completed before the failure.
 *
 * <p>Listeners: RoundHistoryService (archive) and RebalanceMetricsService (counters, timer).
 */
public class RebalanceRoundEvent extends ApplicationEvent {

    private final RebalanceRoundResult result;

    public RebalanceRoundEvent(Object source, RebalanceRoundResult result) {
        super(source);
        this.result = result;
    }

    public RebalanceRoundResult getResult() {
        return result;
    }
}
