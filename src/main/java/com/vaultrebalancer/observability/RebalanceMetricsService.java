package com.vaultrebalancer.observability;

import com.vaultrebalancer.domain.model.RebalanceRoundResult;
import com.vaultrebalancer.event.RebalanceRoundEvent;
import com.vaultrebalancer.event.TransferEvent;
import com.vaultrebalancer.rebalance.RebalanceScheduler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the rebalancing engine:
 * <ul>
 *   <li><b>rebalance.rounds</b> (counter, tag {@code outcome=completed|failed})</li>
 *   <li><b>rebalance.round.duration</b> (timer)</li>
 *   <li><b>rebalance.transfers</b> (counter, tags {@code direction}, {@code status})</li>
 *   <li><b>rebalance.round.in_progress</b> (gauge 0/1, read from the scheduler)</li>
 * </ul>
 *
 * <p>Counters and the timer are driven by application events; the gauge is polled by
 * Micrometer at scrape time.
 */
@Service
public class RebalanceMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter roundsCompleted;
    private final Counter roundsFailed;
    private final Timer roundDuration;

    public RebalanceMetricsService(MeterRegistry meterRegistry, RebalanceScheduler rebalanceScheduler) {
        this.meterRegistry = meterRegistry;

        this.roundsCompleted = Counter.builder("rebalance.rounds")
                .description("Rebalance rounds finished")
                .tag("outcome", "completed")
                .register(meterRegistry);
        this.roundsFailed = Counter.builder("rebalance.rounds")
                .description("Rebalance rounds finished")
                .tag("outcome", "failed")
                .register(meterRegistry);

        this.roundDuration = Timer.builder("rebalance.round.duration")
                .description("Wall time of a rebalance round, settle delay included")
                .maximumExpectedValue(Duration.ofMinutes(30))
                .register(meterRegistry);

        meterRegistry.gauge(
                "rebalance.round.in_progress", rebalanceScheduler, scheduler -> scheduler.isRunning() ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onRoundFinished(RebalanceRoundEvent event) {
        RebalanceRoundResult result = event.getResult();
        if (result.isFailed()) {
            roundsFailed.increment();
        } else {
            roundsCompleted.increment();
        }
        if (result.getStartedAt() != null && result.getFinishedAt() != null) {
            roundDuration.record(Duration.between(result.getStartedAt(), result.getFinishedAt()));
        }
    }

    @EventListener
    @Order(20)
    public void onTransfer(TransferEvent event) {
        Counter.builder("rebalance.transfers")
                .description("Transfer actions by direction and terminal status")
                .tag("direction", event.getAction().getDirection().name().toLowerCase(Locale.ROOT))
                .tag("status", event.getAction().getStatus().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    // Expose for testing
    Counter getRoundsCompleted() {
        return roundsCompleted;
    }

    Counter getRoundsFailed() {
        return roundsFailed;
    }

    Timer getRoundDuration() {
        return roundDuration;
    }
}
