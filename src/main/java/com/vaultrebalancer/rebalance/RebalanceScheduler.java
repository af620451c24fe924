package com.vaultrebalancer.rebalance;

import com.vaultrebalancer.config.LedgerConfig;
import com.vaultrebalancer.config.RebalanceConfig;
import com.vaultrebalancer.domain.enums.RoundTrigger;
import com.vaultrebalancer.domain.model.RebalanceRoundResult;
import com.vaultrebalancer.exception.EngineConfigurationException;
import com.vaultrebalancer.exception.RoundInProgressException;
import com.vaultrebalancer.ledger.LedgerClient;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Process-wide timer that triggers rebalance rounds every {@code rebalance.interval-ms}.
 *
 * <p>Starts on {@link ApplicationReadyEvent}. The first round is aligned to the last vault
 * deposit on the ledger, so a restart does not reset the cadence: with a 48 h interval and a
 * deposit 30 h ago, the first round runs in 18 h. Without a prior deposit (or when the ledger
 * cannot be read) the first round runs immediately.
 *
 * <p>At most one round runs at a time. A tick that finds a round in progress is dropped, not
 * queued. Round failures are logged and never cancel the timer.
 *
 * <p>A missing wallet while enabled is fatal: {@link #start()} throws and the application
 * refuses to start.
 */
@Component
public class RebalanceScheduler implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(RebalanceScheduler.class);

    private final RebalanceOrchestrator rebalanceOrchestrator;
    private final LedgerClient ledgerClient;
    private final RebalanceConfig rebalanceConfig;
    private final LedgerConfig ledgerConfig;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduledRound;

    public RebalanceScheduler(
            RebalanceOrchestrator rebalanceOrchestrator,
            LedgerClient ledgerClient,
            RebalanceConfig rebalanceConfig,
            LedgerConfig ledgerConfig,
            @Qualifier("rebalanceTaskScheduler") TaskScheduler taskScheduler,
            Clock clock) {
        this.rebalanceOrchestrator = rebalanceOrchestrator;
        this.ledgerClient = ledgerClient;
        this.rebalanceConfig = rebalanceConfig;
        this.ledgerConfig = ledgerConfig;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        start();
    }

    /**
     * Arms the timer. Calling it again after a successful start is a no-op.
     *
     * @throws EngineConfigurationException when enabled without a wallet
     */
    public synchronized void start() {
        if (started.get()) {
            return;
        }
        if (!rebalanceConfig.isEnabled()) {
            log.info("Rebalance scheduler disabled (rebalance.enabled=false)");
            return;
        }
        if (!ledgerConfig.hasWallet()) {
            throw new EngineConfigurationException("ledger.wallet is required when rebalancing is enabled");
        }
        long intervalMs = rebalanceConfig.getIntervalMs();
        if (intervalMs <= 0) {
            log.warn("Rebalance scheduler not started: invalid interval {} ms", intervalMs);
            return;
        }

        Instant now = clock.instant();
        long initialDelayMs = computeInitialDelayMs(readLastDepositTime(), now, intervalMs);
        scheduledRound = taskScheduler.scheduleAtFixedRate(
                this::runScheduled, now.plusMillis(initialDelayMs), Duration.ofMillis(intervalMs));
        started.set(true);

        log.info(
                "Rebalance scheduler started: intervalMs={}, initialDelayMs={}, dryRun={}",
                intervalMs,
                initialDelayMs,
                rebalanceConfig.isDryRun());
    }

    @PreDestroy
    public synchronized void stop() {
        ScheduledFuture<?> future = scheduledRound;
        if (future != null) {
            future.cancel(false);
            scheduledRound = null;
            log.info("Rebalance scheduler stopped");
        }
        started.set(false);
    }

    /** Timer tick: runs a round with a fresh ranking unless one is already in progress. */
    void runScheduled() {
        runOnce(RoundTrigger.SCHEDULED);
    }

    /**
     * Runs one round if none is in progress. Never throws: failures are logged and reported
     * as an empty result.
     */
    public Optional<RebalanceRoundResult> runOnce(RoundTrigger trigger) {
        if (!running.compareAndSet(false, true)) {
            log.info("Rebalance round already in progress, skipping {} tick", trigger);
            return Optional.empty();
        }
        try {
            return Optional.of(rebalanceOrchestrator.runRound(trigger, true));
        } catch (RuntimeException e) {
            log.error("Rebalance round failed, next round stays scheduled", e);
            return Optional.empty();
        } finally {
            running.set(false);
        }
    }

    /**
     * Runs a round on behalf of an operator, through the same in-progress guard.
     * Unlike {@link #runOnce}, failures propagate to the caller.
     *
     * @throws RoundInProgressException if a round is already running
     */
    public RebalanceRoundResult runManual(boolean dryRun, boolean refreshRecommendations) {
        if (!running.compareAndSet(false, true)) {
            throw new RoundInProgressException();
        }
        try {
            return rebalanceOrchestrator.runRound(RoundTrigger.MANUAL, dryRun, refreshRecommendations);
        } finally {
            running.set(false);
        }
    }

    /**
     * {@code max(0, interval - (now - lastDeposit))}, or 0 when there was no prior deposit.
     * A deposit timestamp ahead of the local clock never delays beyond one interval.
     */
    public static long computeInitialDelayMs(Optional<Instant> lastDepositTime, Instant now, long intervalMs) {
        if (lastDepositTime.isEmpty()) {
            return 0;
        }
        long elapsedMs = Duration.between(lastDepositTime.get(), now).toMillis();
        return Math.min(intervalMs, Math.max(0, intervalMs - elapsedMs));
    }

    private Optional<Instant> readLastDepositTime() {
        try {
            return ledgerClient.getLastDepositTime(ledgerConfig.getWallet());
        } catch (RuntimeException e) {
            log.warn("Could not read last deposit time, starting without delay: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ---- State (for the status endpoint) ----

    public boolean isStarted() {
        return started.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<Instant> getNextRunAt() {
        ScheduledFuture<?> future = scheduledRound;
        if (future == null || future.isCancelled()) {
            return Optional.empty();
        }
        return Optional.of(clock.instant().plusMillis(Math.max(0, future.getDelay(TimeUnit.MILLISECONDS))));
    }
}
