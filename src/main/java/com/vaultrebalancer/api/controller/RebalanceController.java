package com.vaultrebalancer.api.controller;

import com.vaultrebalancer.api.dto.request.ManualRunRequest;
import com.vaultrebalancer.api.dto.request.WithdrawAllRequest;
import com.vaultrebalancer.api.dto.response.RebalanceStatusResponse;
import com.vaultrebalancer.config.RebalanceConfig;
import com.vaultrebalancer.domain.model.DepositPlan;
import com.vaultrebalancer.domain.model.RebalanceRoundResult;
import com.vaultrebalancer.domain.model.TransferAction;
import com.vaultrebalancer.domain.model.TransferBatchResult;
import com.vaultrebalancer.exception.BusinessException;
import com.vaultrebalancer.exception.ResourceNotFoundException;
import com.vaultrebalancer.observability.RoundHistoryService;
import com.vaultrebalancer.rebalance.RebalanceOrchestrator;
import com.vaultrebalancer.rebalance.RebalanceScheduler;
import com.vaultrebalancer.rebalance.TransferExecutor;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operations endpoints for the rebalancing engine.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/rebalance/status -- scheduler state and the last round</li>
 *   <li>GET /api/rebalance/rounds?limit= -- recent round results, newest first</li>
 *   <li>GET /api/rebalance/rounds/{roundId} -- one archived round</li>
 *   <li>GET /api/rebalance/plan -- deposit plan preview, nothing is executed</li>
 *   <li>POST /api/rebalance/run -- run a round now (409 while one is in progress)</li>
 *   <li>POST /api/rebalance/withdraw-all -- emergency exit from every vault (requires "CONFIRM")</li>
 *   <li>POST /api/rebalance/vaults/{vaultAddress}/withdraw -- exit one vault (requires "CONFIRM")</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/rebalance")
public class RebalanceController {

    private static final Logger log = LoggerFactory.getLogger(RebalanceController.class);

    private final RebalanceScheduler rebalanceScheduler;
    private final RebalanceOrchestrator rebalanceOrchestrator;
    private final TransferExecutor transferExecutor;
    private final RoundHistoryService roundHistoryService;
    private final RebalanceConfig rebalanceConfig;

    public RebalanceController(
            RebalanceScheduler rebalanceScheduler,
            RebalanceOrchestrator rebalanceOrchestrator,
            TransferExecutor transferExecutor,
            RoundHistoryService roundHistoryService,
            RebalanceConfig rebalanceConfig) {
        this.rebalanceScheduler = rebalanceScheduler;
        this.rebalanceOrchestrator = rebalanceOrchestrator;
        this.transferExecutor = transferExecutor;
        this.roundHistoryService = roundHistoryService;
        this.rebalanceConfig = rebalanceConfig;
    }

    @GetMapping("/status")
    public ResponseEntity<RebalanceStatusResponse> getStatus() {
        Optional<RebalanceRoundResult> last = roundHistoryService.getLast();
        RebalanceStatusResponse status = RebalanceStatusResponse.builder()
                .enabled(rebalanceConfig.isEnabled())
                .started(rebalanceScheduler.isStarted())
                .running(rebalanceScheduler.isRunning())
                .dryRun(rebalanceConfig.isDryRun())
                .intervalMs(rebalanceConfig.getIntervalMs())
                .nextRunAt(rebalanceScheduler.getNextRunAt().orElse(null))
                .lastRoundId(last.map(RebalanceRoundResult::getRoundId).orElse(null))
                .lastRoundFinishedAt(last.map(RebalanceRoundResult::getFinishedAt).orElse(null))
                .lastRoundError(last.map(RebalanceRoundResult::getError).orElse(null))
                .build();
        return ResponseEntity.ok(status);
    }

    @GetMapping("/rounds")
    public ResponseEntity<List<RebalanceRoundResult>> getRounds(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(roundHistoryService.getRecent(limit));
    }

    @GetMapping("/rounds/{roundId}")
    public ResponseEntity<RebalanceRoundResult> getRound(@PathVariable String roundId) {
        return roundHistoryService
                .findById(roundId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Rebalance round", roundId));
    }

    /** Plans deposits against current balances. Reuses the cached ranking unless refresh=true. */
    @GetMapping("/plan")
    public ResponseEntity<DepositPlan> previewPlan(@RequestParam(defaultValue = "false") boolean refresh) {
        return ResponseEntity.ok(rebalanceOrchestrator.previewPlan(refresh));
    }

    @PostMapping("/run")
    public ResponseEntity<RebalanceRoundResult> runRound(@RequestBody(required = false) ManualRunRequest request) {
        ManualRunRequest options = request != null ? request : new ManualRunRequest(null, true);
        boolean dryRun = options.getDryRun() != null ? options.getDryRun() : rebalanceConfig.isDryRun();
        log.info("Manual rebalance round requested: dryRun={}", dryRun);
        return ResponseEntity.ok(rebalanceScheduler.runManual(dryRun, options.isRefreshRecommendations()));
    }

    @PostMapping("/withdraw-all")
    public ResponseEntity<TransferBatchResult> withdrawAll(@Valid @RequestBody WithdrawAllRequest request) {
        requireConfirmation(request);
        return ResponseEntity.ok(rebalanceOrchestrator.withdrawAll(request.isDryRun(), request.isIncludeLocked()));
    }

    @PostMapping("/vaults/{vaultAddress}/withdraw")
    public ResponseEntity<TransferAction> withdrawFromVault(
            @PathVariable String vaultAddress, @Valid @RequestBody WithdrawAllRequest request) {
        requireConfirmation(request);
        log.warn("Vault withdrawal requested: vault={}, dryRun={}", vaultAddress, request.isDryRun());
        return ResponseEntity.ok(
                transferExecutor.withdrawFromVault(vaultAddress, request.isDryRun(), request.isIncludeLocked()));
    }

    private static void requireConfirmation(WithdrawAllRequest request) {
        if (!request.isConfirmed()) {
            throw new BusinessException("Withdrawal requires 'confirm': 'CONFIRM' in the request body");
        }
    }
}
