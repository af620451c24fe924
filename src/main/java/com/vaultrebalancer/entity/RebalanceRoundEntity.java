package com.vaultrebalancer.entity;

import com.vaultrebalancer.domain.enums.RoundTrigger;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the rebalance_round table.
 *
 * <p>Summary columns support listing and filtering without parsing JSON; the full
 * {@code RebalanceRoundResult} (actions, plan, errors) is kept in {@code resultJson}.
 */
@Entity
@Table(name = "rebalance_round")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RebalanceRoundEntity {

    @Id
    @Column(name = "round_id", length = 64)
    private String roundId;

    @Enumerated(EnumType.STRING)
    @Column(name = "round_trigger", nullable = false, columnDefinition = "varchar(20)")
    private RoundTrigger trigger;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "dry_run", nullable = false)
    private boolean dryRun;

    @Column(name = "withdrawals_submitted")
    private int withdrawalsSubmitted;

    @Column(name = "deposits_submitted")
    private int depositsSubmitted;

    /** ERROR actions across withdrawals and deposits. */
    @Column(name = "transfer_errors")
    private int transferErrors;

    /** Round-fatal failure message; null for a completed round. */
    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;
}
