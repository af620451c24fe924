package com.vaultrebalancer.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.vaultrebalancer.domain.enums.TransferDirection;
import com.vaultrebalancer.domain.enums.TransferReason;
import com.vaultrebalancer.domain.enums.TransferStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome record of one attempted deposit or withdrawal.
 *
 * <p>usdMicros is the amount actually submitted when status is SUBMITTED (which may be a
 * reduced retry-ladder rung), otherwise the amount that was computed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransferAction {

    private String vaultAddress;
    private TransferDirection direction;
    private BigDecimal equityUsd;
    private Instant lockedUntil;
    private long usdMicros;
    private TransferStatus status;
    private TransferReason reason;
    private String error;

    /** Ledger submissions made for this action, including retry-ladder rungs. */
    private int attempts;

    @JsonIgnore
    public boolean isSubmitted() {
        return status == TransferStatus.SUBMITTED;
    }
}
