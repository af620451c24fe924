package com.vaultrebalancer.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One row of {@code userVaultEquities}: the account's stake in a vault. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultEquityDto {

    private String vaultAddress;
    private BigDecimal equity;

    /** Epoch millis; 0 or absent when the stake is not locked. */
    private Long lockedUntilTimestamp;
}
