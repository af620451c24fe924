package com.vaultrebalancer.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One entry of {@code userNonFundingLedgerUpdates}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerUpdateDto {

    public static final String VAULT_DEPOSIT = "vaultDeposit";

    private Long time;
    private String hash;
    private Delta delta;

    public boolean isVaultDeposit() {
        return delta != null && VAULT_DEPOSIT.equals(delta.getType());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Delta {
        private String type;
        private String vault;
        private BigDecimal usdc;
    }
}
