package com.vaultrebalancer.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Subset of the {@code vaultDetails} response. When the query carries a {@code user}, the
 * ledger includes that user's {@link FollowerState} with their PnL in the vault.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultDetailsDto {

    private String name;
    private String vaultAddress;
    private String leader;
    private Boolean isClosed;
    private Boolean allowDeposits;
    private FollowerState followerState;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FollowerState {
        private String user;
        private BigDecimal vaultEquity;
        private BigDecimal pnl;
        private BigDecimal allTimePnl;
        private Integer daysFollowing;
        private Long vaultEntryTime;
        private Long lockupUntil;
    }
}
