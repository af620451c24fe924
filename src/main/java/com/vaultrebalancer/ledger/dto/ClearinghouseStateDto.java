package com.vaultrebalancer.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Subset of {@code clearinghouseState}. For the wallet it gives the withdrawable balance;
 * for a vault address it lists the vault's own open positions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClearinghouseStateDto {

    private MarginSummary marginSummary;
    private BigDecimal withdrawable;

    @Builder.Default
    private List<AssetPosition> assetPositions = new ArrayList<>();

    /** Open positions with a non-zero size. */
    public int countOpenPositions() {
        if (assetPositions == null) {
            return 0;
        }
        return (int) assetPositions.stream()
                .filter(p -> p.getPosition() != null
                        && p.getPosition().getSzi() != null
                        && p.getPosition().getSzi().signum() != 0)
                .count();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MarginSummary {
        private BigDecimal accountValue;
        private BigDecimal totalMarginUsed;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssetPosition {
        private PerpPosition position;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PerpPosition {
        private String coin;

        /** Signed size. */
        private BigDecimal szi;
    }
}
