package com.vaultrebalancer.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vaultrebalancer.domain.enums.ConfidenceBucket;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ranked vault candidate produced by the external ranking pipeline.
 * allocationPct is informational; target sizing always divides the bucket share evenly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Recommendation {

    private String vaultAddress;
    private String name;

    @JsonAlias("confidence")
    private ConfidenceBucket confidenceBucket;

    private BigDecimal score;
    private BigDecimal allocationPct;
    private String reason;
}
