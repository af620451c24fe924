package com.vaultrebalancer.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional bucket split hints from the ranking pipeline. Any field may be null. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SuggestedAllocations {

    private BigDecimal highPct;
    private BigDecimal lowPct;
    private Integer highCount;
    private Integer lowCount;
    private String barbellNote;
}
