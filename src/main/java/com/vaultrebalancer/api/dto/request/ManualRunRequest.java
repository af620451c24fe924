package com.vaultrebalancer.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional overrides for a manually triggered round. Null fields use the configured values. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualRunRequest {

    private Boolean dryRun;

    @Builder.Default
    private boolean refreshRecommendations = true;
}
