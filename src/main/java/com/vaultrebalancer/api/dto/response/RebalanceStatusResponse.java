package com.vaultrebalancer.api.dto.response;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RebalanceStatusResponse {

    boolean enabled;
    boolean started;
    boolean running;
    boolean dryRun;
    long intervalMs;
    Instant nextRunAt;
    String lastRoundId;
    Instant lastRoundFinishedAt;
    String lastRoundError;
}
