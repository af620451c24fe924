package com.vaultrebalancer.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/** Body of the signing sidecar's {@code POST /vault-transfer}. {@code usd} is micro-USD. */
@Value
public class VaultTransferRequest {

    String vaultAddress;

    @JsonProperty("isDeposit")
    boolean deposit;

    long usd;
}
