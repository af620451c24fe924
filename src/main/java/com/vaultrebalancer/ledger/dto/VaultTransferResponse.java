package com.vaultrebalancer.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exchange response relayed by the signing sidecar: {@code {"status":"ok","response":{...}}}
 * on success, {@code {"status":"err","response":"<message>"}} on rejection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultTransferResponse {

    private String status;
    private JsonNode response;

    public boolean isOk() {
        return "ok".equalsIgnoreCase(status);
    }

    public String errorMessage() {
        if (response == null || response.isNull()) {
            return "status=" + status;
        }
        return response.isTextual() ? response.asText() : response.toString();
    }
}
