package com.vaultrebalancer.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the emergency withdrawal endpoints. {@code confirm} must be the literal
 * text "CONFIRM"; dry-run is the default so a bare confirmation moves nothing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawAllRequest {

    public static final String CONFIRMATION = "CONFIRM";

    @NotBlank
    private String confirm;

    @Builder.Default
    private boolean dryRun = true;

    private boolean includeLocked;

    public boolean isConfirmed() {
        return CONFIRMATION.equals(confirm);
    }
}
