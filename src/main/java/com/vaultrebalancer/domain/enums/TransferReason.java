package com.vaultrebalancer.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a transfer was skipped, or which rule produced it. Serialized as the kebab-case code
 * so round records stay readable in logs and the archive.
 */
public enum TransferReason {
    ZERO_AMOUNT("zero-amount"),
    BELOW_MINIMUM("below-minimum"),
    LOCKED("locked"),
    ALREADY_AT_TARGET("already-at-target"),
    NOT_DEPOSITED("not-deposited"),
    INACTIVE_VAULT("inactive-vault"),
    TAKE_PROFIT("take-profit"),
    NOT_RECOMMENDED("not-recommended"),
    WITHDRAW_ALL("withdraw-all"),
    PLANNED_DEPOSIT("planned-deposit");

    private final String code;

    TransferReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
