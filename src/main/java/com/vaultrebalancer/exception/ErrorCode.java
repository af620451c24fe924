package com.vaultrebalancer.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    ROUND_IN_PROGRESS("ROUND_IN_PROGRESS", 409),
    INSUFFICIENT_EQUITY("INSUFFICIENT_EQUITY", 422),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    LEDGER_ERROR("LEDGER_ERROR", 502),
    LEDGER_UNAVAILABLE("LEDGER_UNAVAILABLE", 503),
    RECOMMENDER_ERROR("RECOMMENDER_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
