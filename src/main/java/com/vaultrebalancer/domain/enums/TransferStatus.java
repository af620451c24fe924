package com.vaultrebalancer.domain.enums;

/**
 * Terminal outcome of one attempted deposit or withdrawal.
 * SKIPPED: never attempted (zero amount, below minimum, locked, nothing deposited).
 * PREPARED: dry-run only, computed but not submitted.
 * SUBMITTED: the ledger accepted the transfer.
 * ERROR: a non-retryable failure, or every rung of the retry ladder failed.
 */
public enum TransferStatus {
    SKIPPED,
    PREPARED,
    SUBMITTED,
    ERROR
}
