package com.vaultrebalancer.exception;

/**
 * Root of all failures raised at the {@link com.vaultrebalancer.ledger.LedgerClient} boundary.
 * Callers dispatch on the concrete subtype, never on the message text.
 */
public abstract class LedgerException extends BaseException {

    protected LedgerException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    protected LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
