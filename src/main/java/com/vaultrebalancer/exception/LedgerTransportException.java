package com.vaultrebalancer.exception;

/** The ledger could not be reached or returned an unreadable response. */
public class LedgerTransportException extends LedgerException {

    public LedgerTransportException(String message) {
        super(ErrorCode.LEDGER_UNAVAILABLE, message);
    }

    public LedgerTransportException(String message, Throwable cause) {
        super(ErrorCode.LEDGER_UNAVAILABLE, message, cause);
    }
}
