package com.vaultrebalancer.exception;

/** The ledger answered but rejected the request for any reason other than insufficient equity. */
public class LedgerRejectedException extends LedgerException {

    public LedgerRejectedException(String message) {
        super(ErrorCode.LEDGER_ERROR, message);
    }
}
