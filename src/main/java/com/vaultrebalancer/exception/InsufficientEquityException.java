package com.vaultrebalancer.exception;

/**
 * The ledger refused a withdrawal because the vault equity available to the account is
 * smaller than requested (margin moved between the balance read and the submission).
 * The only failure the withdrawal retry ladder reacts to.
 */
public class InsufficientEquityException extends LedgerException {

    public InsufficientEquityException(String message) {
        super(ErrorCode.INSUFFICIENT_EQUITY, message);
    }
}
