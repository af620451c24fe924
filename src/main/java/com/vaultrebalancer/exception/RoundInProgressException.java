package com.vaultrebalancer.exception;

public class RoundInProgressException extends BaseException {

    public RoundInProgressException() {
        super(ErrorCode.ROUND_IN_PROGRESS, "A rebalance round is already in progress");
    }
}
