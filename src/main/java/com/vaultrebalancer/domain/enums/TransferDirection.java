package com.vaultrebalancer.domain.enums;

public enum TransferDirection {
    DEPOSIT,
    WITHDRAWAL
}
