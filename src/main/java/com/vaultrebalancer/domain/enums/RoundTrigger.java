package com.vaultrebalancer.domain.enums;

public enum RoundTrigger {
    SCHEDULED,
    MANUAL
}
