package com.vaultrebalancer.domain.model;

import com.vaultrebalancer.domain.enums.ConfidenceBucket;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One planned deposit into a vault with no existing exposure.
 *
 * <p>targetUsd is the unscaled barbell target; depositUsd is what will actually be sent
 * after proportional shrinkage, so depositUsd never exceeds targetUsd.
 */
@Value
@Builder
@Jacksonized
public class DepositTarget {

    String vaultAddress;
    String name;
    ConfidenceBucket confidenceBucket;
    BigDecimal targetUsd;
    BigDecimal depositUsd;
}
