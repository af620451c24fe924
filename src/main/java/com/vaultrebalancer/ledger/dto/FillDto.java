package com.vaultrebalancer.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FillDto {

    private String coin;
    private BigDecimal px;
    private BigDecimal sz;
    private String side;
    private Long time;
}
