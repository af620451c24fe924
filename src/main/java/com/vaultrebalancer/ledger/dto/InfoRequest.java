package com.vaultrebalancer.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/** Body of a {@code POST /info} query. Only the fields relevant to {@code type} are sent. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InfoRequest {

    String type;
    String user;
    String vaultAddress;
    Long startTime;

    public static InfoRequest forUser(String type, String user) {
        return InfoRequest.builder().type(type).user(user).build();
    }
}
