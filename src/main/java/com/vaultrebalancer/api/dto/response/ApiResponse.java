package com.vaultrebalancer.api.dto.response;

import java.time.Instant;
import lombok.Value;

/** Success envelope applied to every operations API response by ApiResponseAdvice. */
@Value
public class ApiResponse<T> {

    boolean success;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
