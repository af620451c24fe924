package com.vaultrebalancer.api.dto.response;

import com.vaultrebalancer.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
public class ApiErrorResponse {

    boolean success;
    ErrorDetail error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        ErrorDetail detail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(false, detail);
    }

    @Value
    @Builder
    public static class ErrorDetail {
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
