package com.vaultrebalancer.exception;

public class RecommendationUnavailableException extends BaseException {

    public RecommendationUnavailableException(String message, Throwable cause) {
        super(ErrorCode.RECOMMENDER_ERROR, message, cause);
    }
}
