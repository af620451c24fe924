package com.vaultrebalancer.exception;

/** Required configuration (wallet, endpoints) is missing; the engine refuses to run. */
public class EngineConfigurationException extends BaseException {

    public EngineConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
}
