package com.smsgate.gateway;

/**
 * Carrier gateway refused or failed a send. {@code errorCode} is the carrier's code when
 * one was returned, otherwise a short local code such as {@code timeout}.
 */
public class GatewayException extends RuntimeException {

    private final String errorCode;

    public GatewayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GatewayException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
