package com.retailops.backend;

import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;

/**
 * Classified RetailCore failure. {@code upstreamStatus} is 0 when no HTTP response arrived.
 */
public class BackendException extends GatewayException {

    private final String operation;
    private final int upstreamStatus;

    public BackendException(ErrorKind kind, String operation, int upstreamStatus, String message, Throwable cause) {
        super(kind, message, null, cause);
        this.operation = operation;
        this.upstreamStatus = upstreamStatus;
    }

    public String operation() {
        return operation;
    }

    public int upstreamStatus() {
        return upstreamStatus;
    }
}
