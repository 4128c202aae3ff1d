package com.companya.sensorhub.exception;

/**
 * Raised when the broker cannot be reached while the subscriber is starting.
 * Treated as fatal: the application context fails to start.
 */
public class TransportConnectException extends RuntimeException {

    public TransportConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
