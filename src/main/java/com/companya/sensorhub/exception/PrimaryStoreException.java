package com.companya.sensorhub.exception;

public class PrimaryStoreException extends RuntimeException {

    public PrimaryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
