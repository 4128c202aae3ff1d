package com.companya.sensorhub.exception;

public class SecondaryStoreException extends RuntimeException {

    public SecondaryStoreException(String message) {
        super(message);
    }

    public SecondaryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
