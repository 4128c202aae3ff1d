package com.companya.sensorhub.exception;

/**
 * An inbound message that cannot be turned into a reading. The message is dropped.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
