package com.couchreplicator.exception;

public class JsonException extends ReplicatorException {

    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
