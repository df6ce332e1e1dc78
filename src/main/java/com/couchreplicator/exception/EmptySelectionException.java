package com.couchreplicator.exception;

public class EmptySelectionException extends ConfigException {

    public EmptySelectionException(String message) {
        super(message);
    }
}
