package com.couchreplicator.exception;

/**
 * Invalid command line or configuration. Always raised before the first request to a cluster.
 */
public class ConfigException extends ReplicatorException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
