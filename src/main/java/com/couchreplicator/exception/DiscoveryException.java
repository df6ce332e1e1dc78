package com.couchreplicator.exception;

/**
 * Listing the databases of the source cluster failed. Aborts the run.
 */
public class DiscoveryException extends ReplicatorException {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
