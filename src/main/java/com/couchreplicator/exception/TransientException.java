package com.couchreplicator.exception;

import com.couchreplicator.model.couchdb.global.ErrorInfo;

/**
 * Network failure, timeout or a gateway/availability status. The job may retry it.
 */
public class TransientException extends ClusterException {

    public TransientException(String message, int httpCode, ErrorInfo errorInfo) {
        super(message, httpCode, errorInfo);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
