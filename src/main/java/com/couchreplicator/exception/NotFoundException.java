package com.couchreplicator.exception;

import com.couchreplicator.model.couchdb.global.ErrorInfo;

/**
 * The database does not exist on the source (404).
 */
public class NotFoundException extends ClusterException {

    public NotFoundException(String message, int httpCode, ErrorInfo errorInfo) {
        super(message, httpCode, errorInfo);
    }
}
