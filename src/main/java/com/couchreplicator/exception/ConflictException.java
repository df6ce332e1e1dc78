package com.couchreplicator.exception;

import com.couchreplicator.model.couchdb.global.ErrorInfo;

/**
 * A replication for the same source and target already exists (409).
 */
public class ConflictException extends ClusterException {

    public ConflictException(String message, int httpCode, ErrorInfo errorInfo) {
        super(message, httpCode, errorInfo);
    }
}
