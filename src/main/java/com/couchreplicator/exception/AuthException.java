package com.couchreplicator.exception;

import com.couchreplicator.model.couchdb.global.ErrorInfo;

/**
 * Credentials were rejected by the cluster (401, 403).
 */
public class AuthException extends ClusterException {

    public AuthException(String message, int httpCode, ErrorInfo errorInfo) {
        super(message, httpCode, errorInfo);
    }
}
