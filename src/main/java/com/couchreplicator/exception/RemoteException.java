package com.couchreplicator.exception;

import com.couchreplicator.model.couchdb.global.ErrorInfo;

/**
 * Any other non-2xx answer, or a 2xx answer whose body is not ok.
 */
public class RemoteException extends ClusterException {

    public RemoteException(String message, int httpCode, ErrorInfo errorInfo) {
        super(message, httpCode, errorInfo);
    }
}
