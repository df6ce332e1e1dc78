package com.couchreplicator.exception;

import com.couchreplicator.model.couchdb.global.ErrorInfo;
import lombok.Getter;

/**
 * Base of the errors a single replication request can end with. These are recorded on the
 * database's result and never abort the run.
 */
@Getter
public abstract class ClusterException extends ReplicatorException {

    // 0 when no response was received
    private final int httpCode;

    private final ErrorInfo errorInfo;

    protected ClusterException(String message, int httpCode, ErrorInfo errorInfo) {
        super(message);
        this.httpCode = httpCode;
        this.errorInfo = errorInfo;
    }

    protected ClusterException(String message, Throwable cause) {
        super(message, cause);
        this.httpCode = 0;
        this.errorInfo = null;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (this.httpCode == 0 && this.errorInfo == null) {
            return message;
        }
        return "%s httpCode is %d. errorInfo is %s".formatted(message, this.httpCode, this.errorInfo);
    }
}
