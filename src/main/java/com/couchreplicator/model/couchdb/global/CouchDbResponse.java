package com.couchreplicator.model.couchdb.global;

import com.couchreplicator.exception.AuthException;
import com.couchreplicator.exception.ClusterException;
import com.couchreplicator.exception.ConflictException;
import com.couchreplicator.exception.NotFoundException;
import com.couchreplicator.exception.RemoteException;
import com.couchreplicator.exception.TransientException;
import lombok.Data;

import java.util.Set;

@Data
public class CouchDbResponse<T> {

    private static final Set<Integer> TRANSIENT_HTTP_CODES = Set.of(408, 429, 502, 503, 504);

    private int httpCode;

    private boolean success;

    private T data;

    // has response but http code is not 2xx
    private ErrorInfo errorInfo;

    // does not have response
    private Throwable ex;

    private CouchDbResponse() {}

    public static <T> CouchDbResponse<T> success(int httpCode, T data) {
        CouchDbResponse<T> couchDbResponse = new CouchDbResponse<>();
        couchDbResponse.setHttpCode(httpCode);
        couchDbResponse.setSuccess(true);
        couchDbResponse.setData(data);
        return couchDbResponse;
    }

    public static <T> CouchDbResponse<T> error(int httpCode, ErrorInfo errorInfo) {
        CouchDbResponse<T> couchDbResponse = new CouchDbResponse<>();
        couchDbResponse.setHttpCode(httpCode);
        couchDbResponse.setSuccess(false);
        couchDbResponse.setErrorInfo(errorInfo);
        return couchDbResponse;
    }

    public static <T> CouchDbResponse<T> error(Throwable ex) {
        CouchDbResponse<T> couchDbResponse = new CouchDbResponse<>();
        couchDbResponse.setSuccess(false);
        couchDbResponse.setEx(ex);
        return couchDbResponse;
    }

    public ClusterException getClusterException(String message) {
        if (this.success) return null;
        if (this.ex != null) {
            return new TransientException("%s no response from cluster.".formatted(message), this.ex);
        }
        return switch (this.httpCode) {
            case 401, 403 -> new AuthException(message, this.httpCode, this.errorInfo);
            case 404 -> new NotFoundException(message, this.httpCode, this.errorInfo);
            case 409 -> new ConflictException(message, this.httpCode, this.errorInfo);
            default -> TRANSIENT_HTTP_CODES.contains(this.httpCode) ?
                    new TransientException(message, this.httpCode, this.errorInfo) :
                    new RemoteException(message, this.httpCode, this.errorInfo);
        };
    }
}
