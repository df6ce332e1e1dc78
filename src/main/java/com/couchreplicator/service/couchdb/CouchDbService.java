package com.couchreplicator.service.couchdb;

import com.couchreplicator.exception.JsonException;
import com.couchreplicator.model.couchdb.global.CouchDbResponse;
import com.couchreplicator.model.couchdb.global.ErrorInfo;
import com.couchreplicator.model.couchdb.replicate.ReplicateRequest;
import com.couchreplicator.model.couchdb.replicate.ReplicateResponse;
import com.couchreplicator.model.internal.ClusterEndpoint;
import com.couchreplicator.util.JsonUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.function.Function;

/**
 * Raw HTTP calls against one cluster. Never throws for remote failures; every outcome is
 * returned as a {@link CouchDbResponse}.
 */
@Slf4j
public class CouchDbService {

    private final RestClient restClient;

    // for logs only
    private final String clusterName;

    public CouchDbService(RestClient restClient, String clusterName) {
        this.restClient = restClient;
        this.clusterName = clusterName;
    }

    public CouchDbResponse<List<String>> getAllDbs() {
        log.trace("[{}] request GET _all_dbs", this.clusterName);
        return this.handleClientResponse(
                "GET _all_dbs",
                this.restClient.get().uri("/_all_dbs"),
                body -> JsonUtil.deserialize(body, new TypeReference<List<String>>() {})
        );
    }

    public CouchDbResponse<ReplicateResponse> replicate(ReplicateRequest replicateRequest) {
        if (ObjectUtils.anyNull(replicateRequest, replicateRequest.getSource(), replicateRequest.getTarget())) {
            throw new IllegalArgumentException("replicate failed. replicateRequest, source or target is null. " +
                    "replicateRequest is %s".formatted(replicateRequest));
        }
        String body = JsonUtil.serializeToString(replicateRequest);
        if (log.isTraceEnabled()) {
            log.trace("[{}] request POST _replicate with data {}",
                    this.clusterName, ClusterEndpoint.mask(body));
        }
        return this.handleClientResponse(
                "POST _replicate",
                this.restClient.post()
                        .uri("/_replicate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(body),
                responseBody -> JsonUtil.deserialize(responseBody, ReplicateResponse.class)
        );
    }

    private <T> CouchDbResponse<T> handleClientResponse(
            String action,
            RestClient.RequestHeadersSpec<?> requestSpec,
            Function<String, T> parser) {
        try {
            return requestSpec.exchange((httpRequest, httpResponse) -> {
                HttpStatusCode statusCode = httpResponse.getStatusCode();
                String body = httpResponse.bodyTo(String.class);
                log.trace("[{}] {} http response code {} with data {}",
                        this.clusterName, action, statusCode.value(), body);
                if (!statusCode.is2xxSuccessful()) {
                    return CouchDbResponse.error(statusCode.value(), JsonUtil.parseErrorInfo(body));
                }
                try {
                    return CouchDbResponse.success(statusCode.value(), parser.apply(body));
                } catch (JsonException e) {
                    // 2xx with an unreadable body
                    return CouchDbResponse.error(statusCode.value(), new ErrorInfo("bad_response", body));
                }
            });
        } catch (Exception e) {
            log.debug("[{}] {} got no response", this.clusterName, action, e);
            return CouchDbResponse.error(e);
        }
    }
}
