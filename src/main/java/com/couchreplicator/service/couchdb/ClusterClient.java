package com.couchreplicator.service.couchdb;

import com.couchreplicator.exception.ClusterException;
import com.couchreplicator.exception.DiscoveryException;
import com.couchreplicator.exception.RemoteException;
import com.couchreplicator.model.couchdb.global.CouchDbResponse;
import com.couchreplicator.model.couchdb.global.ErrorInfo;
import com.couchreplicator.model.couchdb.replicate.ReplicateRequest;
import com.couchreplicator.model.couchdb.replicate.ReplicateResponse;
import com.couchreplicator.model.internal.ClusterEndpoint;
import com.couchreplicator.model.internal.ReplicationRequest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One cluster's {@code _all_dbs} and {@code _replicate} endpoints. Holds no state between calls
 * and is shared by every job of a run.
 */
@Slf4j
public class ClusterClient {

    @Getter
    private final ClusterEndpoint endpoint;

    private final CouchDbService couchDbService;

    public ClusterClient(ClusterEndpoint endpoint, CouchDbService couchDbService) {
        this.endpoint = endpoint;
        this.couchDbService = couchDbService;
    }

    public Set<String> listDatabases() throws DiscoveryException {
        CouchDbResponse<List<String>> response = this.couchDbService.getAllDbs();
        if (!response.isSuccess()) {
            throw new DiscoveryException("listDatabases failed. cluster is %s".formatted(this.endpoint),
                    response.getClusterException("GET _all_dbs failed."));
        }
        if (ObjectUtils.isEmpty(response.getData())) {
            log.warn("cluster {} has no database", this.endpoint);
            return new LinkedHashSet<>();
        }
        return new LinkedHashSet<>(response.getData());
    }

    /**
     * One-shot requests block until CouchDB reports the replication finished. Continuous requests
     * return once the replication is accepted.
     */
    public ReplicateResponse replicate(ReplicationRequest replicationRequest) throws ClusterException {
        if (!this.endpoint.equals(replicationRequest.getIssuingEndpoint())) {
            throw new IllegalArgumentException("replicate failed. request is issued by %s, not by %s"
                    .formatted(replicationRequest.getIssuingEndpoint(), this.endpoint));
        }
        String databaseName = replicationRequest.getDatabaseName();
        ReplicateRequest replicateRequest = new ReplicateRequest(
                replicationRequest.getSource().databaseUrl(databaseName),
                replicationRequest.getTarget().databaseUrl(databaseName)
        );
        if (replicationRequest.isContinuous()) {
            replicateRequest.continuous();
        }
        CouchDbResponse<ReplicateResponse> response = this.couchDbService.replicate(replicateRequest);
        String message = "replicate failed. database is %s, continuous is %s."
                .formatted(databaseName, replicationRequest.isContinuous());
        if (!response.isSuccess()) {
            throw response.getClusterException(message);
        }
        ReplicateResponse replicateResponse = response.getData();
        if (replicateResponse == null || !replicateResponse.isOk()) {
            throw new RemoteException(message + " response is not ok.",
                    response.getHttpCode(),
                    new ErrorInfo("not_ok", String.valueOf(replicateResponse)));
        }
        return replicateResponse;
    }
}
