package com.couchreplicator.service.replication;

import com.couchreplicator.enums.ReplicationDirectionEnum;
import com.couchreplicator.model.internal.JobOptions;
import com.couchreplicator.model.internal.ReplicationRequest;
import com.couchreplicator.service.couchdb.ClusterClient;
import lombok.Getter;

public class ReplicationJobFactory {

    private final ClusterClient sourceClient;

    private final ClusterClient targetClient;

    @Getter
    private final JobOptions jobOptions;

    public ReplicationJobFactory(ClusterClient sourceClient, ClusterClient targetClient, JobOptions jobOptions) {
        this.sourceClient = sourceClient;
        this.targetClient = targetClient;
        this.jobOptions = jobOptions;
    }

    public ReplicationJob create(String databaseName) {
        ReplicationRequest replicationRequest = ReplicationRequest.oneShot(
                this.sourceClient.getEndpoint(),
                this.targetClient.getEndpoint(),
                databaseName,
                this.jobOptions.getDirection()
        );
        ClusterClient issuingClient = this.jobOptions.getDirection() == ReplicationDirectionEnum.TARGET ?
                this.targetClient : this.sourceClient;
        return new ReplicationJob(issuingClient, replicationRequest, this.jobOptions);
    }
}
