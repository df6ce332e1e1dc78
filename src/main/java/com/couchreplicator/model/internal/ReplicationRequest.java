package com.couchreplicator.model.internal;

import com.couchreplicator.enums.ReplicationDirectionEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ReplicationRequest {

    private final ClusterEndpoint source;

    private final ClusterEndpoint target;

    private final String databaseName;

    private final boolean continuous;

    private final ReplicationDirectionEnum direction;

    public static ReplicationRequest oneShot(
            ClusterEndpoint source,
            ClusterEndpoint target,
            String databaseName,
            ReplicationDirectionEnum direction) {
        return new ReplicationRequest(source, target, databaseName, false, direction);
    }

    public ReplicationRequest toContinuous() {
        return new ReplicationRequest(this.source, this.target, this.databaseName, true, this.direction);
    }

    public ClusterEndpoint getIssuingEndpoint() {
        return this.direction == ReplicationDirectionEnum.TARGET ? this.target : this.source;
    }
}
