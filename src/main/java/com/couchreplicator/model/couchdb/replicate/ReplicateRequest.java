package com.couchreplicator.model.couchdb.replicate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplicateRequest {

    // full database url, credentials included
    private String source;

    private String target;

    @JsonProperty("create_target")
    private boolean createTarget = true;

    // omitted for one-shot replication
    private Boolean continuous;

    public ReplicateRequest(String source, String target) {
        this.source = source;
        this.target = target;
    }

    public void continuous() {
        this.continuous = Boolean.TRUE;
    }
}
