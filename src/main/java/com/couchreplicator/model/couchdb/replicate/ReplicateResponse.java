package com.couchreplicator.model.couchdb.replicate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReplicateResponse {

    private boolean ok;

    // one-shot only
    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("source_last_seq")
    private Object sourceLastSeq;

    @JsonProperty("no_changes")
    private boolean noChanges;

    private List<Map<String, Object>> history;

    // continuous only, id of the running replication
    @JsonProperty("_local_id")
    private String localId;
}
