package com.couchreplicator.model.couchdb.global;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorInfo { // CouchDB error body, eg: {"error":"not_found","reason":"Database does not exist."}

    private String error;

    private String reason;
}
