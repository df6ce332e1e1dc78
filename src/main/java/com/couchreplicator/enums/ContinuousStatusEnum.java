package com.couchreplicator.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ContinuousStatusEnum {

    NOT_REQUESTED("NOT_REQUESTED"),

    ESTABLISHED("ESTABLISHED"),

    // initial replication succeeded, continuous setup did not
    FAILED("FAILED"),

    ;

    private final String name;
}
