package com.couchreplicator.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ExitStatusEnum {

    SUCCESS(0),

    // at least one database failed, every database was still attempted
    JOB_FAILED(1),

    CONFIG_ERROR(2),

    DISCOVERY_ERROR(3),

    ;

    private final int code;
}
