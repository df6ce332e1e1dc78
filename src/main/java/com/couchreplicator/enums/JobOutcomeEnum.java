package com.couchreplicator.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum JobOutcomeEnum {

    SUCCEEDED("SUCCEEDED"),

    FAILED("FAILED"),

    ;

    private final String name;
}
