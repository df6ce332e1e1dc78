package com.couchreplicator.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Which cluster's {@code _replicate} endpoint drives the transfer.
 */
@AllArgsConstructor
@Getter
public enum ReplicationDirectionEnum {

    SOURCE("SOURCE"),

    TARGET("TARGET"),

    ;

    private final String name;

    public static ReplicationDirectionEnum fromUseTarget(boolean useTarget) {
        return useTarget ? TARGET : SOURCE;
    }
}
