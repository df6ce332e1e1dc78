package com.couchreplicator.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;

import java.util.Map;
import java.util.Set;

@AllArgsConstructor
@Getter
public enum JobStateEnum {

    PENDING("PENDING"),

    REPLICATING("REPLICATING"),

    SUCCEEDED("SUCCEEDED"),

    FAILED("FAILED"),

    // only after SUCCEEDED and only in permanent mode
    CONTINUOUS_ESTABLISHED("CONTINUOUS_ESTABLISHED"),

    ;

    private final String name;

    private static final Map<JobStateEnum, Set<JobStateEnum>> VALID_TRANSITIONS = Map.of(
            PENDING, Set.of(REPLICATING, FAILED),
            REPLICATING, Set.of(SUCCEEDED, FAILED),
            SUCCEEDED, Set.of(CONTINUOUS_ESTABLISHED),
            FAILED, Set.of(),
            CONTINUOUS_ESTABLISHED, Set.of()
    );

    public static boolean isTransitionProhibit(JobStateEnum from, JobStateEnum to) {
        if (ObjectUtils.anyNull(from, to)) {
            return true;
        }
        Set<JobStateEnum> validNextStates = VALID_TRANSITIONS.get(from);
        if (CollectionUtils.isEmpty(validNextStates)) {
            return true;
        }
        return !validNextStates.contains(to);
    }

    public boolean isTerminal() {
        return this == FAILED || this == SUCCEEDED || this == CONTINUOUS_ESTABLISHED;
    }
}
