package com.couchreplicator.model.internal;

import com.couchreplicator.enums.ReplicationDirectionEnum;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Getter
@AllArgsConstructor
@ToString
public class JobOptions {

    private final ReplicationDirectionEnum direction;

    // add continuous replication after the initial one
    private final boolean permanent;

    private final int maxTransientAttempts;

    private final Duration transientBackoff;
}
