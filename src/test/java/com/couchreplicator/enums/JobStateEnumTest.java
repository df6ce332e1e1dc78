package com.couchreplicator.enums;

import org.junit.jupiter.api.Test;

import static com.couchreplicator.enums.JobStateEnum.*;
import static org.junit.jupiter.api.Assertions.*;

class JobStateEnumTest {

    @Test
    void allowedTransitions() {
        assertFalse(isTransitionProhibit(PENDING, REPLICATING));
        assertFalse(isTransitionProhibit(REPLICATING, SUCCEEDED));
        assertFalse(isTransitionProhibit(REPLICATING, FAILED));
        assertFalse(isTransitionProhibit(SUCCEEDED, CONTINUOUS_ESTABLISHED));
    }

    @Test
    void continuousEstablishedOnlyReachableFromSucceeded() {
        assertTrue(isTransitionProhibit(FAILED, CONTINUOUS_ESTABLISHED));
        assertTrue(isTransitionProhibit(REPLICATING, CONTINUOUS_ESTABLISHED));
        assertTrue(isTransitionProhibit(PENDING, CONTINUOUS_ESTABLISHED));
    }

    @Test
    void failedIsTerminal() {
        for (JobStateEnum next : values()) {
            assertTrue(isTransitionProhibit(FAILED, next));
        }
        assertTrue(isTransitionProhibit(null, REPLICATING));
        assertTrue(FAILED.isTerminal());
        assertFalse(REPLICATING.isTerminal());
    }
}
