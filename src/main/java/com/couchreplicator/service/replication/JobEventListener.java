package com.couchreplicator.service.replication;

import com.couchreplicator.model.internal.JobResult;
import com.couchreplicator.model.internal.RunSummary;

/**
 * Callbacks from the scheduler. {@link #onJobStarted} and {@link #onJobFinished} are invoked from
 * worker threads, and {@link #onJobFinished} also from the thread calling cancel.
 */
public interface JobEventListener {

    JobEventListener NOOP = new JobEventListener() {};

    default void onRunStarted(RunSummary runSummary) {}

    default void onJobStarted(String databaseName) {}

    default void onJobFinished(JobResult jobResult, RunSummary runSummary) {}

    default void onRunFinished(RunSummary runSummary) {}
}
