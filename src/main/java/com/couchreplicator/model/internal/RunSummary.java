package com.couchreplicator.model.internal;

import com.couchreplicator.enums.ExitStatusEnum;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of one run. Workers record results concurrently; all mutators and readers
 * synchronize on this instance. The first result recorded for a database wins.
 */
@Slf4j
public class RunSummary {

    private final int total;

    private final Map<String, JobResult> results = new LinkedHashMap<>();

    private int succeeded;

    private int failed;

    private final int skipped;

    private int continuousEstablished;

    private int continuousFailed;

    private final Instant startTime;

    private Instant endTime;

    public RunSummary(int total) {
        this(total, 0);
    }

    public RunSummary(int total, int skipped) {
        this(total, skipped, Instant.now());
    }

    public RunSummary(int total, int skipped, Instant startTime) {
        this.total = total;
        this.skipped = skipped;
        this.startTime = startTime;
    }

    /**
     * @return false if the database already had a result or the summary is finalized
     */
    public synchronized boolean record(JobResult jobResult) {
        if (this.endTime != null) {
            log.debug("summary finalized, drop late result {}", jobResult);
            return false;
        }
        if (this.results.putIfAbsent(jobResult.getDatabaseName(), jobResult) != null) {
            return false;
        }
        if (jobResult.isSucceeded()) {
            this.succeeded++;
        } else {
            this.failed++;
        }
        switch (jobResult.getContinuousStatus()) {
            case ESTABLISHED -> this.continuousEstablished++;
            case FAILED -> this.continuousFailed++;
            default -> { }
        }
        return true;
    }

    public synchronized boolean hasResult(String databaseName) {
        return this.results.containsKey(databaseName);
    }

    public synchronized void finalizeSummary() {
        if (this.endTime == null) {
            this.endTime = Instant.now();
        }
    }

    public synchronized boolean isFinalized() {
        return this.endTime != null;
    }

    public int getTotal() {
        return this.total;
    }

    public synchronized int getCompleted() {
        return this.succeeded + this.failed;
    }

    public synchronized int getSucceeded() {
        return this.succeeded;
    }

    public synchronized int getFailed() {
        return this.failed;
    }

    public int getSkipped() {
        return this.skipped;
    }

    public synchronized int getContinuousEstablished() {
        return this.continuousEstablished;
    }

    public synchronized int getContinuousFailed() {
        return this.continuousFailed;
    }

    public synchronized List<JobResult> getResults() {
        return Collections.unmodifiableList(new ArrayList<>(this.results.values()));
    }

    public synchronized List<JobResult> getFailedResults() {
        return this.results.values().stream().filter(r -> !r.isSucceeded()).toList();
    }

    public synchronized List<JobResult> getContinuousFailedResults() {
        return this.results.values().stream().filter(JobResult::isContinuousFailed).toList();
    }

    public Instant getStartTime() {
        return this.startTime;
    }

    public synchronized Instant getEndTime() {
        return this.endTime;
    }

    public synchronized Duration getElapsed() {
        return Duration.between(this.startTime, this.endTime == null ? Instant.now() : this.endTime);
    }

    // continuous setup failures alone never fail the run
    public synchronized boolean isSuccess() {
        return this.failed == 0 && this.succeeded == this.total;
    }

    public synchronized int getExitCode() {
        return isSuccess() ? ExitStatusEnum.SUCCESS.getCode() : ExitStatusEnum.JOB_FAILED.getCode();
    }

    @Override
    public synchronized String toString() {
        return "RunSummary(total=%d, succeeded=%d, failed=%d, skipped=%d, continuousEstablished=%d, continuousFailed=%d)"
                .formatted(this.total, this.succeeded, this.failed, this.skipped,
                        this.continuousEstablished, this.continuousFailed);
    }
}
