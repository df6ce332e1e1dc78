package com.couchreplicator.service.replication;

import com.couchreplicator.enums.ContinuousStatusEnum;
import com.couchreplicator.enums.JobOutcomeEnum;
import com.couchreplicator.enums.JobStateEnum;
import com.couchreplicator.exception.ReplicatorException;
import com.couchreplicator.exception.TransientException;
import com.couchreplicator.model.internal.JobOptions;
import com.couchreplicator.model.internal.JobResult;
import com.couchreplicator.model.internal.ReplicationRequest;
import com.couchreplicator.service.couchdb.ClusterClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * Drives one database through a one-shot replication and, in permanent mode, a continuous one.
 * <p>
 * PENDING -> REPLICATING -> SUCCEEDED | FAILED, then SUCCEEDED -> CONTINUOUS_ESTABLISHED when
 * the continuous request is accepted. A failed continuous request leaves the job SUCCEEDED and
 * is reported on the result. Failed jobs are not retried, only transient errors within one
 * attempt budget are.
 */
@Slf4j
public class ReplicationJob {

    @Getter
    private final String databaseName;

    private final ClusterClient issuingClient;

    @Getter
    private final ReplicationRequest replicationRequest;

    private final JobOptions jobOptions;

    @Getter
    private volatile JobStateEnum state = JobStateEnum.PENDING;

    private int attempts;

    public ReplicationJob(
            ClusterClient issuingClient,
            ReplicationRequest replicationRequest,
            JobOptions jobOptions) {
        this.databaseName = replicationRequest.getDatabaseName();
        this.issuingClient = issuingClient;
        this.replicationRequest = replicationRequest;
        this.jobOptions = jobOptions;
    }

    public JobResult execute() {
        Instant startTime = Instant.now();
        this.transitionTo(JobStateEnum.REPLICATING);
        log.info("Starting replication of database {}", this.databaseName);
        try {
            this.replicateWithRetry(this.replicationRequest);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            this.transitionTo(JobStateEnum.FAILED);
            log.warn("Replication of database {} cancelled", this.databaseName);
            return this.buildResult(JobOutcomeEnum.FAILED, JobResult.CANCELLED, startTime)
                    .build();
        } catch (RuntimeException e) {
            this.transitionTo(JobStateEnum.FAILED);
            String errorDetail = e.toString();
            log.error("*** Failed to replicate database {}. error is {}", this.databaseName, errorDetail);
            return this.buildResult(JobOutcomeEnum.FAILED, errorDetail, startTime).build();
        }
        this.transitionTo(JobStateEnum.SUCCEEDED);
        log.info("Replication of database {} successful", this.databaseName);
        if (!this.jobOptions.isPermanent()) {
            return this.buildResult(JobOutcomeEnum.SUCCEEDED, null, startTime).build();
        }
        return this.establishContinuous(startTime);
    }

    private JobResult establishContinuous(Instant startTime) {
        log.info("Setting up continuous replication of database {}", this.databaseName);
        try {
            this.replicateWithRetry(this.replicationRequest.toContinuous());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return this.continuousFailed(JobResult.CANCELLED, startTime);
        } catch (RuntimeException e) {
            return this.continuousFailed(e.toString(), startTime);
        }
        this.transitionTo(JobStateEnum.CONTINUOUS_ESTABLISHED);
        log.info("Continuous replication of database {} successfully setup", this.databaseName);
        return this.buildResult(JobOutcomeEnum.SUCCEEDED, null, startTime)
                .continuousStatus(ContinuousStatusEnum.ESTABLISHED)
                .build();
    }

    private JobResult continuousFailed(String errorDetail, Instant startTime) {
        log.warn("*** Failed to setup continuous replication of database {}. error is {}",
                this.databaseName, errorDetail);
        return this.buildResult(JobOutcomeEnum.SUCCEEDED, null, startTime)
                .continuousStatus(ContinuousStatusEnum.FAILED)
                .continuousErrorDetail(errorDetail)
                .build();
    }

    private void replicateWithRetry(ReplicationRequest request) throws InterruptedException {
        int maxAttempts = Math.max(1, this.jobOptions.getMaxTransientAttempts());
        for (int attempt = 1; ; attempt++) {
            this.attempts++;
            try {
                this.issuingClient.replicate(request);
                return;
            } catch (TransientException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.debug("replicate database {} hit a transient error, attempt {}/{}. error is {}",
                        this.databaseName, attempt, maxAttempts, e.toString());
            }
            Duration backoff = this.jobOptions.getTransientBackoff();
            if (backoff != null && !backoff.isZero()) {
                Thread.sleep(backoff.toMillis());
            }
        }
    }

    private JobResult.JobResultBuilder buildResult(JobOutcomeEnum outcome, String errorDetail, Instant startTime) {
        return JobResult.builder()
                .databaseName(this.databaseName)
                .outcome(outcome)
                .errorDetail(errorDetail)
                .attempts(this.attempts)
                .duration(Duration.between(startTime, Instant.now()));
    }

    private void transitionTo(JobStateEnum next) {
        if (JobStateEnum.isTransitionProhibit(this.state, next)) {
            throw new ReplicatorException("transitionTo failed. database is %s, %s -> %s is prohibited"
                    .formatted(this.databaseName, this.state, next));
        }
        this.state = next;
    }
}
