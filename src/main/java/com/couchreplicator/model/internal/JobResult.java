package com.couchreplicator.model.internal;

import com.couchreplicator.enums.ContinuousStatusEnum;
import com.couchreplicator.enums.JobOutcomeEnum;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Getter
@Builder
@ToString
public class JobResult {

    public static final String CANCELLED = "cancelled";

    private final String databaseName;

    private final JobOutcomeEnum outcome;

    // verbatim error chain, null on success
    private final String errorDetail;

    @Builder.Default
    private final ContinuousStatusEnum continuousStatus = ContinuousStatusEnum.NOT_REQUESTED;

    private final String continuousErrorDetail;

    private final int attempts;

    @Builder.Default
    private final Duration duration = Duration.ZERO;

    public static JobResult cancelled(String databaseName) {
        return JobResult.builder()
                .databaseName(databaseName)
                .outcome(JobOutcomeEnum.FAILED)
                .errorDetail(CANCELLED)
                .build();
    }

    public boolean isSucceeded() {
        return this.outcome == JobOutcomeEnum.SUCCEEDED;
    }

    public boolean isCancelled() {
        return this.outcome == JobOutcomeEnum.FAILED && CANCELLED.equals(this.errorDetail);
    }

    public boolean isContinuousFailed() {
        return this.continuousStatus == ContinuousStatusEnum.FAILED;
    }
}
