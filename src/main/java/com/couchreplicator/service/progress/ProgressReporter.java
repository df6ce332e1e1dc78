package com.couchreplicator.service.progress;

import com.couchreplicator.model.internal.JobResult;
import com.couchreplicator.model.internal.RunSummary;
import com.couchreplicator.service.replication.JobEventListener;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.time.DurationFormatUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Console progress bar plus start/end banner. The bar is only drawn on an interactive terminal.
 */
@Slf4j
@Component
public class ProgressReporter implements JobEventListener {

    private static final char FILL = '█';

    private static final String PREFIX = "Progress:";

    private static final String SUFFIX = "Complete";

    private final PrintStream out;

    private final int barLength;

    private final boolean interactive;

    @Setter
    private volatile boolean quiet;

    @Autowired
    public ProgressReporter(@Value("${couchdb.replicator.progress-bar-length:50}") int barLength) {
        this(System.out, barLength, System.console() != null);
    }

    public ProgressReporter(PrintStream out, int barLength, boolean interactive) {
        this.out = out;
        this.barLength = barLength;
        this.interactive = interactive;
    }

    @Override
    public void onRunStarted(RunSummary runSummary) {
        if (this.quiet) return;
        this.out.println("Replication started at %s".formatted(runSummary.getStartTime()));
        this.drawBar(0, runSummary.getTotal());
    }

    @Override
    public void onJobFinished(JobResult jobResult, RunSummary runSummary) {
        if (this.quiet) return;
        this.drawBar(runSummary.getCompleted(), runSummary.getTotal());
    }

    @Override
    public void onRunFinished(RunSummary runSummary) {
        if (this.quiet) return;
        if (this.interactive) {
            // wipe the bar
            this.out.print(StringUtils.repeat(' ', PREFIX.length() + this.barLength + SUFFIX.length() + 11) + "\r");
        }
        this.out.println("Replication ended at %s".formatted(runSummary.getEndTime()));
        this.out.println("Replication of %d databases took %s".formatted(
                runSummary.getTotal(),
                DurationFormatUtils.formatDurationHMS(runSummary.getElapsed().toMillis())));
    }

    public void printSummary(RunSummary runSummary) {
        this.out.println("Succeeded: %d, Failed: %d, Skipped: %d".formatted(
                runSummary.getSucceeded(), runSummary.getFailed(), runSummary.getSkipped()));
        List<JobResult> failedResults = runSummary.getFailedResults();
        if (CollectionUtils.isNotEmpty(failedResults)) {
            this.out.println("Failed databases:");
            failedResults.forEach(r -> this.out.println("  %s: %s".formatted(r.getDatabaseName(), r.getErrorDetail())));
        }
        if (runSummary.getContinuousEstablished() > 0 || runSummary.getContinuousFailed() > 0) {
            this.out.println("Continuous replication established: %d, failed: %d".formatted(
                    runSummary.getContinuousEstablished(), runSummary.getContinuousFailed()));
        }
        runSummary.getContinuousFailedResults().forEach(r -> this.out.println(
                "  continuous setup failed for %s: %s".formatted(r.getDatabaseName(), r.getContinuousErrorDetail())));
    }

    private synchronized void drawBar(int completed, int total) {
        if (!this.interactive) return;
        this.out.print(renderBar(completed, total, this.barLength) + "\r");
        this.out.flush();
    }

    public static String renderBar(int completed, int total, int length) {
        double ratio = total <= 0 ? 1.0 : Math.min(1.0, (double) completed / total);
        int filledLength = (int) (length * ratio);
        String bar = StringUtils.repeat(FILL, filledLength) + StringUtils.repeat('-', length - filledLength);
        return String.format(Locale.ROOT, "%s |%s| %.1f%% %s", PREFIX, bar, ratio * 100, SUFFIX);
    }
}
