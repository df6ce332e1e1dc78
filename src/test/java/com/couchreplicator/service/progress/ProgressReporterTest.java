package com.couchreplicator.service.progress;

import com.couchreplicator.enums.ContinuousStatusEnum;
import com.couchreplicator.enums.JobOutcomeEnum;
import com.couchreplicator.model.internal.JobResult;
import com.couchreplicator.model.internal.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ProgressReporterTest {

    private ByteArrayOutputStream buffer;

    private PrintStream out;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @Test
    void renderBarShouldFillProportionally() {
        assertEquals("Progress: |█████-----| 50.0% Complete", ProgressReporter.renderBar(5, 10, 10));
        assertEquals("Progress: |----------| 0.0% Complete", ProgressReporter.renderBar(0, 10, 10));
        assertEquals("Progress: |██████████| 100.0% Complete", ProgressReporter.renderBar(10, 10, 10));
    }

    @Test
    void renderBarShouldTreatEmptyRunAsComplete() {
        assertEquals("Progress: |████| 100.0% Complete", ProgressReporter.renderBar(0, 0, 4));
    }

    @Test
    void nonInteractiveOutputShouldNotContainBar() {
        ProgressReporter reporter = new ProgressReporter(out, 10, false);
        RunSummary runSummary = new RunSummary(1);

        reporter.onRunStarted(runSummary);
        runSummary.record(success("db1"));
        reporter.onJobFinished(success("db1"), runSummary);
        runSummary.finalizeSummary();
        reporter.onRunFinished(runSummary);

        String output = output();
        assertTrue(output.contains("Replication started at"));
        assertTrue(output.contains("Replication ended at"));
        assertTrue(output.contains("Replication of 1 databases took"));
        assertFalse(output.contains("Progress:"));
    }

    @Test
    void interactiveOutputShouldDrawBar() {
        ProgressReporter reporter = new ProgressReporter(out, 10, true);
        RunSummary runSummary = new RunSummary(2);

        reporter.onRunStarted(runSummary);
        runSummary.record(success("db1"));
        reporter.onJobFinished(success("db1"), runSummary);

        assertTrue(output().contains("Progress: |█████-----| 50.0% Complete"));
    }

    @Test
    void quietShouldSuppressProgressButNotSummary() {
        ProgressReporter reporter = new ProgressReporter(out, 10, true);
        reporter.setQuiet(true);
        RunSummary runSummary = new RunSummary(1);

        reporter.onRunStarted(runSummary);
        runSummary.record(success("db1"));
        reporter.onJobFinished(success("db1"), runSummary);
        runSummary.finalizeSummary();
        reporter.onRunFinished(runSummary);
        assertEquals("", output());

        reporter.printSummary(runSummary);
        assertTrue(output().contains("Succeeded: 1, Failed: 0, Skipped: 0"));
    }

    @Test
    void printSummaryShouldListFailures() {
        ProgressReporter reporter = new ProgressReporter(out, 10, false);
        RunSummary runSummary = new RunSummary(3, 2);
        runSummary.record(success("db1"));
        runSummary.record(JobResult.builder()
                .databaseName("db2")
                .outcome(JobOutcomeEnum.FAILED)
                .errorDetail("NotFoundException : replicate failed.")
                .build());
        runSummary.record(JobResult.builder()
                .databaseName("db3")
                .outcome(JobOutcomeEnum.SUCCEEDED)
                .continuousStatus(ContinuousStatusEnum.FAILED)
                .continuousErrorDetail("ConflictException : replicate failed.")
                .build());
        runSummary.finalizeSummary();

        reporter.printSummary(runSummary);

        String output = output();
        assertTrue(output.contains("Succeeded: 2, Failed: 1, Skipped: 2"));
        assertTrue(output.contains("db2: NotFoundException : replicate failed."));
        assertTrue(output.contains("Continuous replication established: 0, failed: 1"));
        assertTrue(output.contains("continuous setup failed for db3: ConflictException : replicate failed."));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static JobResult success(String databaseName) {
        return JobResult.builder()
                .databaseName(databaseName)
                .outcome(JobOutcomeEnum.SUCCEEDED)
                .attempts(1)
                .build();
    }
}
