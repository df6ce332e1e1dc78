package com.couchreplicator.service.replication;

import com.couchreplicator.enums.JobOutcomeEnum;
import com.couchreplicator.exception.ConfigException;
import com.couchreplicator.model.internal.DatabaseSelection;
import com.couchreplicator.model.internal.JobResult;
import com.couchreplicator.model.internal.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one job per database on a pool of {@code concurrencyLimit} threads. Databases are
 * dispatched in the given order; a job failure never stops the others.
 */
@Slf4j
@Service
public class JobScheduler implements DisposableBean {

    private static final long POLL_INTERVAL_MS = 500;

    private final Duration shutdownGracePeriod;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    // counted down when the current run returns
    private volatile CountDownLatch runFinished = new CountDownLatch(0);

    private volatile ActiveRun activeRun;

    @Autowired
    public JobScheduler(@Value("${couchdb.replicator.shutdown-grace-period-sec:30}") long shutdownGracePeriodSec) {
        this.shutdownGracePeriod = Duration.ofSeconds(shutdownGracePeriodSec);
    }

    public RunSummary run(
            Collection<String> databases,
            int concurrencyLimit,
            ReplicationJobFactory jobFactory) throws ConfigException {
        return this.run(databases, concurrencyLimit, jobFactory, JobEventListener.NOOP);
    }

    public RunSummary run(
            Collection<String> databases,
            int concurrencyLimit,
            ReplicationJobFactory jobFactory,
            JobEventListener listener) throws ConfigException {
        return this.run(new DatabaseSelection(new LinkedHashSet<>(databases), List.of()),
                concurrencyLimit, jobFactory, listener);
    }

    public RunSummary run(
            DatabaseSelection selection,
            int concurrencyLimit,
            ReplicationJobFactory jobFactory,
            JobEventListener listener) throws ConfigException {
        if (concurrencyLimit < 1) {
            throw new ConfigException("run failed. concurrency must be >= 1. concurrency is %d"
                    .formatted(concurrencyLimit));
        }
        List<String> orderedDatabases = List.copyOf(selection.getDatabases());
        RunSummary runSummary = new RunSummary(orderedDatabases.size(), selection.getSkipped().size());
        ActiveRun activeRun = new ActiveRun(orderedDatabases, runSummary, listener);
        this.runFinished = new CountDownLatch(1);
        CountDownLatch jobsFinished = new CountDownLatch(orderedDatabases.size());
        ThreadPoolTaskExecutor executor = this.createExecutor(concurrencyLimit);
        this.notify(() -> listener.onRunStarted(runSummary));
        this.activeRun = activeRun;
        // cancelled before the run, eg: shutdown during discovery
        if (this.cancelRequested.get()) {
            this.cancelPending(activeRun);
        }
        log.debug("dispatching {} database(s) with concurrency {}", orderedDatabases.size(), concurrencyLimit);
        try {
            for (String databaseName : orderedDatabases) {
                executor.execute(() -> {
                    try {
                        this.runJob(databaseName, jobFactory, activeRun);
                    } finally {
                        jobsFinished.countDown();
                    }
                });
            }
            this.awaitJobs(jobsFinished, activeRun);
        } finally {
            executor.shutdown();
            runSummary.finalizeSummary();
            this.activeRun = null;
            this.cancelRequested.set(false);
            this.runFinished.countDown();
        }
        this.notify(() -> listener.onRunFinished(runSummary));
        log.debug("run finished. {}", runSummary);
        return runSummary;
    }

    /**
     * Stop dispatching. Pending databases are recorded as cancelled right away, active ones get
     * the grace period to finish before they are abandoned. A cancel with no run in progress
     * applies to the next run.
     */
    public void cancel() {
        if (this.cancelRequested.compareAndSet(false, true)) {
            log.warn("cancel requested. no new replication will be started");
        }
        ActiveRun activeRun = this.activeRun;
        if (activeRun != null) {
            this.cancelPending(activeRun);
        }
    }

    public boolean isCancelRequested() {
        return this.cancelRequested.get();
    }

    @Override
    public void destroy() throws InterruptedException {
        this.cancel();
        if (this.runFinished.getCount() == 0) {
            return;
        }
        // let the running summary be finalized before the context goes away
        this.runFinished.await(this.shutdownGracePeriod.toMillis() + POLL_INTERVAL_MS * 4, TimeUnit.MILLISECONDS);
    }

    private void runJob(String databaseName, ReplicationJobFactory jobFactory, ActiveRun activeRun) {
        if (!activeRun.claim(databaseName)) {
            // resolved by cancel()
            return;
        }
        JobResult jobResult;
        if (this.cancelRequested.get()) {
            jobResult = JobResult.cancelled(databaseName);
        } else {
            this.notify(() -> activeRun.listener.onJobStarted(databaseName));
            try {
                jobResult = jobFactory.create(databaseName).execute();
            } catch (RuntimeException e) {
                log.error("*** Replication job of database {} crashed", databaseName, e);
                jobResult = JobResult.builder()
                        .databaseName(databaseName)
                        .outcome(JobOutcomeEnum.FAILED)
                        .errorDetail(e.toString())
                        .build();
            }
        }
        this.record(jobResult, activeRun);
    }

    private void cancelPending(ActiveRun activeRun) {
        for (String databaseName : activeRun.databases) {
            if (activeRun.claim(databaseName)) {
                log.info("Cancel pending replication of database {}", databaseName);
                this.record(JobResult.cancelled(databaseName), activeRun);
            }
        }
    }

    private void awaitJobs(CountDownLatch jobsFinished, ActiveRun activeRun) {
        boolean interrupted = false;
        Instant abandonAt = null;
        try {
            while (jobsFinished.getCount() > 0) {
                if (this.cancelRequested.get()) {
                    if (abandonAt == null) {
                        abandonAt = Instant.now().plus(this.shutdownGracePeriod);
                    } else if (Instant.now().isAfter(abandonAt)) {
                        this.abandon(activeRun);
                        return;
                    }
                }
                try {
                    jobsFinished.await(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                    this.cancel();
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void abandon(ActiveRun activeRun) {
        for (String databaseName : activeRun.databases) {
            if (!activeRun.runSummary.hasResult(databaseName)) {
                log.warn("Abandon replication of database {}", databaseName);
                this.record(JobResult.cancelled(databaseName), activeRun);
            }
        }
    }

    private void record(JobResult jobResult, ActiveRun activeRun) {
        if (activeRun.runSummary.record(jobResult)) {
            this.notify(() -> activeRun.listener.onJobFinished(jobResult, activeRun.runSummary));
        }
    }

    // a broken listener must not break the run
    private void notify(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("job event listener failed", e);
        }
    }

    private ThreadPoolTaskExecutor createExecutor(int concurrencyLimit) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrencyLimit);
        executor.setMaxPoolSize(concurrencyLimit);
        executor.setThreadNamePrefix("Replication-Job-Thread-");
        // abandoned jobs are interrupted on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // each database is claimed once, either by its worker or by cancel()
    private static final class ActiveRun {

        private final List<String> databases;

        private final RunSummary runSummary;

        private final JobEventListener listener;

        private final Set<String> claimed = ConcurrentHashMap.newKeySet();

        private ActiveRun(List<String> databases, RunSummary runSummary, JobEventListener listener) {
            this.databases = databases;
            this.runSummary = runSummary;
            this.listener = listener;
        }

        private boolean claim(String databaseName) {
            return this.claimed.add(databaseName);
        }
    }
}
