package com.couchreplicator.runner;

import com.couchreplicator.enums.ExitStatusEnum;
import com.couchreplicator.enums.ReplicationDirectionEnum;
import com.couchreplicator.exception.ConfigException;
import com.couchreplicator.exception.DiscoveryException;
import com.couchreplicator.model.internal.ClusterEndpoint;
import com.couchreplicator.model.internal.DatabaseSelection;
import com.couchreplicator.model.internal.JobOptions;
import com.couchreplicator.model.internal.RunSummary;
import com.couchreplicator.service.couchdb.ClusterClient;
import com.couchreplicator.service.couchdb.ClusterClientFactory;
import com.couchreplicator.service.progress.ProgressReporter;
import com.couchreplicator.service.replication.JobScheduler;
import com.couchreplicator.service.replication.ReplicationJobFactory;
import com.couchreplicator.service.selector.DatabaseSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Component
public class ReplicatorCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final String APPLICATION_LOGGER = "com.couchreplicator";

    private static final String CLUSTER_CLIENT_LOGGER = "com.couchreplicator.service.couchdb";

    private final ClusterClientFactory clusterClientFactory;

    private final DatabaseSelector databaseSelector;

    private final JobScheduler jobScheduler;

    private final ProgressReporter progressReporter;

    private final LoggingSystem loggingSystem;

    @Value("${couchdb.replicator.default-concurrency:5}")
    private int defaultConcurrency;

    @Value("${couchdb.replicator.transient-retry.max-attempts:3}")
    private int maxTransientAttempts;

    @Value("${couchdb.replicator.transient-retry.backoff-sec:5}")
    private long transientBackoffSec;

    @Value("${couchdb.replicator.source-ssl-bundle:}")
    private String sourceSslBundle;

    @Value("${couchdb.replicator.target-ssl-bundle:}")
    private String targetSslBundle;

    private volatile int exitCode = ExitStatusEnum.SUCCESS.getCode();

    @Autowired
    public ReplicatorCommandLineRunner(
            ClusterClientFactory clusterClientFactory,
            DatabaseSelector databaseSelector,
            JobScheduler jobScheduler,
            ProgressReporter progressReporter,
            LoggingSystem loggingSystem) {
        this.clusterClientFactory = clusterClientFactory;
        this.databaseSelector = databaseSelector;
        this.jobScheduler = jobScheduler;
        this.progressReporter = progressReporter;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(ReplicationCommand.HELP)) {
            System.out.println(ReplicationCommand.usage());
            return;
        }
        try {
            ReplicationCommand command = ReplicationCommand.parse(args, this.defaultConcurrency);
            this.applyVerbosity(command);
            log.debug("command is {}", command);
            RunSummary runSummary = this.replicate(command);
            this.exitCode = runSummary.getExitCode();
        } catch (ConfigException e) {
            log.error("configuration error. {}", e.toString());
            System.err.println(ReplicationCommand.usage());
            this.exitCode = ExitStatusEnum.CONFIG_ERROR.getCode();
        } catch (DiscoveryException e) {
            log.error("database discovery failed. {}", e.toString());
            this.exitCode = ExitStatusEnum.DISCOVERY_ERROR.getCode();
        }
    }

    public RunSummary replicate(ReplicationCommand command) throws ConfigException, DiscoveryException {
        ClusterEndpoint sourceEndpoint = ClusterEndpoint.of(command.getSourceUrl(), this.sourceSslBundle);
        ClusterEndpoint targetEndpoint = ClusterEndpoint.of(command.getTargetUrl(), this.targetSslBundle);
        ClusterClient sourceClient = this.clusterClientFactory.create(sourceEndpoint, "source");
        ClusterClient targetClient = this.clusterClientFactory.create(targetEndpoint, "target");

        DatabaseSelection selection = this.databaseSelector.select(command.getSelectionPolicy(), sourceClient);

        JobOptions jobOptions = new JobOptions(
                ReplicationDirectionEnum.fromUseTarget(command.isUseTarget()),
                command.isPermanent(),
                this.maxTransientAttempts,
                Duration.ofSeconds(this.transientBackoffSec)
        );
        ReplicationJobFactory jobFactory = new ReplicationJobFactory(sourceClient, targetClient, jobOptions);
        this.progressReporter.setQuiet(command.isQuiet());
        log.info("Replicating {} database(s) from {} to {}, concurrency {}, {}'s _replicate API{}",
                selection.getDatabases().size(),
                sourceEndpoint,
                targetEndpoint,
                command.getConcurrency(),
                jobOptions.getDirection().getName().toLowerCase(),
                command.isPermanent() ? ", permanent" : "");

        RunSummary runSummary = this.jobScheduler.run(
                selection,
                command.getConcurrency(),
                jobFactory,
                this.progressReporter
        );
        this.progressReporter.printSummary(runSummary);
        if (runSummary.isSuccess()) {
            log.info("Replication finished. {}", runSummary);
        } else {
            log.error("Replication finished with failures. {}", runSummary);
        }
        return runSummary;
    }

    @Override
    public int getExitCode() {
        return this.exitCode;
    }

    private void applyVerbosity(ReplicationCommand command) {
        if (command.isVerbose()) {
            this.loggingSystem.setLogLevel(APPLICATION_LOGGER, LogLevel.DEBUG);
        }
        if (command.isDebug()) {
            this.loggingSystem.setLogLevel(CLUSTER_CLIENT_LOGGER, LogLevel.TRACE);
        }
    }
}
