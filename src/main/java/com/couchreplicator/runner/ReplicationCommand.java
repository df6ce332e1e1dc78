package com.couchreplicator.runner;

import com.couchreplicator.exception.ConfigException;
import com.couchreplicator.model.internal.SelectionPolicy;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Validated command line. Built once, before any request is sent.
 */
@Getter
@ToString
public class ReplicationCommand {

    public static final String SOURCE = "source";

    public static final String TARGET = "target";

    public static final String ALL = "all";

    public static final String SKIP = "skip";

    public static final String CONCURRENCY = "concurrency";

    public static final String USE_TARGET = "use_target";

    public static final String SYSTEM_DBS = "system_dbs";

    public static final String PERMANENT = "permanent";

    public static final String VERBOSE = "verbose";

    public static final String QUIET = "quiet";

    public static final String DEBUG = "debug";

    public static final String HELP = "help";

    @ToString.Exclude
    private final String sourceUrl;

    @ToString.Exclude
    private final String targetUrl;

    private final SelectionPolicy selectionPolicy;

    private final int concurrency;

    private final boolean useTarget;

    private final boolean permanent;

    private final boolean verbose;

    private final boolean quiet;

    private final boolean debug;

    private ReplicationCommand(
            String sourceUrl,
            String targetUrl,
            SelectionPolicy selectionPolicy,
            int concurrency,
            boolean useTarget,
            boolean permanent,
            boolean verbose,
            boolean quiet,
            boolean debug) {
        this.sourceUrl = sourceUrl;
        this.targetUrl = targetUrl;
        this.selectionPolicy = selectionPolicy;
        this.concurrency = concurrency;
        this.useTarget = useTarget;
        this.permanent = permanent;
        this.verbose = verbose;
        this.quiet = quiet;
        this.debug = debug;
    }

    public static ReplicationCommand parse(ApplicationArguments args, int defaultConcurrency) throws ConfigException {
        String sourceUrl = singleValue(args, SOURCE);
        String targetUrl = singleValue(args, TARGET);
        if (StringUtils.isAnyBlank(sourceUrl, targetUrl)) {
            throw new ConfigException("parse failed. --source and --target are required");
        }
        int concurrency = defaultConcurrency;
        String concurrencyValue = singleValue(args, CONCURRENCY);
        if (concurrencyValue != null) {
            try {
                concurrency = Integer.parseInt(concurrencyValue.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException("parse failed. --concurrency is not a number. value is %s"
                        .formatted(concurrencyValue), e);
            }
        }
        if (concurrency < 1) {
            throw new ConfigException("parse failed. --concurrency must be >= 1. value is %d".formatted(concurrency));
        }
        SelectionPolicy selectionPolicy = SelectionPolicy.of(
                args.getNonOptionArgs(),
                args.containsOption(ALL),
                parseSkipList(optionValues(args, SKIP)),
                args.containsOption(SYSTEM_DBS)
        );
        return new ReplicationCommand(
                sourceUrl,
                targetUrl,
                selectionPolicy,
                concurrency,
                args.containsOption(USE_TARGET),
                args.containsOption(PERMANENT),
                args.containsOption(VERBOSE),
                args.containsOption(QUIET),
                args.containsOption(DEBUG)
        );
    }

    // --skip=a,b --skip=c
    static List<String> parseSkipList(List<String> values) {
        List<String> result = new ArrayList<>();
        if (CollectionUtils.isEmpty(values)) {
            return result;
        }
        for (String value : values) {
            if (StringUtils.isBlank(value)) {
                continue;
            }
            Arrays.stream(StringUtils.split(value, ','))
                    .map(String::trim)
                    .filter(StringUtils::isNotEmpty)
                    .forEach(result::add);
        }
        return result;
    }

    private static String singleValue(ApplicationArguments args, String name) throws ConfigException {
        List<String> values = optionValues(args, name);
        if (values == null) {
            return null;
        }
        if (values.size() > 1) {
            throw new ConfigException("parse failed. --%s given more than once".formatted(name));
        }
        return values.get(0);
    }

    // "--name value" parses as a bare option plus a positional argument, which would become a database name
    private static List<String> optionValues(ApplicationArguments args, String name) throws ConfigException {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        if (CollectionUtils.isEmpty(values)) {
            throw new ConfigException("parse failed. --%s needs a value, use --%s=<value>".formatted(name, name));
        }
        return values;
    }

    public static String usage() {
        return """
                Replicate databases between couchdb clusters

                usage: couchdb-replicator --source=<url> --target=<url> [options] [DB ...]

                required named arguments:
                  --source=<url>       The URL for the CouchDB cluster from which we will be replicating
                  --target=<url>       The URL for the CouchDB cluster to which we will be replicating

                positional arguments:
                  DB                   Databases to replicate

                optional arguments:
                  --help               Show this help message and exit
                  --all                Replicate all dbs from source to destination.
                                       Use with --skip to replicate "all but ..."
                  --skip=<db,db,...>   Comma-separated list of db to skip (i.e. NOT synchronize)
                  --concurrency=<n>    Maximum number of simultaneous replications
                  --use_target         Use the target's _replicate API when replicating.
                                       By default, the source's _replicate API is used
                  --system_dbs         Do not skip "system" databases starting with underscore
                                       such as _users, _global_changes, etc...
                  --permanent          Add permanent continuous replication after first initial replication
                  --verbose            Verbose
                  --quiet              Quiet. Do not show progress bar
                  --debug              Debug info such as details of the requests and responses.
                                       Useful for determining why long replications are failing
                """;
    }
}
