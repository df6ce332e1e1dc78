package com.couchreplicator.model.internal;

import com.couchreplicator.exception.ConfigException;
import com.couchreplicator.util.DatabaseNameUtil;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.collections4.CollectionUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Which databases a run should attempt. Explicit names and replicate-all are mutually
 * exclusive; exactly one of them must be given.
 */
@Getter
@ToString
public class SelectionPolicy {

    private final List<String> explicitDatabases;

    private final boolean replicateAll;

    private final Set<String> skipDatabases;

    private final boolean includeSystemDatabases;

    private SelectionPolicy(
            List<String> explicitDatabases,
            boolean replicateAll,
            Set<String> skipDatabases,
            boolean includeSystemDatabases) {
        this.explicitDatabases = explicitDatabases;
        this.replicateAll = replicateAll;
        this.skipDatabases = skipDatabases;
        this.includeSystemDatabases = includeSystemDatabases;
    }

    public static SelectionPolicy of(
            Collection<String> explicitDatabases,
            boolean replicateAll,
            Collection<String> skipDatabases,
            boolean includeSystemDatabases) throws ConfigException {
        List<String> explicit = explicitDatabases == null ? List.of() : new ArrayList<>(explicitDatabases);
        if (replicateAll && CollectionUtils.isNotEmpty(explicit)) {
            throw new ConfigException("SelectionPolicy failed. " +
                    "--all and explicit databases are mutually exclusive. databases are %s".formatted(explicit));
        }
        if (!replicateAll && CollectionUtils.isEmpty(explicit)) {
            throw new ConfigException("SelectionPolicy failed. need to specify databases to replicate or --all");
        }
        explicit.forEach(DatabaseNameUtil::validate);
        Set<String> skip = skipDatabases == null ? Set.of() : new LinkedHashSet<>(skipDatabases);
        return new SelectionPolicy(
                Collections.unmodifiableList(explicit),
                replicateAll,
                Collections.unmodifiableSet(skip),
                includeSystemDatabases);
    }

    public static SelectionPolicy explicit(Collection<String> databases) throws ConfigException {
        return of(databases, false, null, false);
    }

    public static SelectionPolicy all(Collection<String> skipDatabases, boolean includeSystemDatabases)
            throws ConfigException {
        return of(null, true, skipDatabases, includeSystemDatabases);
    }

    public boolean isSkipped(String databaseName) {
        return this.skipDatabases.contains(databaseName)
                || this.skipDatabases.contains(DatabaseNameUtil.encode(databaseName));
    }
}
