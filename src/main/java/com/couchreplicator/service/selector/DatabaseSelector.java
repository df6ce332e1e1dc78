package com.couchreplicator.service.selector;

import com.couchreplicator.exception.DiscoveryException;
import com.couchreplicator.exception.EmptySelectionException;
import com.couchreplicator.model.internal.DatabaseSelection;
import com.couchreplicator.model.internal.SelectionPolicy;
import com.couchreplicator.service.couchdb.ClusterClient;
import com.couchreplicator.util.DatabaseNameUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class DatabaseSelector {

    public DatabaseSelection select(SelectionPolicy policy, ClusterClient sourceClient)
            throws DiscoveryException, EmptySelectionException {
        Collection<String> candidates;
        if (policy.isReplicateAll()) {
            log.info("Getting list of all databases in source {}", sourceClient.getEndpoint());
            candidates = sourceClient.listDatabases();
        } else {
            candidates = policy.getExplicitDatabases();
        }
        Set<String> selected = new LinkedHashSet<>();
        List<String> skipped = new ArrayList<>();
        for (String databaseName : candidates) {
            if (StringUtils.isBlank(databaseName)) {
                log.debug("Skipping blank database name");
                continue;
            }
            if (policy.isSkipped(databaseName)) {
                log.debug("Skipping database {}", databaseName);
                skipped.add(databaseName);
                continue;
            }
            if (DatabaseNameUtil.isSystemDatabase(databaseName) && !policy.isIncludeSystemDatabases()) {
                log.debug("Skipping system database {}", databaseName);
                skipped.add(databaseName);
                continue;
            }
            if (!selected.add(databaseName)) {
                log.debug("Database {} given more than once", databaseName);
            }
        }
        if (selected.isEmpty()) {
            throw new EmptySelectionException("select failed. no database left to replicate. " +
                    "policy is %s, skipped is %s".formatted(policy, skipped));
        }
        log.info("{} database(s) selected, {} skipped", selected.size(), skipped.size());
        return new DatabaseSelection(selected, skipped);
    }
}
