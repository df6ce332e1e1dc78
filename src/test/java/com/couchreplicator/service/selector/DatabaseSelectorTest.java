package com.couchreplicator.service.selector;

import com.couchreplicator.exception.DiscoveryException;
import com.couchreplicator.exception.EmptySelectionException;
import com.couchreplicator.model.internal.ClusterEndpoint;
import com.couchreplicator.model.internal.DatabaseSelection;
import com.couchreplicator.model.internal.SelectionPolicy;
import com.couchreplicator.service.couchdb.ClusterClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DatabaseSelectorTest {

    private final DatabaseSelector databaseSelector = new DatabaseSelector();

    private ClusterClient sourceClient;

    @BeforeEach
    void setUp() {
        sourceClient = mock(ClusterClient.class);
        when(sourceClient.getEndpoint()).thenReturn(ClusterEndpoint.of("http://source.example:5984"));
    }

    @Test
    void replicateAllWithSkipListShouldLeaveOnlyUserDatabases() {
        // Given
        when(sourceClient.listDatabases()).thenReturn(new LinkedHashSet<>(List.of("db1", "db2", "db3", "_users")));
        SelectionPolicy policy = SelectionPolicy.all(List.of("db1", "db2"), false);

        // When
        DatabaseSelection selection = databaseSelector.select(policy, sourceClient);

        // Then
        assertEquals(List.of("db3"), new ArrayList<>(selection.getDatabases()));
        assertEquals(List.of("db1", "db2", "_users"), selection.getSkipped());
    }

    @Test
    void explicitDatabasesShouldBeKeptInOrderWithoutDiscovery() {
        SelectionPolicy policy = SelectionPolicy.explicit(List.of("db1", "db2", "db3"));

        DatabaseSelection selection = databaseSelector.select(policy, sourceClient);

        assertEquals(List.of("db1", "db2", "db3"), new ArrayList<>(selection.getDatabases()));
        verify(sourceClient, never()).listDatabases();
    }

    @Test
    void explicitDuplicatesShouldBeRemoved() {
        SelectionPolicy policy = SelectionPolicy.explicit(List.of("db2", "db1", "db2", "db1"));

        DatabaseSelection selection = databaseSelector.select(policy, sourceClient);

        assertEquals(List.of("db2", "db1"), new ArrayList<>(selection.getDatabases()));
    }

    @Test
    void systemDatabasesShouldBeKeptWhenRequested() {
        when(sourceClient.listDatabases()).thenReturn(new LinkedHashSet<>(List.of("_replicator", "_users", "db1")));

        DatabaseSelection selection = databaseSelector.select(SelectionPolicy.all(List.of("_replicator"), true), sourceClient);

        assertEquals(List.of("_users", "db1"), new ArrayList<>(selection.getDatabases()));
    }

    @Test
    void explicitSystemDatabaseShouldBeDroppedWithoutSystemFlag() {
        SelectionPolicy policy = SelectionPolicy.of(List.of("_users", "db1"), false, List.of(), false);

        DatabaseSelection selection = databaseSelector.select(policy, sourceClient);

        assertEquals(Set.of("db1"), selection.getDatabases());
    }

    @Test
    void emptySelectionShouldBeSignalled() {
        when(sourceClient.listDatabases()).thenReturn(new LinkedHashSet<>(List.of("_users", "db1")));

        assertThrows(EmptySelectionException.class,
                () -> databaseSelector.select(SelectionPolicy.all(List.of("db1"), false), sourceClient));
        verify(sourceClient, never()).replicate(any());
    }

    @Test
    void discoveryFailureShouldPropagate() {
        when(sourceClient.listDatabases()).thenThrow(new DiscoveryException("listDatabases failed."));

        assertThrows(DiscoveryException.class,
                () -> databaseSelector.select(SelectionPolicy.all(List.of(), false), sourceClient));
    }

    @Test
    void selectionShouldNeverContainDuplicatesSkippedOrSystemDatabases() {
        Random random = new Random(42);
        List<String> universe = List.of("db1", "db2", "db3", "db4", "_users", "_replicator", "_global_changes", "a/b");
        for (int round = 0; round < 200; round++) {
            List<String> discovered = new ArrayList<>();
            for (int i = 0; i < 1 + random.nextInt(12); i++) {
                discovered.add(universe.get(random.nextInt(universe.size())));
            }
            List<String> skip = new ArrayList<>();
            for (int i = 0; i < random.nextInt(4); i++) {
                skip.add(universe.get(random.nextInt(universe.size())));
            }
            ClusterClient client = mock(ClusterClient.class);
            when(client.listDatabases()).thenReturn(new LinkedHashSet<>(discovered));
            SelectionPolicy policy = SelectionPolicy.all(skip, false);

            DatabaseSelection selection;
            try {
                selection = databaseSelector.select(policy, client);
            } catch (EmptySelectionException e) {
                assertTrue(discovered.stream().allMatch(db -> skip.contains(db) || db.startsWith("_")));
                continue;
            }
            List<String> selected = new ArrayList<>(selection.getDatabases());
            assertEquals(new HashSet<>(selected).size(), selected.size());
            for (String db : selected) {
                assertFalse(skip.contains(db), "skipped database %s selected".formatted(db));
                assertFalse(db.startsWith("_"), "system database %s selected".formatted(db));
                assertTrue(discovered.contains(db));
            }
        }
    }
}
