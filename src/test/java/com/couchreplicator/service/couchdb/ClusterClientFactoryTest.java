package com.couchreplicator.service.couchdb;

import com.couchreplicator.exception.ConfigException;
import com.couchreplicator.model.internal.ClusterEndpoint;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ssl.DefaultSslBundleRegistry;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;

class ClusterClientFactoryTest {

    private final ClusterClientFactory factory =
            new ClusterClientFactory(RestClient.builder(), new DefaultSslBundleRegistry(), 5);

    @Test
    void createShouldBindClientToEndpoint() {
        ClusterEndpoint endpoint = ClusterEndpoint.of("http://admin:pw@localhost:5984");

        ClusterClient client = factory.create(endpoint, "source");

        assertSame(endpoint, client.getEndpoint());
    }

    @Test
    void unknownSslBundleShouldBeConfigError() {
        ClusterEndpoint endpoint = ClusterEndpoint.of("https://localhost:6984", "missing-bundle");

        assertThrows(ConfigException.class, () -> factory.create(endpoint, "target"));
    }
}
