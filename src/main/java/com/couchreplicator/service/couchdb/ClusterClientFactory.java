package com.couchreplicator.service.couchdb;

import com.couchreplicator.exception.ConfigException;
import com.couchreplicator.model.internal.ClusterEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ssl.NoSuchSslBundleException;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

@Slf4j
@Service
public class ClusterClientFactory {

    private final RestClient.Builder restClientBuilder;

    private final SslBundles sslBundles;

    private final Duration connectTimeout;

    @Autowired
    public ClusterClientFactory(
            RestClient.Builder restClientBuilder,
            SslBundles sslBundles,
            @Value("${couchdb.replicator.connect-timeout-sec:30}") long connectTimeoutSec) {
        this.restClientBuilder = restClientBuilder;
        this.sslBundles = sslBundles;
        this.connectTimeout = Duration.ofSeconds(connectTimeoutSec);
    }

    public ClusterClient create(ClusterEndpoint endpoint, String clusterName) throws ConfigException {
        return new ClusterClient(endpoint, new CouchDbService(this.buildRestClient(endpoint), clusterName));
    }

    private RestClient buildRestClient(ClusterEndpoint endpoint) {
        HttpClient.Builder httpClientBuilder = HttpClient.newBuilder()
                .connectTimeout(this.connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (endpoint.getSslBundle() != null) {
            try {
                httpClientBuilder.sslContext(
                        this.sslBundles.getBundle(endpoint.getSslBundle()).createSslContext());
            } catch (NoSuchSslBundleException e) {
                throw new ConfigException("buildRestClient failed. ssl bundle %s is not configured"
                        .formatted(endpoint.getSslBundle()), e);
            }
        }
        // no read timeout, a one-shot replication may run for hours
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClientBuilder.build());
        return this.restClientBuilder.clone()
                .requestFactory(requestFactory)
                .baseUrl(endpoint.getBaseUrl())
                .defaultHeaders(headers -> {
                    if (endpoint.hasCredentials()) {
                        headers.setBasicAuth(endpoint.getUsername(), endpoint.getPassword());
                    }
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                })
                .build();
    }
}
