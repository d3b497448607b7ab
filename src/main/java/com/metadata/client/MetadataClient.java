package com.metadata.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * Entry point for talking to the metadata server: one shared {@link RestClient} behind the
 * users and health endpoint groups.
 *
 * <pre>
 * MetadataClient client = new MetadataClient(ClientConfig.of("http://localhost:8000").withToken(token));
 * ApiResponse&lt;UserBody&gt; created = client.users().create(new UserBody("123456782", "A", "+972501234567", "X"));
 * </pre>
 */
public class MetadataClient {

    private static final Logger log = LoggerFactory.getLogger(MetadataClient.class);

    private final UsersApi users;
    private final HealthApiClient health;

    public MetadataClient(ClientConfig config) {
        this(config, RestClient.builder().requestFactory(requestFactory(config)));
    }

    /**
     * Builds on a caller-supplied builder, whose request factory is left untouched.
     */
    public MetadataClient(ClientConfig config, RestClient.Builder builder) {
        builder.baseUrl(config.baseUrl());
        if (config.hasToken()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, config.prefix() + " " + config.token());
        }
        RestClient restClient = builder.build();
        this.users = new UsersApiClient(restClient);
        this.health = new HealthApiClient(restClient);
        log.debug("Metadata client for {} (authenticated={})", config.baseUrl(), config.hasToken());
    }

    public UsersApi users() {
        return users;
    }

    public HealthApiClient health() {
        return health;
    }

    private static JdkClientHttpRequestFactory requestFactory(ClientConfig config) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(config.timeout())
            .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(config.timeout());
        return factory;
    }
}
