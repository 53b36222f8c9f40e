package com.numaansystems.obo.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared outbound HTTP client for the identity provider, Graph and Search.
 *
 * <p>One pooled client serves all requests. The same connect and response
 * timeouts apply to every downstream call; a timeout surfaces as an
 * {@link java.io.IOException} which callers turn into a
 * {@link com.numaansystems.obo.exception.TransportException}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class HttpClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean(destroyMethod = "close")
    public CloseableHttpClient oboHttpClient(OboProperties properties) {
        OboProperties.Http http = properties.http();

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(http.connectTimeout().toMillis()))
                .setSocketTimeout(Timeout.ofMilliseconds(http.responseTimeout().toMillis()))
                .build();

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(connectionConfig)
                .setMaxConnTotal(http.maxConnections())
                .setMaxConnPerRoute(http.maxConnections())
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(http.connectTimeout().toMillis()))
                .setResponseTimeout(Timeout.ofMilliseconds(http.responseTimeout().toMillis()))
                .build();

        logger.info("Outbound HTTP client initialized: connectTimeout={}, responseTimeout={}, maxConnections={}",
                http.connectTimeout(), http.responseTimeout(), http.maxConnections());

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build();
    }
}
