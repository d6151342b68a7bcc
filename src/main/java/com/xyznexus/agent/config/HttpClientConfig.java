package com.xyznexus.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient behind the reasoning service RestClient.
 *
 * Reasoning calls are the main blocking point of a run, so connect and
 * response timeouts are always set; a stalled provider surfaces as a
 * ResourceAccessException (retried) instead of holding a specialist thread forever.
 * Pool size covers every concurrent specialist loop.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean("reasoningRestClientBuilder")
    public RestClient.Builder reasoningRestClientBuilder(NexusProperties properties) {
        NexusProperties.Http http = properties.getHttp();

        PoolingHttpClientConnectionManager connectionManager =
                PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(http.getMaxConnections())
                        .setMaxConnPerRoute(http.getMaxConnections())
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.ofMilliseconds(http.getConnectTimeout().toMillis()))
                                .setSocketTimeout(Timeout.ofMilliseconds(http.getReadTimeout().toMillis()))
                                .build())
                        .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(http.getReadTimeout().toMillis()))
                        .build())
                .build();

        log.info("Reasoning HttpClient configured [maxConnections={}, connectTimeout={}, readTimeout={}]",
                http.getMaxConnections(), http.getConnectTimeout(), http.getReadTimeout());

        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
