// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.config.rest;

import de.telekom.horizon.relay.config.RelayConfig;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.BasicHttpClientConnectionManager;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;


/**
 * The {@code HttpClientConfig} class for creating and configuring the HTTP clients of the relay.
 *
 * Outbound webhook calls share one pooled client with bounded timeouts. Inbound streams get a dedicated
 * single-connection client per listener, so a slow webhook can never hold up the stream of the same rule.
 */
@Configuration
public class HttpClientConfig {

    /**
     * The RelayConfig instance for retrieving configuration parameters.
     */
    private final RelayConfig relayConfig;

    /**
     * Construct of a new {@code HttpClientConfig} with the specified RelayConfig.
     * @param relayConfig The RelayConfig instance for retrieving configuration parameters.
     */
    @Autowired
    public HttpClientConfig(RelayConfig relayConfig) {
        this.relayConfig = relayConfig;
    }

    /**
     * Creates and configures the {@code PoolingHttpClientConnectionManager} bean used for webhook connections.
     *
     * @return The configured {@code PoolingHttpClientConnectionManager} bean.
     */
    @Bean
    public PoolingHttpClientConnectionManager poolingHttpClientConnectionManager() {
        var connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(relayConfig.getWebhookMaxConnections());
        connectionManager.setDefaultMaxPerRoute(relayConfig.getWebhookMaxConnections());
        return connectionManager;
    }

    /**
     * Creates and configures the {@code RequestConfig} bean for webhook timeout settings.
     *
     * @return The configured {@code RequestConfig} bean.
     */
    @Bean
    public RequestConfig webhookRequestConfig() {
        return RequestConfig.custom()
                .setConnectionRequestTimeout(relayConfig.getWebhookMaxTimeout())
                .setConnectTimeout(relayConfig.getWebhookMaxTimeout())
                .setSocketTimeout(relayConfig.getWebhookMaxTimeout())
                .build();
    }

    /**
     * Creates the pooled {@code CloseableHttpClient} used for webhook deliveries.
     *
     * @param poolingHttpClientConnectionManager The PoolingHttpClientConnectionManager bean.
     * @param webhookRequestConfig               The RequestConfig bean for webhook calls.
     * @return The configured CloseableHttpClient bean.
     */
    @Bean
    public CloseableHttpClient webhookHttpClient(PoolingHttpClientConnectionManager poolingHttpClientConnectionManager, RequestConfig webhookRequestConfig) {
        return HttpClientBuilder
                .create()
                .setConnectionManager(poolingHttpClientConnectionManager)
                .setDefaultRequestConfig(webhookRequestConfig)
                .disableCookieManagement()
                .build();
    }

    /**
     * Creates a supplier of streaming clients. Each call returns a new client holding exactly one connection.
     * The socket timeout is disabled because ntfy streams stay silent for arbitrary long periods.
     *
     * @return A supplier of new streaming CloseableHttpClient instances.
     */
    @Bean
    public Supplier<CloseableHttpClient> streamHttpClientSupplier() {
        var streamRequestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(relayConfig.getConnectionRequestTimeoutMs())
                .setConnectTimeout(relayConfig.getConnectTimeoutMs())
                .setSocketTimeout(0)
                .build();

        return () -> HttpClientBuilder
                .create()
                .setConnectionManager(new BasicHttpClientConnectionManager())
                .setDefaultRequestConfig(streamRequestConfig)
                .disableCookieManagement()
                .disableAutomaticRetries()
                .build();
    }
}
