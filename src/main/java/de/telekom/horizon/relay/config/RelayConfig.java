// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@Getter
public class RelayConfig {

    @Value("${relay.supervisor.poll-interval-ms}")
    private long pollIntervalMs;

    @Value("${relay.supervisor.cancel-timeout-ms:10000}")
    private long cancelTimeoutMs;

    @Value("${relay.listener.threadpool-size}")
    private int listenerThreadPoolSize;

    @Value("${relay.listener.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${relay.listener.connection-request-timeout-ms:5000}")
    private int connectionRequestTimeoutMs;

    @Value("${relay.listener.user-agent:horizon-relay/0.1.0}")
    private String userAgent;

    @Value("${relay.listener.initial-backoff-interval-ms}")
    private long initialBackoffIntervalMs;

    @Value("${relay.listener.max-backoff-interval-ms}")
    private long maxBackoffIntervalMs;

    @Value("${relay.listener.backoff-multiplier}")
    private double backoffMultiplier;

    @Value("${relay.listener.max-elapsed-backoff-ms}")
    private long maxElapsedBackoffMs;

    @Value("${relay.listener.unexpected-error-pause-ms:5000}")
    private long unexpectedErrorPauseMs;

    @Value("${relay.webhook.max-timeout}")
    private int webhookMaxTimeout;

    @Value("${relay.webhook.max-connections}")
    private int webhookMaxConnections;

    @Value("#{'${relay.webhook.successful-status-codes}'.split(',')}")
    private List<Integer> successfulStatusCodes;
}
