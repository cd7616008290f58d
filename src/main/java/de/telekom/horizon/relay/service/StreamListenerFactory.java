// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.config.RelayMetrics;
import de.telekom.horizon.relay.model.RelayRule;
import lombok.Getter;
import org.apache.http.impl.client.CloseableHttpClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * The {@code StreamListenerFactory} class for creating instances of {@link StreamListener}.
 * Listeners pull their collaborators from this factory, so every listener of the process shares the same
 * dispatcher, configuration and metrics while owning its own HTTP client.
 */
@Getter
@Component
public class StreamListenerFactory {

    private final RelayConfig relayConfig;

    private final NotificationDispatcher notificationDispatcher;

    private final ObjectMapper objectMapper;

    private final RelayMetrics relayMetrics;

    private final Supplier<CloseableHttpClient> streamHttpClientSupplier;

    private final Sleeper sleeper;

    private final Clock clock;

    /**
     * Constructs a StreamListenerFactory with necessary dependencies.
     *
     * @param relayConfig              The RelayConfig instance for timeouts and backoff settings.
     * @param notificationDispatcher   The dispatcher decoded messages are handed to.
     * @param objectMapper             The ObjectMapper instance for decoding stream lines.
     * @param relayMetrics             The RelayMetrics instance for recording metrics.
     * @param streamHttpClientSupplier Supplier of a new streaming client per listener.
     */
    @Autowired
    public StreamListenerFactory(RelayConfig relayConfig, NotificationDispatcher notificationDispatcher, ObjectMapper objectMapper, RelayMetrics relayMetrics,
                                 @Qualifier("streamHttpClientSupplier") Supplier<CloseableHttpClient> streamHttpClientSupplier) {
        this(relayConfig, notificationDispatcher, objectMapper, relayMetrics, streamHttpClientSupplier, Sleeper.THREAD, Clock.systemUTC());
    }

    public StreamListenerFactory(RelayConfig relayConfig, NotificationDispatcher notificationDispatcher, ObjectMapper objectMapper, RelayMetrics relayMetrics,
                                 Supplier<CloseableHttpClient> streamHttpClientSupplier, Sleeper sleeper, Clock clock) {
        this.relayConfig = relayConfig;
        this.notificationDispatcher = notificationDispatcher;
        this.objectMapper = objectMapper;
        this.relayMetrics = relayMetrics;
        this.streamHttpClientSupplier = streamHttpClientSupplier;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Creates a new instance of {@link StreamListener} for the given rule.
     *
     * @param rule The rule the listener relays.
     * @return A new, not yet running StreamListener.
     */
    public StreamListener createNew(RelayRule rule) {
        return new StreamListener(new StreamListenerRecord(rule, this));
    }
}
