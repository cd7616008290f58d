// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * The {@code RelayMetrics} class is responsible for recording metrics of the relay path and the listener supervision.
 */
@Component
public class RelayMetrics {

    public static final String METRIC_EVENTS_RECEIVED = "relay.events.received";
    public static final String METRIC_DELIVERIES = "relay.deliveries";
    public static final String METRIC_RECONNECTS = "relay.listener.reconnects";
    public static final String METRIC_RESTARTS = "relay.listener.restarts";
    public static final String METRIC_ACTIVE_LISTENERS = "relay.listeners.active";

    private final MeterRegistry meterRegistry;

    private final Map<String, Counter> counters;

    /**
     * Constructor for RelayMetrics.
     *
     * @param meterRegistry The Micrometer registry for recording metrics.
     */
    public RelayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
    }

    public void recordEventReceived(long ruleId) {
        counter(METRIC_EVENTS_RECEIVED, "rule", String.valueOf(ruleId)).increment();
    }

    public void recordDelivery(boolean successful) {
        counter(METRIC_DELIVERIES, "result", successful ? "success" : "failure").increment();
    }

    public void recordReconnect(long ruleId) {
        counter(METRIC_RECONNECTS, "rule", String.valueOf(ruleId)).increment();
    }

    public void recordRestart() {
        counter(METRIC_RESTARTS, "reason", "finished").increment();
    }

    /**
     * Registers a gauge reporting the number of running stream listeners.
     *
     * @param activeListeners Supplier of the current number of running listeners.
     */
    public void registerActiveListenersGauge(Supplier<Number> activeListeners) {
        Gauge.builder(METRIC_ACTIVE_LISTENERS, activeListeners)
                .description("Number of stream listeners currently registered by the supervisor")
                .register(meterRegistry);
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        var counterKey = String.format("%s-%s-%s", name, tagKey, tagValue);
        return counters.computeIfAbsent(counterKey, ignored -> Counter.builder(name)
                .tag(tagKey, tagValue)
                .register(meterRegistry));
    }
}
