// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Collections;

@Configuration
public class ThreadPoolConfig {

    private final RelayConfig relayConfig;

    private final MeterRegistry meterRegistry;

    @Autowired
    public ThreadPoolConfig(RelayConfig relayConfig, MeterRegistry meterRegistry) {
        this.relayConfig = relayConfig;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Every running stream listener occupies one thread of this pool for as long as its stream stays open,
     * so the pool size is the upper bound of concurrently relayed rules. The pool has no queue: a rule submitted
     * while all threads are busy is rejected and submitted again on the next reconciliation tick.
     */
    @Bean(name = "streamListenerExecutor")
    public ThreadPoolTaskExecutor streamListenerExecutor() {
        ThreadPoolTaskExecutor streamListenerExecutor = new ThreadPoolTaskExecutor();

        streamListenerExecutor.setThreadNamePrefix("stream-listener-");
        streamListenerExecutor.setAwaitTerminationSeconds(20);
        streamListenerExecutor.setWaitForTasksToCompleteOnShutdown(false);
        streamListenerExecutor.setCorePoolSize(relayConfig.getListenerThreadPoolSize());
        streamListenerExecutor.setMaxPoolSize(relayConfig.getListenerThreadPoolSize());
        streamListenerExecutor.setQueueCapacity(0);

        streamListenerExecutor.afterPropertiesSet();
        ExecutorServiceMetrics.monitor(meterRegistry, streamListenerExecutor.getThreadPoolExecutor(), "streamListenerExecutor", Collections.emptyList());

        return streamListenerExecutor;
    }

}
