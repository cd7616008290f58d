// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.config.RelayMetrics;
import de.telekom.horizon.relay.exception.RuleStoreException;
import de.telekom.horizon.relay.model.ListenerState;
import de.telekom.horizon.relay.model.ReconciliationResult;
import de.telekom.horizon.relay.model.RelayRule;
import de.telekom.horizon.relay.store.RuleStore;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The {@code ListenerSupervisor} keeps exactly one running {@link StreamListener} per rule in the {@link RuleStore}.
 *
 * Every tick fetches all rules and reconciles them with the registry: finished listeners are removed first,
 * then missing listeners are started (which restarts the ones just removed), then listeners of deleted rules
 * are cancelled and awaited. If the store cannot be read the registry is left untouched.
 */
@Slf4j
@Service
@ConditionalOnProperty(value = "relay.mode", havingValue = "relay", matchIfMissing = true)
public class ListenerSupervisor {

    private final RuleStore ruleStore;

    private final StreamListenerFactory streamListenerFactory;

    private final Executor streamListenerExecutor;

    private final RelayMetrics relayMetrics;

    private final Duration cancelTimeout;

    private final ListenerRegistry registry = new ListenerRegistry();

    @Getter
    private volatile ReconciliationResult lastReconciliation;

    @Getter
    private volatile boolean ruleStoreAvailable = true;

    private volatile List<SupervisedTask> activeTasks = List.of();

    @Autowired
    public ListenerSupervisor(RuleStore ruleStore, StreamListenerFactory streamListenerFactory,
                              @Qualifier("streamListenerExecutor") Executor streamListenerExecutor,
                              RelayConfig relayConfig, RelayMetrics relayMetrics) {
        this.ruleStore = ruleStore;
        this.streamListenerFactory = streamListenerFactory;
        this.streamListenerExecutor = streamListenerExecutor;
        this.relayMetrics = relayMetrics;
        this.cancelTimeout = Duration.ofMillis(relayConfig.getCancelTimeoutMs());

        relayMetrics.registerActiveListenersGauge(() -> activeTasks.size());
        log.info("Reconciling relay rules every {} ms", relayConfig.getPollIntervalMs());
    }

    @Scheduled(fixedDelayString = "${relay.supervisor.poll-interval-ms}", initialDelayString = "${relay.supervisor.initial-delay-ms:0}")
    protected void scheduledReconcile() {
        reconcile();
    }

    /**
     * Runs one reconciliation tick. Never throws.
     *
     * @return What the tick changed.
     */
    public synchronized ReconciliationResult reconcile() {
        List<RelayRule> rules;
        try {
            rules = ruleStore.list();
            ruleStoreAvailable = true;
        } catch (RuleStoreException ruleStoreException) {
            ruleStoreAvailable = false;
            log.error("Could not fetch relay rules, keeping {} listeners untouched: {}", registry.size(), ruleStoreException.getMessage());
            lastReconciliation = ReconciliationResult.skippedTick();
            return lastReconciliation;
        } catch (RuntimeException unknownException) {
            log.error("Unknown exception occurred while fetching relay rules, keeping {} listeners untouched", registry.size(), unknownException);
            lastReconciliation = ReconciliationResult.skippedTick();
            return lastReconciliation;
        }

        var started = new LinkedHashSet<Long>();
        var restarted = new LinkedHashSet<Long>();
        var stopped = new LinkedHashSet<Long>();

        try {
            Map<Long, RelayRule> desired = rules.stream()
                    .collect(Collectors.toMap(RelayRule::id, Function.identity(), (first, second) -> first, LinkedHashMap::new));

            var finished = removeFinishedTasks();
            startMissingListeners(desired, finished, started, restarted);
            stopRemovedListeners(desired.keySet(), stopped);
        } catch (RuntimeException unknownException) {
            log.error("Unknown exception occurred during reconciliation", unknownException);
        } finally {
            activeTasks = registry.tasks();
        }

        if (!started.isEmpty() || !restarted.isEmpty() || !stopped.isEmpty()) {
            log.info("Reconciled {} rules: {} started, {} restarted, {} stopped", rules.size(), started.size(), restarted.size(), stopped.size());
        }

        lastReconciliation = new ReconciliationResult(Set.copyOf(started), Set.copyOf(restarted), Set.copyOf(stopped), false);
        return lastReconciliation;
    }

    private Set<Long> removeFinishedTasks() {
        var finished = new LinkedHashSet<Long>();

        for (var task : registry.finishedTasks()) {
            var ruleId = task.getRuleId();
            task.getFailure().ifPresentOrElse(
                    failure -> log.warn("[Rule {}] Listener failed: {}", ruleId, failure.toString(), failure),
                    () -> log.warn("[Rule {}] Listener completed unexpectedly", ruleId));

            registry.remove(ruleId);
            finished.add(ruleId);
        }

        return finished;
    }

    private void startMissingListeners(Map<Long, RelayRule> desired, Set<Long> finished, Set<Long> started, Set<Long> restarted) {
        for (var rule : desired.values()) {
            if (registry.contains(rule.id())) {
                continue;
            }

            try {
                registry.register(SupervisedTask.start(streamListenerFactory.createNew(rule), streamListenerExecutor));
            } catch (RejectedExecutionException rejectedExecutionException) {
                log.error("[Rule {}] Could not start listener, executor is saturated: {}", rule.id(), rejectedExecutionException.getMessage());
                continue;
            }

            if (finished.contains(rule.id())) {
                log.info("[Rule {}] Restarting failed rule", rule.id());
                relayMetrics.recordRestart();
                restarted.add(rule.id());
            } else {
                log.info("[Rule {}] Starting listener for new rule {}/{}", rule.id(), rule.sourceEndpoint(), rule.sourceTopic());
                started.add(rule.id());
            }
        }
    }

    private void stopRemovedListeners(Set<Long> desiredIds, Set<Long> stopped) {
        for (var ruleId : registry.ruleIds()) {
            if (desiredIds.contains(ruleId)) {
                continue;
            }

            registry.remove(ruleId).ifPresent(task -> {
                log.info("[Rule {}] Rule was removed, stopping listener", ruleId);
                stop(task);
                stopped.add(ruleId);
            });
        }
    }

    private void stop(SupervisedTask task) {
        try {
            if (task.cancelAndAwait(cancelTimeout)) {
                log.debug("[Rule {}] Listener stopped", task.getRuleId());
            } else {
                log.warn("[Rule {}] Listener did not stop within {} ms", task.getRuleId(), cancelTimeout.toMillis());
            }
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            log.warn("[Rule {}] Interrupted while waiting for the listener to stop", task.getRuleId());
        }
    }

    /**
     * @return The state of every registered listener, as of the last tick's registry.
     */
    public Map<Long, ListenerState> getListenerStates() {
        var states = new LinkedHashMap<Long, ListenerState>();
        activeTasks.forEach(task -> states.put(task.getRuleId(), task.getListener().getState()));
        return states;
    }

    public int getActiveListenerCount() {
        return activeTasks.size();
    }

    @PreDestroy
    public synchronized void shutdown() {
        var tasks = registry.tasks();
        log.info("Shutting down, cancelling {} listeners", tasks.size());

        tasks.forEach(task -> task.getListener().cancel());
        for (var task : tasks) {
            registry.remove(task.getRuleId());
            stop(task);
        }

        activeTasks = List.of();
    }
}
