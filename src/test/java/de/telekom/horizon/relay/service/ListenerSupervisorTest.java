// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.config.RelayMetrics;
import de.telekom.horizon.relay.config.ThreadPoolConfig;
import de.telekom.horizon.relay.exception.RuleStoreException;
import de.telekom.horizon.relay.model.ListenerState;
import de.telekom.horizon.relay.model.RelayRule;
import de.telekom.horizon.relay.store.RuleStore;
import de.telekom.horizon.relay.test.utils.ObjectGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static de.telekom.horizon.relay.test.utils.ObjectGenerator.generateRule;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ListenerSupervisorTest {

    @Mock
    RuleStore ruleStore;

    @Mock
    StreamListenerFactory streamListenerFactory;

    ManualExecutor executor;

    SimpleMeterRegistry meterRegistry;

    RelayConfig relayConfig;

    ListenerSupervisor listenerSupervisor;

    @BeforeEach
    void setUp() {
        relayConfig = ObjectGenerator.mockRelayConfig();
        when(relayConfig.getCancelTimeoutMs()).thenReturn(100L);

        executor = new ManualExecutor();
        meterRegistry = new SimpleMeterRegistry();
        listenerSupervisor = new ListenerSupervisor(ruleStore, streamListenerFactory, executor, relayConfig, new RelayMetrics(meterRegistry));
    }

    @Test
    @DisplayName("A new rule gets exactly one listener across ticks")
    void startListenerOnceForNewRule() {
        var rule = generateRule(1L);
        var listener = mockListener(rule);
        when(ruleStore.list()).thenReturn(List.of(rule));
        when(streamListenerFactory.createNew(rule)).thenReturn(listener);

        var first = listenerSupervisor.reconcile();
        var second = listenerSupervisor.reconcile();

        assertEquals(Set.of(1L), first.started());
        assertTrue(second.started().isEmpty());
        assertTrue(second.restarted().isEmpty());
        verify(streamListenerFactory, times(1)).createNew(rule);
        assertEquals(1, executor.submitted());
        assertEquals(1, listenerSupervisor.getActiveListenerCount());
    }

    @Test
    @DisplayName("Removing one rule cancels exactly that listener")
    void cancelOnlyRemovedRule() {
        var kept = generateRule(1L);
        var removed = generateRule(2L);
        var keptListener = mockListener(kept);
        var removedListener = mockListener(removed);
        when(ruleStore.list()).thenReturn(List.of(kept, removed), List.of(kept));
        when(streamListenerFactory.createNew(kept)).thenReturn(keptListener);
        when(streamListenerFactory.createNew(removed)).thenReturn(removedListener);

        listenerSupervisor.reconcile();
        var result = listenerSupervisor.reconcile();

        assertEquals(Set.of(2L), result.stopped());
        verify(removedListener).cancel();
        verify(keptListener, never()).cancel();
        assertEquals(Set.of(1L), listenerSupervisor.getListenerStates().keySet());
    }

    @Test
    @DisplayName("A failed listener is removed and restarted on the next tick")
    void restartFailedListener() {
        var rule = generateRule(1L);
        var failing = mockListener(rule);
        var replacement = mockListener(rule);
        doThrow(new IllegalStateException("crashed")).when(failing).run();
        when(ruleStore.list()).thenReturn(List.of(rule));
        when(streamListenerFactory.createNew(rule)).thenReturn(failing, replacement);

        listenerSupervisor.reconcile();
        executor.runAll();
        var result = listenerSupervisor.reconcile();

        assertEquals(Set.of(1L), result.restarted());
        assertTrue(result.started().isEmpty());
        verify(streamListenerFactory, times(2)).createNew(rule);
        assertEquals(1.0, meterRegistry.get(RelayMetrics.METRIC_RESTARTS).counter().count());
    }

    @Test
    @DisplayName("A listener that ended normally is restarted as well")
    void restartCompletedListener() {
        var rule = generateRule(1L);
        var completed = mockListener(rule);
        var replacement = mockListener(rule);
        when(ruleStore.list()).thenReturn(List.of(rule));
        when(streamListenerFactory.createNew(rule)).thenReturn(completed, replacement);

        listenerSupervisor.reconcile();
        executor.runAll();
        var result = listenerSupervisor.reconcile();

        assertEquals(Set.of(1L), result.restarted());
        verify(completed, never()).cancel();
    }

    @Test
    @DisplayName("A finished listener of a removed rule is dropped without restart")
    void dropFinishedListenerOfRemovedRule() {
        var rule = generateRule(1L);
        var listener = mockListener(rule);
        when(ruleStore.list()).thenReturn(List.of(rule), List.of());
        when(streamListenerFactory.createNew(rule)).thenReturn(listener);

        listenerSupervisor.reconcile();
        executor.runAll();
        var result = listenerSupervisor.reconcile();

        assertTrue(result.restarted().isEmpty());
        assertTrue(result.stopped().isEmpty());
        assertEquals(0, listenerSupervisor.getActiveListenerCount());
        verify(streamListenerFactory, times(1)).createNew(rule);
    }

    @Test
    @DisplayName("An unavailable rule store leaves the running listeners untouched")
    void keepRegistryWhenStoreFails() {
        var rule = generateRule(1L);
        var listener = mockListener(rule);
        when(ruleStore.list())
                .thenReturn(List.of(rule))
                .thenThrow(new RuleStoreException("Could not list relay rules", new DataAccessResourceFailureException("database down")))
                .thenReturn(List.of(rule));
        when(streamListenerFactory.createNew(rule)).thenReturn(listener);

        listenerSupervisor.reconcile();
        var failed = listenerSupervisor.reconcile();

        assertTrue(failed.skipped());
        assertFalse(listenerSupervisor.isRuleStoreAvailable());
        assertEquals(1, listenerSupervisor.getActiveListenerCount());
        verify(listener, never()).cancel();

        var recovered = listenerSupervisor.reconcile();

        assertFalse(recovered.skipped());
        assertTrue(listenerSupervisor.isRuleStoreAvailable());
        verify(streamListenerFactory, times(1)).createNew(rule);
    }

    @Test
    @DisplayName("A saturated executor skips the rule until the next tick")
    void retryStartWhenExecutorRejects() {
        var rule = generateRule(1L);
        var listener = mockListener(rule);
        when(ruleStore.list()).thenReturn(List.of(rule));
        when(streamListenerFactory.createNew(rule)).thenReturn(listener);

        executor.rejectNext();
        var rejected = listenerSupervisor.reconcile();
        var accepted = listenerSupervisor.reconcile();

        assertTrue(rejected.started().isEmpty());
        assertEquals(Set.of(1L), accepted.started());
        assertEquals(1, executor.submitted());
    }

    @Test
    @DisplayName("A rule beyond the pool size is not registered until a thread becomes free")
    void startRuleBeyondPoolSizeOnceThreadIsFree() {
        when(relayConfig.getListenerThreadPoolSize()).thenReturn(1);
        var poolExecutor = new ThreadPoolConfig(relayConfig, meterRegistry).streamListenerExecutor();
        var supervisor = new ListenerSupervisor(ruleStore, streamListenerFactory, poolExecutor, relayConfig, new RelayMetrics(new SimpleMeterRegistry()));

        var first = generateRule(1L);
        var second = generateRule(2L);
        var firstListener = mockListener(first);
        var secondListener = mockListener(second);
        var released = new CountDownLatch(1);
        doAnswer(invocation -> {
            released.await();
            return null;
        }).when(firstListener).run();
        doAnswer(invocation -> {
            released.countDown();
            return null;
        }).when(firstListener).cancel();
        when(ruleStore.list()).thenReturn(List.of(first, second), List.of(second));
        when(streamListenerFactory.createNew(first)).thenReturn(firstListener);
        when(streamListenerFactory.createNew(second)).thenReturn(secondListener);

        try {
            var saturated = supervisor.reconcile();

            assertEquals(Set.of(1L), saturated.started());
            assertEquals(1, supervisor.getActiveListenerCount());
            assertEquals(Set.of(1L), supervisor.getListenerStates().keySet());

            var stopping = supervisor.reconcile();

            assertTrue(stopping.started().isEmpty());
            assertEquals(Set.of(1L), stopping.stopped());

            await().atMost(5, TimeUnit.SECONDS).until(() -> supervisor.reconcile().started().contains(2L));
            assertEquals(Set.of(2L), supervisor.getListenerStates().keySet());
        } finally {
            released.countDown();
            poolExecutor.shutdown();
        }
    }

    @Test
    @DisplayName("An unexpected error while fetching rules skips the tick")
    void skipTickOnUnexpectedFetchError() {
        var rule = generateRule(1L);
        var listener = mockListener(rule);
        when(ruleStore.list())
                .thenReturn(List.of(rule))
                .thenThrow(new IllegalStateException("result set closed"));
        when(streamListenerFactory.createNew(rule)).thenReturn(listener);

        listenerSupervisor.reconcile();
        var failed = assertDoesNotThrow(() -> listenerSupervisor.reconcile());

        assertTrue(failed.skipped());
        assertEquals(1, listenerSupervisor.getActiveListenerCount());
        verify(listener, never()).cancel();
    }

    @Test
    @DisplayName("Unexpected errors end the tick but not the supervisor")
    void survivesUnexpectedErrors() {
        var rule = generateRule(1L);
        when(ruleStore.list()).thenReturn(List.of(rule));
        when(streamListenerFactory.createNew(rule)).thenThrow(new IllegalStateException("broken factory"));

        var result = assertDoesNotThrow(() -> listenerSupervisor.reconcile());

        assertFalse(result.skipped());
        assertEquals(0, listenerSupervisor.getActiveListenerCount());
    }

    @Test
    @DisplayName("Shutdown cancels every running listener")
    void shutdownCancelsAll() {
        var first = generateRule(1L);
        var second = generateRule(2L);
        var firstListener = mockListener(first);
        var secondListener = mockListener(second);
        when(ruleStore.list()).thenReturn(List.of(first, second));
        when(streamListenerFactory.createNew(first)).thenReturn(firstListener);
        when(streamListenerFactory.createNew(second)).thenReturn(secondListener);

        listenerSupervisor.reconcile();
        listenerSupervisor.shutdown();

        verify(firstListener, atLeastOnce()).cancel();
        verify(secondListener, atLeastOnce()).cancel();
        assertEquals(0, listenerSupervisor.getActiveListenerCount());
    }

    @Test
    @DisplayName("Report the state of every registered listener")
    void reportListenerStates() {
        var rule = generateRule(1L);
        var listener = mockListener(rule);
        when(listener.getState()).thenReturn(ListenerState.BACKING_OFF);
        when(ruleStore.list()).thenReturn(List.of(rule));
        when(streamListenerFactory.createNew(rule)).thenReturn(listener);

        listenerSupervisor.reconcile();

        assertEquals(ListenerState.BACKING_OFF, listenerSupervisor.getListenerStates().get(1L));
        assertEquals(1.0, meterRegistry.get(RelayMetrics.METRIC_ACTIVE_LISTENERS).gauge().value());
    }

    private StreamListener mockListener(RelayRule rule) {
        var listener = mock(StreamListener.class);
        lenient().when(listener.getRule()).thenReturn(rule);
        return listener;
    }

    /**
     * Queues submitted tasks until the test runs them.
     */
    static class ManualExecutor implements Executor {

        private final List<Runnable> pending = new ArrayList<>();

        private int submitted;

        private boolean rejectNext;

        @Override
        public void execute(Runnable command) {
            if (rejectNext) {
                rejectNext = false;
                throw new RejectedExecutionException("queue full");
            }
            submitted++;
            pending.add(command);
        }

        void runAll() {
            var tasks = new ArrayList<>(pending);
            pending.clear();
            tasks.forEach(Runnable::run);
        }

        void rejectNext() {
            rejectNext = true;
        }

        int submitted() {
            return submitted;
        }
    }
}
