// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import lombok.Getter;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A running {@link StreamListener} together with the handle that observes how its invocation ended.
 */
@Getter
public class SupervisedTask {

    private final long ruleId;

    private final StreamListener listener;

    private final CompletableFuture<Void> completion;

    SupervisedTask(long ruleId, StreamListener listener, CompletableFuture<Void> completion) {
        this.ruleId = ruleId;
        this.listener = listener;
        this.completion = completion;
    }

    /**
     * Submits the listener to the executor.
     *
     * @throws java.util.concurrent.RejectedExecutionException If the executor is saturated.
     */
    public static SupervisedTask start(StreamListener listener, Executor executor) {
        return new SupervisedTask(listener.getRule().id(), listener, CompletableFuture.runAsync(listener, executor));
    }

    public boolean isFinished() {
        return completion.isDone();
    }

    /**
     * @return The throwable that ended the invocation, or empty if it is still running or ended normally.
     */
    public Optional<Throwable> getFailure() {
        if (!completion.isCompletedExceptionally()) {
            return Optional.empty();
        }

        try {
            completion.join();
            return Optional.empty();
        } catch (CompletionException completionException) {
            return Optional.ofNullable(completionException.getCause());
        } catch (CancellationException cancellationException) {
            return Optional.of(cancellationException);
        }
    }

    /**
     * Cancels the listener and waits for its invocation to unwind.
     *
     * @param timeout Upper bound for the wait.
     * @return true if the invocation ended within the timeout.
     * @throws InterruptedException If the waiting thread is interrupted.
     */
    public boolean cancelAndAwait(Duration timeout) throws InterruptedException {
        listener.cancel();

        try {
            completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException timeoutException) {
            return false;
        } catch (ExecutionException | CancellationException endedWithFailure) {
            return true;
        }
        return true;
    }
}
