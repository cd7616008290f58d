// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Exponential reconnect delays with a per-delay cap and a ceiling on the total time spent in one backoff sequence.
 *
 * A sequence starts with {@link #reset()}. The delay handed out last is truncated to the time left
 * until the ceiling, so the ceiling is never overshot. Not thread-safe, each listener owns one instance.
 */
public class ExponentialBackoff {

    private final Duration initialInterval;
    private final Duration maxInterval;
    private final double multiplier;
    private final Duration maxElapsed;
    private final Clock clock;

    private Duration currentInterval;

    @Getter
    private Instant sequenceStartedAt;

    public ExponentialBackoff(Duration initialInterval, Duration maxInterval, double multiplier, Duration maxElapsed, Clock clock) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0 but was " + multiplier);
        }

        this.initialInterval = initialInterval;
        this.maxInterval = maxInterval;
        this.multiplier = multiplier;
        this.maxElapsed = maxElapsed;
        this.clock = clock;

        reset();
    }

    /**
     * Starts a new sequence: the next delay is the initial interval again and the elapsed time counts from now.
     */
    public void reset() {
        currentInterval = initialInterval;
        sequenceStartedAt = clock.instant();
    }

    /**
     * Hands out the next delay of the current sequence.
     *
     * @return The delay to wait before the next attempt, or empty if the elapsed time ceiling is reached.
     */
    public Optional<Duration> nextDelay() {
        var elapsed = Duration.between(sequenceStartedAt, clock.instant());
        if (elapsed.compareTo(maxElapsed) >= 0) {
            return Optional.empty();
        }

        var remaining = maxElapsed.minus(elapsed);
        var delay = currentInterval.compareTo(remaining) > 0 ? remaining : currentInterval;

        var grown = Duration.ofMillis((long) (currentInterval.toMillis() * multiplier));
        currentInterval = grown.compareTo(maxInterval) > 0 ? maxInterval : grown;

        return Optional.of(delay);
    }

    public Duration getElapsed() {
        return Duration.between(sequenceStartedAt, clock.instant());
    }
}
