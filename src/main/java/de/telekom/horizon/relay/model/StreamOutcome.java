// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

/**
 * Result of a single connection attempt of a stream listener.
 */
public enum StreamOutcome {
    /**
     * Client error from ntfy (bad credentials, unknown topic). Not retried within the current invocation.
     */
    TERMINAL,
    /**
     * Transient failure. The listener backs off and connects again.
     */
    RETRY,
    /**
     * The upstream closed the stream without an error.
     */
    COMPLETED
}
