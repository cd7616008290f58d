// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

/**
 * {@code TERMINAL} marks a client error from the server, {@code FINISHED} a stream closed by the server
 * or a reconnect sequence that hit its time ceiling.
 */
public enum ListenerState {
    CONNECTING,
    STREAMING,
    BACKING_OFF,
    TERMINAL,
    FINISHED,
    CANCELLED
}
