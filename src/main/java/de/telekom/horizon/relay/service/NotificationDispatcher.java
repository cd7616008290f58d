// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.model.NtfyMessage;
import de.telekom.horizon.relay.model.RelayRule;

/**
 * Forwards a single decoded notification to the destination of a rule.
 */
public interface NotificationDispatcher {

    /**
     * Delivers the message once, best-effort. Implementations must not throw and must return
     * within their outbound timeout, since the calling stream listener blocks until they do.
     *
     * @param rule    The rule the message was received for.
     * @param message The decoded notification.
     */
    void deliver(RelayRule rule, NtfyMessage message);
}
