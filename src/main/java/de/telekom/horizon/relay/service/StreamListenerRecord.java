// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.model.RelayRule;

public record StreamListenerRecord(
        RelayRule rule,
        StreamListenerFactory streamListenerFactory
) {
}
