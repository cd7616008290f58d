// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import java.util.Set;

/**
 * What a single reconciliation tick changed.
 *
 * @param started   Rules that got a listener for the first time.
 * @param restarted Rules whose previous listener had finished and was started again.
 * @param stopped   Rules that were removed from the store and whose listener was cancelled.
 * @param skipped   True if the tick ended early because the rule store was unavailable.
 */
public record ReconciliationResult(Set<Long> started, Set<Long> restarted, Set<Long> stopped, boolean skipped) {

    public static ReconciliationResult skippedTick() {
        return new ReconciliationResult(Set.of(), Set.of(), Set.of(), true);
    }
}
