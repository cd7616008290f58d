// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.store;

import de.telekom.horizon.relay.exception.RuleStoreException;
import de.telekom.horizon.relay.model.RelayRule;

import java.util.List;
import java.util.Optional;

/**
 * Durable table of relay rules. Every method throws {@link RuleStoreException} if the store is unavailable.
 */
public interface RuleStore {

    /**
     * Returns a complete snapshot of all rules.
     *
     * @return All rules ordered by id.
     */
    List<RelayRule> list();

    /**
     * Adds a rule unless the same server, topic and webhook combination already exists.
     *
     * @return The stored rule including its generated id, or empty for a duplicate.
     */
    Optional<RelayRule> add(String sourceEndpoint, String sourceTopic, String destinationEndpoint, String authCredential);

    /**
     * Removes the rule with the given id.
     *
     * @return true if a rule was removed.
     */
    boolean remove(long id);
}
