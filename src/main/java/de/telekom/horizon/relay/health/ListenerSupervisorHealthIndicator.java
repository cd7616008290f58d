// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.health;

import de.telekom.horizon.relay.model.ListenerState;
import de.telekom.horizon.relay.service.ListenerSupervisor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.EnumMap;

/**
 * {@code ListenerSupervisorHealthIndicator} reports DOWN while the rule store cannot be read.
 * Individual listeners that are backing off or terminal only show up in the details.
 */
@Component
@ConditionalOnProperty(value = "relay.mode", havingValue = "relay", matchIfMissing = true)
public class ListenerSupervisorHealthIndicator implements HealthIndicator {

    private final ListenerSupervisor listenerSupervisor;

    public ListenerSupervisorHealthIndicator(ListenerSupervisor listenerSupervisor) {
        this.listenerSupervisor = listenerSupervisor;
    }

    @Override
    public Health health() {
        Health.Builder status = Health.up();

        if (!listenerSupervisor.isRuleStoreAvailable()) {
            status = Health.down();
        }

        var listenersByState = new EnumMap<ListenerState, Integer>(ListenerState.class);
        listenerSupervisor.getListenerStates().values().forEach(state -> listenersByState.merge(state, 1, Integer::sum));

        return status
                .withDetail("ruleStoreAvailable", listenerSupervisor.isRuleStoreAvailable())
                .withDetail("activeListeners", listenerSupervisor.getActiveListenerCount())
                .withDetail("listenersByState", listenersByState)
                .build();
    }
}
