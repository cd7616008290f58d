// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay;

import de.telekom.horizon.relay.health.ListenerSupervisorHealthIndicator;
import de.telekom.horizon.relay.service.ListenerSupervisor;
import de.telekom.horizon.relay.store.RuleStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class RelayApplicationTest {

    @Autowired
    ListenerSupervisor listenerSupervisor;

    @Autowired
    ListenerSupervisorHealthIndicator healthIndicator;

    @Autowired
    RuleStore ruleStore;

    @Test
    @DisplayName("Start the relay and reconcile an empty rule store")
    void contextLoads() {
        assertTrue(ruleStore.list().isEmpty());

        var result = listenerSupervisor.reconcile();

        assertFalse(result.skipped());
        assertEquals(0, listenerSupervisor.getActiveListenerCount());
        assertEquals(Status.UP, healthIndicator.health().getStatus());
    }
}
