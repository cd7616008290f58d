// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

/**
 * A forwarding rule binding one ntfy topic to one Discord webhook.
 *
 * @param id                  Store generated identifier, stable for the lifetime of the rule.
 * @param sourceEndpoint      Base URL of the ntfy server.
 * @param sourceTopic         Topic name on that server.
 * @param destinationEndpoint Discord webhook URL.
 * @param authCredential      Pre-formatted Authorization header value, or {@code null}.
 */
public record RelayRule(
        long id,
        String sourceEndpoint,
        String sourceTopic,
        String destinationEndpoint,
        String authCredential
) {

    public boolean hasAuthCredential() {
        return authCredential != null && !authCredential.isBlank();
    }

    /**
     * Describes the kind of credential without revealing it.
     *
     * @return "Basic (User/Pass)", "Bearer Token", "Custom" or "None".
     */
    public String describeAuth() {
        if (!hasAuthCredential()) {
            return "None";
        }
        if (authCredential.startsWith("Basic")) {
            return "Basic (User/Pass)";
        }
        if (authCredential.startsWith("Bearer")) {
            return "Bearer Token";
        }
        return "Custom";
    }
}
