// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.utils;

import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * The {@code AuthHeaders} class builds the Authorization header values stored with a rule.
 */
public final class AuthHeaders {

    private AuthHeaders() {
    }

    /**
     * Builds the header value from either basic credentials or a token.
     *
     * @param basicCredentials Credentials in the form {@code user:password}, or {@code null}.
     * @param token            An access token, or {@code null}.
     * @return {@code Basic <base64>}, {@code Bearer <token>} or {@code null} if neither is given.
     * @throws IllegalArgumentException If both are given or the basic credentials contain no colon.
     */
    public static String build(String basicCredentials, String token) {
        var hasBasic = StringUtils.isNotEmpty(basicCredentials);
        var hasToken = StringUtils.isNotEmpty(token);

        if (hasBasic && hasToken) {
            throw new IllegalArgumentException("Basic credentials and token are mutually exclusive");
        }

        if (hasBasic) {
            if (!basicCredentials.contains(":")) {
                throw new IllegalArgumentException("Basic credentials must have the form USER:PASS");
            }
            return "Basic " + Base64.getEncoder().encodeToString(basicCredentials.getBytes(StandardCharsets.UTF_8));
        }

        return hasToken ? "Bearer " + token : null;
    }
}
