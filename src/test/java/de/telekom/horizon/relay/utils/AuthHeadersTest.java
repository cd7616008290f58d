// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthHeadersTest {

    @Test
    @DisplayName("Encode basic credentials")
    void encodeBasicCredentials() {
        assertEquals("Basic dXNlcjpwYXNz", AuthHeaders.build("user:pass", null));
    }

    @Test
    @DisplayName("Keep colons inside the password")
    void keepColonsInPassword() {
        assertEquals("Basic dXNlcjpwYTpzcw==", AuthHeaders.build("user:pa:ss", null));
    }

    @Test
    @DisplayName("Prefix tokens with Bearer")
    void bearerToken() {
        assertEquals("Bearer tk_abc", AuthHeaders.build(null, "tk_abc"));
    }

    @Test
    @DisplayName("No credentials yield no header")
    void noCredentials() {
        assertNull(AuthHeaders.build(null, null));
        assertNull(AuthHeaders.build("", ""));
    }

    @Test
    @DisplayName("Reject both kinds of credentials at once")
    void rejectBoth() {
        assertThrows(IllegalArgumentException.class, () -> AuthHeaders.build("user:pass", "tk_abc"));
    }

    @Test
    @DisplayName("Reject basic credentials without a password separator")
    void rejectMalformedBasic() {
        assertThrows(IllegalArgumentException.class, () -> AuthHeaders.build("user", null));
    }
}
