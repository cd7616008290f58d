// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.exception;

import lombok.Getter;

@Getter
public class StreamStatusException extends Exception {

    private final int statusCode;


    public StreamStatusException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Client errors (bad credentials, unknown topic) do not heal by reconnecting.
     *
     * @return true for status codes 400 to 499.
     */
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
