// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One decoded line of an ntfy JSON stream.
 *
 * Priority is kept as text since ntfy publishers send both numbers ({@code 4}) and names ({@code "high"}).
 * A single tag sent as a plain string is read as a one-element list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NtfyMessage(
        String id,
        Long time,
        String event,
        String topic,
        String title,
        String message,
        String priority,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> tags
) {

    public static final String EVENT_MESSAGE = "message";

    public boolean isMessageEvent() {
        return EVENT_MESSAGE.equals(event);
    }
}
