// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Embed color (decimal RGB) and title emoji per notification severity.
 */
@Getter
@AllArgsConstructor
public enum NotificationStyle {
    INFO(3447003, "ℹ️"),
    SUCCESS(3066993, "✅"),
    WARNING(16776960, "⚠️"),
    ERROR(15158332, "❌");

    private final int color;
    private final String emoji;
}
