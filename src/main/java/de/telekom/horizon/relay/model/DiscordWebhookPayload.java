// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import java.util.List;

public record DiscordWebhookPayload(List<Embed> embeds) {

    public record Embed(String title, String description, int color, String timestamp, Footer footer) {
    }

    public record Footer(String text) {
    }
}
