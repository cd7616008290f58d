// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.model.DiscordWebhookPayload;
import de.telekom.horizon.relay.model.NotificationStyle;
import de.telekom.horizon.relay.model.NtfyMessage;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * The {@code DiscordEmbedFactory} turns an ntfy message into a Discord webhook payload with exactly one embed.
 *
 * Severity is derived from the message tags first and from its priority second.
 */
@Component
public class DiscordEmbedFactory {

    static final String DEFAULT_TITLE = "New Ntfy message";
    static final String DEFAULT_DESCRIPTION = "*No content*";

    private static final Set<String> ERROR_TAGS = Set.of("error", "skull", "rotating_light", "fire", "boom");
    private static final Set<String> WARNING_TAGS = Set.of("warning", "exclamation", "construction");
    private static final Set<String> SUCCESS_TAGS = Set.of("white_check_mark", "heavy_check_mark", "partying_face", "tada", "check");

    private final Clock clock;

    @Autowired
    public DiscordEmbedFactory() {
        this(Clock.systemUTC());
    }

    public DiscordEmbedFactory(Clock clock) {
        this.clock = clock;
    }

    public DiscordWebhookPayload createPayload(NtfyMessage message) {
        var style = resolveStyle(message);

        var title = StringUtils.defaultIfBlank(message.title(), DEFAULT_TITLE);
        if (!title.startsWith(style.getEmoji())) {
            title = style.getEmoji() + " " + title;
        }

        var description = StringUtils.defaultIfBlank(message.message(), DEFAULT_DESCRIPTION);
        var footer = new DiscordWebhookPayload.Footer("Ntfy topic: " + Objects.toString(message.topic(), ""));

        var embed = new DiscordWebhookPayload.Embed(title, description, style.getColor(), formatTimestamp(message.time()), footer);
        return new DiscordWebhookPayload(List.of(embed));
    }

    /**
     * Picks the style of a message. The first matching tag wins over the priority.
     *
     * @param message The decoded notification.
     * @return The style to render the embed with.
     */
    public NotificationStyle resolveStyle(NtfyMessage message) {
        var tags = Objects.requireNonNullElse(message.tags(), List.<String>of());

        for (var tag : tags) {
            if (tag == null) {
                continue;
            }

            var normalized = tag.toLowerCase(Locale.ROOT);
            if (ERROR_TAGS.contains(normalized)) {
                return NotificationStyle.ERROR;
            }
            if (WARNING_TAGS.contains(normalized)) {
                return NotificationStyle.WARNING;
            }
            if (SUCCESS_TAGS.contains(normalized)) {
                return NotificationStyle.SUCCESS;
            }
        }

        return styleForPriority(message.priority());
    }

    private NotificationStyle styleForPriority(String priority) {
        if (StringUtils.isBlank(priority)) {
            return NotificationStyle.INFO;
        }

        var normalized = priority.trim().toLowerCase(Locale.ROOT);
        if (StringUtils.isNumeric(normalized)) {
            var level = Integer.parseInt(normalized);
            if (level >= 5) {
                return NotificationStyle.ERROR;
            }
            return level >= 4 ? NotificationStyle.WARNING : NotificationStyle.INFO;
        }

        return switch (normalized) {
            case "urgent", "max" -> NotificationStyle.ERROR;
            case "high" -> NotificationStyle.WARNING;
            default -> NotificationStyle.INFO;
        };
    }

    private String formatTimestamp(Long epochSeconds) {
        var instant = epochSeconds != null ? Instant.ofEpochSecond(epochSeconds) : clock.instant();
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
