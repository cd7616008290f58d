// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.client.WebhookClient;
import de.telekom.horizon.relay.config.RelayMetrics;
import de.telekom.horizon.relay.exception.WebhookDeliveryException;
import de.telekom.horizon.relay.model.NtfyMessage;
import de.telekom.horizon.relay.model.RelayRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * The {@code DiscordDispatcher} posts every relayed message as a single embed to the Discord webhook of the rule.
 * Delivery happens once. Failures are logged and counted, never rethrown into the stream listener.
 */
@Slf4j
@Service
public class DiscordDispatcher implements NotificationDispatcher {

    private final WebhookClient webhookClient;

    private final DiscordEmbedFactory embedFactory;

    private final RelayMetrics relayMetrics;

    public DiscordDispatcher(WebhookClient webhookClient, DiscordEmbedFactory embedFactory, RelayMetrics relayMetrics) {
        this.webhookClient = webhookClient;
        this.embedFactory = embedFactory;
        this.relayMetrics = relayMetrics;
    }

    @Override
    public void deliver(RelayRule rule, NtfyMessage message) {
        var successful = false;

        try {
            webhookClient.post(rule.destinationEndpoint(), embedFactory.createPayload(message));
            successful = true;
            log.debug("[Rule {}] Delivered message {} to Discord", rule.id(), message.id());
        } catch (WebhookDeliveryException webhookDeliveryException) {
            log.error("[Rule {}] Discord rejected message {}: {}", rule.id(), message.id(), webhookDeliveryException.getMessage());
        } catch (IOException ioException) {
            log.error("[Rule {}] Error while sending message {} to Discord: {}", rule.id(), message.id(), buildCauseDescription(ioException));
        } catch (RuntimeException unknownException) {
            log.error("[Rule {}] Unknown exception occurred while dispatching message {}", rule.id(), message.id(), unknownException);
        } finally {
            relayMetrics.recordDelivery(successful);
        }
    }

    private String buildCauseDescription(Throwable exceptionCause) {
        return String.format("cause %s with Type %s", exceptionCause.getMessage(), exceptionCause.getClass().getName());
    }
}
