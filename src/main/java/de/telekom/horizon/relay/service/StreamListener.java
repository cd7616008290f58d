// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.config.RelayMetrics;
import de.telekom.horizon.relay.exception.StreamStatusException;
import de.telekom.horizon.relay.model.ListenerState;
import de.telekom.horizon.relay.model.NtfyMessage;
import de.telekom.horizon.relay.model.RelayRule;
import de.telekom.horizon.relay.model.StreamOutcome;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpEntity;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.springframework.http.HttpHeaders;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * The {@code StreamListener} class relays the ntfy topic of exactly one {@link RelayRule}.
 *
 * Each connection attempt ends in a {@link StreamOutcome}. Client errors (4xx) end the invocation for good,
 * everything else is retried with exponential backoff until the elapsed time ceiling of the current backoff
 * sequence is reached. A successfully opened stream starts a new sequence. Messages are dispatched in the
 * order they arrive, each one before the next line is read.
 *
 * {@link #cancel()} may be called from any thread. It aborts the open request, which unblocks a pending
 * socket read, and interrupts the runner thread, which unblocks a backoff sleep.
 */
@Slf4j
public class StreamListener implements Runnable {

    static final String ACCEPT_VALUE = "application/x-ndjson, application/json";

    @Getter
    private final RelayRule rule;

    private final NotificationDispatcher notificationDispatcher;

    private final ObjectMapper objectMapper;

    private final RelayMetrics relayMetrics;

    private final Supplier<CloseableHttpClient> httpClientSupplier;

    private final Sleeper sleeper;

    private final ExponentialBackoff backoff;

    private final String userAgent;

    private final Duration unexpectedErrorPause;

    private final Object lock = new Object();

    @Getter
    private volatile ListenerState state = ListenerState.CONNECTING;

    private volatile boolean cancelled;

    private HttpGet currentRequest;

    private Thread runner;

    /**
     * Creates a new StreamListener instance.
     *
     * @param streamListenerRecord The record holding the rule and the factory providing all collaborators.
     */
    public StreamListener(StreamListenerRecord streamListenerRecord) {
        var factory = streamListenerRecord.streamListenerFactory();
        RelayConfig relayConfig = factory.getRelayConfig();

        this.rule = streamListenerRecord.rule();
        this.notificationDispatcher = factory.getNotificationDispatcher();
        this.objectMapper = factory.getObjectMapper();
        this.relayMetrics = factory.getRelayMetrics();
        this.httpClientSupplier = factory.getStreamHttpClientSupplier();
        this.sleeper = factory.getSleeper();
        this.userAgent = relayConfig.getUserAgent();
        this.unexpectedErrorPause = Duration.ofMillis(relayConfig.getUnexpectedErrorPauseMs());
        this.backoff = new ExponentialBackoff(
                Duration.ofMillis(relayConfig.getInitialBackoffIntervalMs()),
                Duration.ofMillis(relayConfig.getMaxBackoffIntervalMs()),
                relayConfig.getBackoffMultiplier(),
                Duration.ofMillis(relayConfig.getMaxElapsedBackoffMs()),
                factory.getClock());
    }

    /**
     * Connects, streams and reconnects until a terminal outcome, the end of the stream, an exhausted
     * backoff sequence or cancellation. Never throws for network or protocol failures.
     */
    @Override
    public void run() {
        synchronized (lock) {
            if (cancelled) {
                state = ListenerState.CANCELLED;
                return;
            }
            runner = Thread.currentThread();
        }

        var httpClient = httpClientSupplier.get();
        try {
            log.info("[Rule {}] Starting listener for {}", rule.id(), buildStreamUrl());
            backoff.reset();
            relayLoop(httpClient);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            if (!cancelled) {
                log.warn("[Rule {}] Listener interrupted", rule.id());
            }
        } finally {
            synchronized (lock) {
                runner = null;
            }
            if (cancelled) {
                state = ListenerState.CANCELLED;
                log.debug("[Rule {}] Listener cancelled", rule.id());
            }
            closeHttpClient(httpClient);
        }
    }

    private void relayLoop(CloseableHttpClient httpClient) throws InterruptedException {
        while (!cancelled) {
            state = ListenerState.CONNECTING;
            var outcome = connectAndStream(httpClient);

            if (cancelled) {
                return;
            }

            switch (outcome) {
                case TERMINAL -> {
                    state = ListenerState.TERMINAL;
                    return;
                }
                case COMPLETED -> {
                    state = ListenerState.FINISHED;
                    log.warn("[Rule {}] Stream was closed by the server", rule.id());
                    return;
                }
                case RETRY -> {
                    var delay = backoff.nextDelay();
                    if (delay.isEmpty()) {
                        state = ListenerState.FINISHED;
                        log.error("[Rule {}] Giving up after reconnecting for {} s", rule.id(), backoff.getElapsed().toSeconds());
                        return;
                    }

                    state = ListenerState.BACKING_OFF;
                    relayMetrics.recordReconnect(rule.id());
                    log.info("[Rule {}] Reconnecting in {} ms", rule.id(), delay.get().toMillis());
                    sleeper.sleep(delay.get());
                }
            }
        }
    }

    /**
     * Performs one connection attempt and reads the stream until it ends or fails.
     *
     * @param httpClient The client owned by this listener.
     * @return The outcome of the attempt.
     * @throws InterruptedException If the pause after an unexpected error is interrupted.
     */
    StreamOutcome connectAndStream(CloseableHttpClient httpClient) throws InterruptedException {
        var request = buildRequest();

        synchronized (lock) {
            if (cancelled) {
                return StreamOutcome.RETRY;
            }
            currentRequest = request;
        }

        // Closing the response shuts the connection down without draining the endless body.
        try (var response = httpClient.execute(request)) {
            var statusCode = response.getStatusLine().getStatusCode();
            if (statusCode < 200 || statusCode >= 300) {
                throw new StreamStatusException(String.format("HTTP %d %s", statusCode, response.getStatusLine().getReasonPhrase()), statusCode);
            }

            state = ListenerState.STREAMING;
            backoff.reset();
            log.info("[Rule {}] Connected, listening for messages", rule.id());

            readStream(response.getEntity());
            return StreamOutcome.COMPLETED;
        } catch (StreamStatusException streamStatusException) {
            if (streamStatusException.isClientError()) {
                log.error("[Rule {}] Server rejected the subscription with {}, not retrying", rule.id(), streamStatusException.getMessage());
                return StreamOutcome.TERMINAL;
            }
            log.warn("[Rule {}] Server answered with {}", rule.id(), streamStatusException.getMessage());
            return StreamOutcome.RETRY;
        } catch (IOException ioException) {
            if (!cancelled) {
                log.warn("[Rule {}] Connection error: {}", rule.id(), buildCauseDescription(ioException));
            }
            return StreamOutcome.RETRY;
        } catch (RuntimeException unknownException) {
            if (cancelled) {
                return StreamOutcome.RETRY;
            }
            log.error("[Rule {}] Unknown exception occurred while streaming", rule.id(), unknownException);
            sleeper.sleep(unexpectedErrorPause);
            return StreamOutcome.RETRY;
        } finally {
            synchronized (lock) {
                currentRequest = null;
            }
        }
    }

    /**
     * Reads NDJSON lines until the end of the stream. The reader is never closed,
     * closing a chunked stream would try to consume it to the end.
     */
    private void readStream(HttpEntity entity) throws IOException {
        if (entity == null) {
            return;
        }

        var reader = new BufferedReader(new InputStreamReader(entity.getContent(), StandardCharsets.UTF_8));
        String line;
        while (!cancelled && (line = reader.readLine()) != null) {
            processLine(line);
        }
    }

    void processLine(String line) {
        if (StringUtils.isBlank(line)) {
            return;
        }

        NtfyMessage message;
        try {
            message = objectMapper.readValue(line, NtfyMessage.class);
        } catch (JsonProcessingException jsonProcessingException) {
            log.warn("[Rule {}] Skipping malformed line: {}", rule.id(), StringUtils.abbreviate(line, 200));
            return;
        }

        if (message == null || !message.isMessageEvent()) {
            log.trace("[Rule {}] Ignoring non-message event", rule.id());
            return;
        }

        relayMetrics.recordEventReceived(rule.id());
        log.debug("[Rule {}] Received message {}", rule.id(), message.id());
        notificationDispatcher.deliver(rule, message);
    }

    /**
     * Requests the listener to stop. Safe to call repeatedly and from any thread.
     */
    public void cancel() {
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;

            if (currentRequest != null) {
                currentRequest.abort();
            }
            if (runner != null) {
                runner.interrupt();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    HttpGet buildRequest() {
        var request = new HttpGet(buildStreamUrl());
        request.setHeader(HttpHeaders.USER_AGENT, userAgent);
        request.setHeader(HttpHeaders.ACCEPT, ACCEPT_VALUE);
        request.setHeader(HttpHeaders.CONNECTION, "keep-alive");
        if (rule.hasAuthCredential()) {
            request.setHeader(HttpHeaders.AUTHORIZATION, rule.authCredential());
        }
        return request;
    }

    String buildStreamUrl() {
        return StringUtils.stripEnd(rule.sourceEndpoint(), "/") + "/" + StringUtils.stripStart(rule.sourceTopic(), "/") + "/json";
    }

    private void closeHttpClient(CloseableHttpClient httpClient) {
        try {
            httpClient.close();
        } catch (IOException ioException) {
            log.debug("[Rule {}] Error while closing the stream client: {}", rule.id(), buildCauseDescription(ioException));
        }
    }

    private String buildCauseDescription(Throwable exceptionCause) {
        return String.format("cause %s with Type %s", exceptionCause.getMessage(), exceptionCause.getClass().getName());
    }
}
