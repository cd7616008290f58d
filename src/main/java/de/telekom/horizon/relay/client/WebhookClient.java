// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.exception.WebhookDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.message.BasicHeader;
import org.apache.http.util.EntityUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * The {@code WebhookClient} class is responsible for posting JSON payloads to chat webhooks.
 * It uses the shared pooled webhook client, so every call is bounded by the configured webhook timeouts.
 */
@Component
@Slf4j
public class WebhookClient {

    private static final int MAX_RESPONSE_EXCERPT = 200;

    private final RelayConfig relayConfig;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    /**
     * Construct of a new {@code WebhookClient} with the specified params.
     *
     * @param relayConfig  The RelayConfig instance for retrieving the accepted status codes.
     * @param httpClient   The pooled CloseableHttpClient used for webhook requests.
     * @param objectMapper The ObjectMapper instance for JSON serialization.
     */
    @Autowired
    public WebhookClient(RelayConfig relayConfig, @Qualifier("webhookHttpClient") CloseableHttpClient httpClient, ObjectMapper objectMapper) {
        this.relayConfig = relayConfig;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Posts the given payload as JSON to the webhook url.
     *
     * @param webhookUrl The url of the webhook.
     * @param payload    The object to be serialized as request body.
     * @throws WebhookDeliveryException If the webhook answers with a status code that is not accepted.
     * @throws IOException              If the payload cannot be serialized or an IO error occurs during the request.
     */
    public void post(String webhookUrl, Object payload) throws WebhookDeliveryException, IOException {
        var request = new HttpPost(webhookUrl);

        overrideHeader(request, HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        overrideHeader(request, HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        overrideHeader(request, HttpHeaders.ACCEPT_CHARSET, StandardCharsets.UTF_8.displayName());

        // throws JsonProcessingException -> IOException
        request.setEntity(new StringEntity(objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8));

        executeRequest(webhookUrl, request);
    }

    private void executeRequest(String webhookUrl, HttpPost request) throws IOException, WebhookDeliveryException {
        try (var response = httpClient.execute(request)) {
            var statusCode = response.getStatusLine().getStatusCode();

            if (!relayConfig.getSuccessfulStatusCodes().contains(statusCode)) {
                throw new WebhookDeliveryException(String.format("Webhook '%s' answered with %d %s: %s",
                        webhookUrl, statusCode, response.getStatusLine().getReasonPhrase(), readExcerpt(response)), statusCode);
            }

            EntityUtils.consumeQuietly(response.getEntity());
        }
    }

    private String readExcerpt(HttpResponse response) throws IOException {
        var entity = response.getEntity();
        if (entity == null) {
            return "";
        }

        return StringUtils.abbreviate(EntityUtils.toString(entity, StandardCharsets.UTF_8), MAX_RESPONSE_EXCERPT);
    }

    private void overrideHeader(HttpRequestBase request, String key, String value) {
        request.removeHeaders(key);
        request.setHeader(new BasicHeader(key, value));
    }
}
