package com.cloudcostbuddy.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers notifications by POSTing them as JSON to a push gateway.
 *
 * The gateway owns device tokens and channel fan-out (FCM, APNs, email).
 * A 2xx response counts as delivered; anything else is reported as not
 * delivered. Transport errors propagate to the caller.
 */
@RequiredArgsConstructor
@Slf4j
public class WebhookNotificationDispatcher implements NotificationDispatcher {

    private final RestTemplate restTemplate;
    private final String webhookUrl;

    @Override
    public DispatchResult send(NotificationMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", message.userId());
        payload.put("title", message.title());
        payload.put("body", message.body());
        payload.put("data", message.data());
        payload.put("timestamp", Instant.now().toString());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    webhookUrl, new HttpEntity<>(payload, headers), String.class);

            if (response.getStatusCode().is2xxSuccessful()) {
                log.debug("Notification delivered to {} via webhook", message.userId());
                return DispatchResult.delivered("HTTP " + response.getStatusCode().value());
            }
            return DispatchResult.notDelivered("HTTP " + response.getStatusCode().value());

        } catch (RestClientException e) {
            throw new NotificationDeliveryException(
                    "Webhook delivery to " + webhookUrl + " failed for user " + message.userId(), e);
        }
    }
}
