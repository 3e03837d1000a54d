package com.tenderintel.tender.service;

import com.tenderintel.tender.config.TenderScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts run results to an external monitoring webhook when one is configured.
 * Delivery is best effort: a failed notification never fails the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HealthNotifier {

    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";

    private final RestTemplate restTemplate;
    private final TenderScraperProperties properties;
    private final Clock clock;

    public void success(String message) {
        send(SUCCESS, message);
    }

    public void failure(String message) {
        send(FAILURE, message);
    }

    private void send(String status, String message) {
        String url = properties.getHealth().getWebhookUrl();
        if (url == null || url.isBlank()) {
            return;
        }

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("status", status);
        payload.put("message", message);
        payload.put("timestamp", LocalDateTime.now(clock).toString());
        payload.put("source", properties.getHealth().getSource());

        try {
            restTemplate.postForEntity(url, payload, String.class);
            log.info("Health webhook sent ({})", status);
        } catch (RestClientException e) {
            log.warn("Health webhook failed: {}", e.getMessage());
        }
    }
}
