package com.tenderintel.tender.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderintel.tender.config.TenderScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Base64;

/**
 * Solves image verification codes through the 2captcha HTTP API.
 *
 * Flow: POST the base64 image to in.php, then poll res.php until the worker answers.
 * "CAPCHA_NOT_READY" is the service's own spelling. Responses are read as text because
 * the service does not always label its JSON with a JSON content type.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TwoCaptchaSolver implements ChallengeSolver {

    private static final String NOT_READY = "CAPCHA_NOT_READY";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TenderScraperProperties properties;

    @Override
    public String solve(byte[] image) {
        TenderScraperProperties.Captcha captcha = properties.getCaptcha();
        if (captcha.getApiKey() == null || captcha.getApiKey().isBlank()) {
            throw new ChallengeSolvingException("2captcha API key is not configured");
        }

        log.info("Sending verification image to 2captcha ({} bytes)...", image.length);
        String taskId = submit(image, captcha);

        for (int poll = 1; poll <= captcha.getMaxPolls(); poll++) {
            sleepMs(captcha.getPollInterval().toMillis());
            String url = UriComponentsBuilder.fromHttpUrl(captcha.getBaseUrl() + "/res.php")
                    .queryParam("key", captcha.getApiKey())
                    .queryParam("action", "get")
                    .queryParam("id", taskId)
                    .queryParam("json", 1)
                    .toUriString();
            ApiResponse response = parse(restTemplate.getForObject(url, String.class));
            if (response.status() == 1) {
                String solved = response.request() == null ? "" : response.request().trim();
                if (solved.isEmpty()) {
                    throw new ChallengeSolvingException("2captcha returned empty result");
                }
                log.info("Verification code solved: '{}'", solved);
                return solved;
            }
            if (!NOT_READY.equals(response.request())) {
                throw new ChallengeSolvingException("2captcha error: " + response.request());
            }
        }
        throw new ChallengeSolvingException("2captcha did not answer after " + captcha.getMaxPolls() + " polls");
    }

    private String submit(byte[] image, TenderScraperProperties.Captcha captcha) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("key", captcha.getApiKey());
        form.add("method", "base64");
        form.add("body", Base64.getEncoder().encodeToString(image));
        form.add("json", "1");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        ApiResponse response = parse(restTemplate.postForObject(
                captcha.getBaseUrl() + "/in.php", new HttpEntity<>(form, headers), String.class));
        if (response.status() != 1) {
            throw new ChallengeSolvingException("2captcha rejected the image: " + response.request());
        }
        return response.request();
    }

    private ApiResponse parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ChallengeSolvingException("2captcha returned an empty response");
        }
        try {
            return objectMapper.readValue(body, ApiResponse.class);
        } catch (JsonProcessingException e) {
            throw new ChallengeSolvingException("Unreadable 2captcha response: " + body, e);
        }
    }

    private void sleepMs(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ChallengeSolvingException("Interrupted while waiting for 2captcha", ie);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ApiResponse(int status, String request) {
    }
}
