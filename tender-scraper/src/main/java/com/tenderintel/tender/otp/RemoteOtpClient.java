package com.tenderintel.tender.otp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tenderintel.tender.config.TenderScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.Optional;

/**
 * Reads the latest ticket from another instance's /get-otp endpoint.
 * Used when that instance already owns the webhook port.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RemoteOtpClient {

    private final RestTemplate restTemplate;
    private final TenderScraperProperties properties;

    public Optional<OtpTicket> fetchLatest() {
        String url = "http://127.0.0.1:" + properties.getOtp().getExistingListenerPort() + "/get-otp";
        try {
            OtpStatus status = restTemplate.getForObject(url, OtpStatus.class);
            if (status == null || status.otp() == null || status.timestamp() == null) {
                return Optional.empty();
            }
            return Optional.of(new OtpTicket(status.otp(), status.timestamp()));
        } catch (Exception e) {
            log.debug("Polling {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OtpStatus(String otp, Instant timestamp) {
    }
}
