package com.tenderintel.tender.otp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Receives forwarded SMS from the phone's SMS-forwarder app.
 *
 * Forwarder apps disagree on the request shape, so every textual field is collected:
 * well-known query keys first, then all parameters (query and form), JSON body values,
 * and finally the raw body.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class OtpWebhookController {

    private static final List<String> PREFERRED_KEYS = List.of("msg", "message", "text", "body", "sms");

    private final OtpCoordinator coordinator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @RequestMapping(value = "/sms-webhook", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Map<String, String>> smsWebhook(HttpServletRequest request,
                                                          @RequestBody(required = false) String body) {
        List<String> parts = collectText(request, body);
        String combined = String.join(" | ", parts);
        log.info("Webhook received [{}], raw data: {}", request.getMethod(), abbreviate(combined));

        Optional<String> otp = OtpExtractor.extractFirst(parts);
        if (otp.isEmpty()) {
            log.warn("No OTP found in data: {}", abbreviate(combined));
            return ResponseEntity.ok(Map.of("status", "error", "detail", "no OTP found in message"));
        }

        coordinator.deliver(otp.get());
        log.info("OTP extracted: {}", otp.get());
        return ResponseEntity.ok(Map.of("status", "ok", "otp_received", otp.get()));
    }

    @GetMapping("/get-otp")
    public ResponseEntity<Map<String, Object>> getOtp() {
        Map<String, Object> response = new LinkedHashMap<>();
        Optional<OtpTicket> fresh = coordinator.latestFresh();
        if (fresh.isPresent()) {
            OtpTicket ticket = fresh.get();
            response.put("otp", ticket.code());
            response.put("age_seconds", Duration.between(ticket.receivedAt(), clock.instant()).toSeconds());
            response.put("timestamp", ticket.receivedAt());
        } else {
            response.put("otp", null);
            response.put("detail", "no recent OTP available");
            response.put("timestamp", null);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "running"));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<String> collectText(HttpServletRequest request, String body) {
        List<String> parts = new ArrayList<>();

        for (String key : PREFERRED_KEYS) {
            addIfNew(parts, request.getParameter(key));
        }
        // Query string and url-encoded form fields
        for (String[] values : request.getParameterMap().values()) {
            for (String value : values) {
                addIfNew(parts, value);
            }
        }

        if (body != null && !body.isBlank()) {
            collectJson(parts, body);
            addIfNew(parts, body);
        }
        return parts;
    }

    private void collectJson(List<String> parts, String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null) return;
            if (root.isObject()) {
                Iterator<JsonNode> values = root.elements();
                while (values.hasNext()) {
                    JsonNode value = values.next();
                    if (value.isTextual()) {
                        addIfNew(parts, value.asText());
                    }
                }
            } else if (root.isTextual()) {
                addIfNew(parts, root.asText());
            }
        } catch (Exception e) {
            log.debug("Webhook body is not JSON: {}", e.getMessage());
        }
    }

    private void addIfNew(List<String> parts, String value) {
        if (value != null && !value.isBlank() && !parts.contains(value)) {
            parts.add(value);
        }
    }

    private String abbreviate(String text) {
        return text.length() <= 500 ? text : text.substring(0, 500);
    }
}
