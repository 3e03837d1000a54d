package com.tenderintel.tender.otp;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteOtpClientTest {

    private static final String URL = "http://127.0.0.1:5050/get-otp";

    private MockRestServiceServer server;
    private RemoteOtpClient client;

    @BeforeEach
    void setUp() {
        TenderScraperProperties properties = TestDataFactory.fastProperties();
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RemoteOtpClient(restTemplate, properties);
    }

    @Test
    void fetchLatest_freshCode_returnsTicketWithArrivalTime() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"otp\":\"482913\",\"age_seconds\":4,\"timestamp\":\"2026-03-01T06:00:00Z\"}",
                MediaType.APPLICATION_JSON));

        assertThat(client.fetchLatest())
                .contains(new OtpTicket("482913", Instant.parse("2026-03-01T06:00:00Z")));
    }

    @Test
    void fetchLatest_noRecentCode_empty() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"otp\":null,\"detail\":\"no recent OTP available\",\"timestamp\":null}",
                MediaType.APPLICATION_JSON));

        assertThat(client.fetchLatest()).isEmpty();
    }

    @Test
    void fetchLatest_listenerError_empty() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThat(client.fetchLatest()).isEmpty();
    }
}
