package com.tenderintel.tender.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TwoCaptchaSolverTest {

    private static final byte[] IMAGE = {1, 2, 3};

    private TenderScraperProperties properties;
    private MockRestServiceServer server;
    private TwoCaptchaSolver solver;

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.fastProperties();
        properties.getCaptcha().setApiKey("test-key");
        properties.getCaptcha().setPollInterval(Duration.ofMillis(1));
        properties.getCaptcha().setMaxPolls(3);
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        solver = new TwoCaptchaSolver(restTemplate, new ObjectMapper(), properties);
    }

    private void expectSubmitted() {
        server.expect(requestTo("https://2captcha.com/in.php"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"status\":1,\"request\":\"74120\"}", MediaType.TEXT_HTML));
    }

    private void expectPoll(String body) {
        server.expect(requestTo(startsWith("https://2captcha.com/res.php")))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(body, MediaType.TEXT_HTML));
    }

    @Test
    void solve_pollsUntilReady() {
        expectSubmitted();
        expectPoll("{\"status\":0,\"request\":\"CAPCHA_NOT_READY\"}");
        expectPoll("{\"status\":1,\"request\":\" K7PX \"}");

        assertThat(solver.solve(IMAGE)).isEqualTo("K7PX");
        server.verify();
    }

    @Test
    void solve_serviceError_failsAttempt() {
        expectSubmitted();
        expectPoll("{\"status\":0,\"request\":\"ERROR_CAPTCHA_UNSOLVABLE\"}");

        assertThatThrownBy(() -> solver.solve(IMAGE))
                .isInstanceOf(ChallengeSolvingException.class)
                .hasMessageContaining("ERROR_CAPTCHA_UNSOLVABLE");
    }

    @Test
    void solve_neverReady_failsAfterMaxPolls() {
        expectSubmitted();
        expectPoll("{\"status\":0,\"request\":\"CAPCHA_NOT_READY\"}");
        expectPoll("{\"status\":0,\"request\":\"CAPCHA_NOT_READY\"}");
        expectPoll("{\"status\":0,\"request\":\"CAPCHA_NOT_READY\"}");

        assertThatThrownBy(() -> solver.solve(IMAGE))
                .isInstanceOf(ChallengeSolvingException.class)
                .hasMessageContaining("3 polls");
    }

    @Test
    void solve_noApiKey_failsWithoutCallingService() {
        properties.getCaptcha().setApiKey("");

        assertThatThrownBy(() -> solver.solve(IMAGE))
                .isInstanceOf(ChallengeSolvingException.class)
                .hasMessageContaining("not configured");
        server.verify();
    }
}
