package com.tenderintel.tender.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * All runtime settings, bound once at startup from {@code tender-scraper.*} and injected
 * into each component. Nothing mutates these at runtime; per-run choices such as
 * interactive OTP entry travel as {@link com.tenderintel.tender.model.RunMode}.
 */
@Component
@ConfigurationProperties(prefix = "tender-scraper")
@Data
public class TenderScraperProperties {

    private Portal portal = new Portal();
    private Browser browser = new Browser();
    private Session session = new Session();
    private Otp otp = new Otp();
    private Login login = new Login();
    private Captcha captcha = new Captcha();
    private Scraping scraping = new Scraping();
    private Storage storage = new Storage();
    private Output output = new Output();
    private Health health = new Health();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Portal {
        private String baseUrl = "https://www.ireps.gov.in";
        private String loginUrl = "https://www.ireps.gov.in/epsn/guestLogin.do";
        private String searchUrl = "https://www.ireps.gov.in/epsn/anonymSearch.do";
        /** Registered mobile number the OTP is sent to. */
        private String mobile = "";
    }

    @Data
    public static class Browser {
        private boolean headless = true;
        private Duration navigationTimeout = Duration.ofSeconds(30);
        private Duration settleDelay = Duration.ofSeconds(3);
    }

    @Data
    public static class Session {
        private String file = "session/ireps_session.json";
        private Duration maxAge = Duration.ofHours(20);
    }

    @Data
    public static class Otp {
        private String cacheFile = "data/otp_cache.json";
        /** The portal keeps handing out the same code for a day. */
        private Duration cacheMaxAge = Duration.ofHours(24);
        private Duration waitTimeout = Duration.ofSeconds(90);
        private Duration freshCodeTimeout = Duration.ofSeconds(60);
        private Duration freshnessWindow = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofSeconds(3);
        /** Set by {@link WebhookPortGuard} when another instance already owns the webhook port. */
        private boolean useExistingListener = false;
        private int existingListenerPort = 5050;
    }

    @Data
    public static class Login {
        /** Each attempt can trigger an OTP generation; the portal allows two per hour. */
        private int maxAttempts = 2;
    }

    @Data
    public static class Captcha {
        private String apiKey = "";
        private String baseUrl = "https://2captcha.com";
        private int maxAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(2);
        private Duration pollInterval = Duration.ofSeconds(5);
        private int maxPolls = 24;
    }

    @Data
    public static class Scraping {
        private String category = "Works";
        private Duration minDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(4);
        private int maxRetries = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(2);
        private int maxConsecutiveFailures = 3;
        /** 0 = unlimited. Positive values cap the harvest for development runs. */
        private int devRecordCap = 0;
    }

    @Data
    public static class Storage {
        private String snapshotFile = "data/tenders_memory.json";
        private boolean cleanOverwrite = false;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.BOTH;
        private String outputDir = "data/reports";

        public enum OutputMode {
            CSV, JSON, BOTH, NONE
        }
    }

    @Data
    public static class Health {
        private String webhookUrl = "";
        private String source = "ireps_scraper";
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 6,13,19 * * *";
        private String zone = "Asia/Kolkata";
        private boolean runOnStartup = false;
    }
}
