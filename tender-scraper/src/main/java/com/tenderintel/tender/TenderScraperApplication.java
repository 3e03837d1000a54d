package com.tenderintel.tender;

import com.tenderintel.tender.config.WebhookPortGuard;
import com.tenderintel.tender.scheduler.ScrapeCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class TenderScraperApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(TenderScraperApplication.class);
        app.addListeners(new WebhookPortGuard());
        ConfigurableApplicationContext context = app.run(args);

        // --run-now and --test-login are one-shot: exit with the run's status
        if (context.getBean(ScrapeCommandRunner.class).isOneShot()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
