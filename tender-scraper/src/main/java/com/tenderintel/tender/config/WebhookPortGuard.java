package com.tenderintel.tender.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.HashMap;
import java.util.Map;

/**
 * Runs before the embedded web server is created.
 *
 * If the webhook port is already bound (usually a standalone receiver started earlier),
 * this instance moves to an ephemeral port and the OTP coordinator polls the other
 * instance's /get-otp endpoint instead of waiting on its own webhook.
 */
@Slf4j
public class WebhookPortGuard implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    static final String PROPERTY_SOURCE_NAME = "webhookPortGuard";

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        apply(event.getEnvironment());
    }

    void apply(ConfigurableEnvironment environment) {
        int port = environment.getProperty("server.port", Integer.class, 8080);
        if (port <= 0 || isAvailable(port)) {
            return;
        }

        log.warn("Port {} is already in use. Using the existing OTP listener on that port; "
                + "stop any standalone receiver if codes are not picked up.", port);

        Map<String, Object> overrides = new HashMap<>();
        overrides.put("server.port", 0);
        overrides.put("tender-scraper.otp.use-existing-listener", true);
        overrides.put("tender-scraper.otp.existing-listener-port", port);
        environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, overrides));
    }

    static boolean isAvailable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
