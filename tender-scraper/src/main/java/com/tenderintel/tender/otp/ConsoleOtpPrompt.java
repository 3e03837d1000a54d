package com.tenderintel.tender.otp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Component
@Slf4j
public class ConsoleOtpPrompt implements ManualOtpPrompt {

    @Override
    public Optional<String> prompt() {
        PrintStream out = System.out;
        out.println();
        out.println("=".repeat(60));
        out.println("OTP not received via the SMS forwarder webhook.");
        out.println("Check your phone for the OTP SMS and type it below.");
        out.println("=".repeat(60));
        out.print("Enter OTP (or press Enter to skip): ");
        out.flush();

        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line = reader.readLine();
            if (line == null || line.isBlank()) {
                log.warn("Manual OTP input skipped");
                return Optional.empty();
            }
            String otp = line.trim();
            if (!OtpExtractor.isPlausibleCode(otp)) {
                out.println("Invalid OTP format: '" + otp + "' (expected 4-8 digits)");
                log.warn("Invalid manual OTP: {}", otp);
                return Optional.empty();
            }
            log.info("OTP entered manually");
            return Optional.of(otp);
        } catch (IOException e) {
            log.warn("Manual OTP input failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
