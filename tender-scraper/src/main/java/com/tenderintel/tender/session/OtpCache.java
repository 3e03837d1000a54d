package com.tenderintel.tender.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderintel.tender.config.TenderScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * The last accepted OTP, kept on disk for a day.
 *
 * The portal issues the same code for 24 hours but only allows two generations per
 * hour, so re-using a cached code avoids spending a generation on every run.
 * Cache problems are never fatal: they are logged and the cache is treated as empty.
 */
@Component
@Slf4j
public class OtpCache {

    private final Path cacheFile;
    private final Duration maxAge;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OtpCache(TenderScraperProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(Paths.get(properties.getOtp().getCacheFile()), properties.getOtp().getCacheMaxAge(), objectMapper, clock);
    }

    OtpCache(Path cacheFile, Duration maxAge, ObjectMapper objectMapper, Clock clock) {
        this.cacheFile = cacheFile;
        this.maxAge = maxAge;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Optional<String> load() {
        if (!Files.isRegularFile(cacheFile)) return Optional.empty();
        try {
            Entry entry = objectMapper.readValue(cacheFile.toFile(), Entry.class);
            if (entry.code() == null || entry.code().isBlank() || entry.timestamp() == null) {
                return Optional.empty();
            }
            Duration age = Duration.between(LocalDateTime.parse(entry.timestamp()), LocalDateTime.now(clock));
            if (age.compareTo(maxAge) >= 0) {
                log.info("Cached OTP is {}h old (max {}h), expired", age.toHours(), maxAge.toHours());
                return Optional.empty();
            }
            log.info("Found cached OTP ({}m old)", age.toMinutes());
            return Optional.of(entry.code());
        } catch (IOException | DateTimeParseException e) {
            log.debug("Could not load cached OTP: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void save(String code) {
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Entry entry = new Entry(code, LocalDateTime.now(clock).toString());
            objectMapper.writeValue(cacheFile.toFile(), entry);
            log.info("OTP cached at {} (valid for {}h)", entry.timestamp(), maxAge.toHours());
        } catch (IOException e) {
            log.warn("Could not save OTP cache: {}", e.getMessage());
        }
    }

    public void invalidate() {
        try {
            Files.deleteIfExists(cacheFile);
        } catch (IOException e) {
            log.warn("Could not delete OTP cache {}: {}", cacheFile, e.getMessage());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entry(String code, String timestamp) {
    }
}
