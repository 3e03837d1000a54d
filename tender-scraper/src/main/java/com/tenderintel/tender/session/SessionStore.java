package com.tenderintel.tender.session;

import com.tenderintel.tender.config.TenderScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Where the browser's authenticated state lives between runs.
 * The file's modification time is the session's creation time.
 */
@Component
@Slf4j
public class SessionStore {

    private final Path sessionFile;
    private final Duration maxAge;
    private final Clock clock;

    public SessionStore(TenderScraperProperties properties, Clock clock) {
        this(Paths.get(properties.getSession().getFile()), properties.getSession().getMaxAge(), clock);
    }

    SessionStore(Path sessionFile, Duration maxAge, Clock clock) {
        this.sessionFile = sessionFile;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public Path path() {
        return sessionFile;
    }

    public boolean exists() {
        return Files.isRegularFile(sessionFile);
    }

    public Optional<Duration> age() {
        if (!exists()) return Optional.empty();
        try {
            Instant modified = Files.getLastModifiedTime(sessionFile).toInstant();
            return Optional.of(Duration.between(modified, clock.instant()));
        } catch (IOException e) {
            log.warn("Could not read session file time {}: {}", sessionFile, e.getMessage());
            return Optional.empty();
        }
    }

    /** Exists and younger than the max age. Says nothing about whether the portal still accepts it. */
    public boolean isFresh() {
        Optional<Duration> age = age();
        if (age.isEmpty()) {
            log.info("No saved session file found at {}", sessionFile);
            return false;
        }
        if (age.get().compareTo(maxAge) > 0) {
            log.info("Session file is {}h old (max {}h), expired", age.get().toHours(), maxAge.toHours());
            return false;
        }
        log.info("Session file exists and is {}m old, potentially valid", age.get().toMinutes());
        return true;
    }

    /** Make sure the parent directory exists before the browser writes the file. */
    public Path prepare() {
        try {
            Path parent = sessionFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new PortalException("Cannot create session directory for " + sessionFile, e);
        }
        return sessionFile;
    }
}
