package com.tenderintel.tender.change;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.TenderRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The persisted snapshot: a JSON object keyed by tender number.
 *
 * Writes go to {@code <file>.tmp}, the current file is copied to {@code <file>.bak}, then the
 * temp file is renamed over the target. A crash at any point leaves either the old or the new
 * snapshot readable.
 */
@Component
@Slf4j
public class SnapshotStore {

    private static final TypeReference<LinkedHashMap<String, TenderRecord>> SNAPSHOT_TYPE =
            new TypeReference<>() {
            };

    private final Path file;
    private final ObjectMapper mapper;

    public SnapshotStore(TenderScraperProperties properties, ObjectMapper mapper) {
        this(Paths.get(properties.getStorage().getSnapshotFile()), mapper);
    }

    SnapshotStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    public Path path() {
        return file;
    }

    Path backupPath() {
        return file.resolveSibling(file.getFileName() + ".bak");
    }

    Path tempPath() {
        return file.resolveSibling(file.getFileName() + ".tmp");
    }

    /** Missing or unreadable snapshot loads as empty; a corrupt one falls back to the backup first. */
    public Map<String, TenderRecord> load() {
        if (!Files.exists(file)) {
            log.info("No snapshot at {}, starting fresh", file);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, TenderRecord> snapshot = read(file);
            log.info("Loaded memory with {} tenders from {}", snapshot.size(), file);
            return snapshot;
        } catch (IOException e) {
            log.warn("Could not load memory file {}: {}", file, e.getMessage());
        }

        Path backup = backupPath();
        if (Files.exists(backup)) {
            try {
                Map<String, TenderRecord> snapshot = read(backup);
                log.warn("Recovered {} tenders from backup {}", snapshot.size(), backup);
                return snapshot;
            } catch (IOException e) {
                log.warn("Backup {} unreadable too: {}", backup, e.getMessage());
            }
        }
        log.warn("Starting with an empty memory");
        return new LinkedHashMap<>();
    }

    public void save(Map<String, TenderRecord> snapshot) {
        Path tmp = tempPath();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
        } catch (IOException e) {
            log.error("Failed to write snapshot {}: {}", tmp, e.getMessage(), e);
            throw new RuntimeException("Snapshot write failed", e);
        }

        if (Files.exists(file)) {
            try {
                Files.copy(file, backupPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            } catch (IOException e) {
                log.warn("Could not create backup: {}", e.getMessage());
            }
        }

        try {
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to replace snapshot {}: {}", file, e.getMessage(), e);
            throw new RuntimeException("Snapshot write failed", e);
        }
        log.info("Saved memory with {} tenders to {}", snapshot.size(), file);
    }

    private Map<String, TenderRecord> read(Path path) throws IOException {
        Map<String, TenderRecord> snapshot = mapper.readValue(path.toFile(), SNAPSHOT_TYPE);
        return snapshot == null ? new LinkedHashMap<>() : snapshot;
    }
}
