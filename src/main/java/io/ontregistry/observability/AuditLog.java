package io.ontregistry.observability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.ontregistry.config.RegistryConfig;
import io.ontregistry.model.AuditEntry;
import io.ontregistry.storage.DocumentFiles;
import io.ontregistry.storage.RegistryIoException;
import io.ontregistry.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only history of mutations applied to the registry, stored as {@code {"entries": [...]}}
 * with the newest entry last. Only the most recent {@code maxEntries} are retained; older ones are
 * dropped on append.
 */
public final class AuditLog {
    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final Path auditFile;
    private final Path lockFile;
    private final int maxEntries;
    private final Clock clock;

    public AuditLog(RegistryConfig config, int maxEntries) {
        this(config.auditFile(), config.auditLockFile(), maxEntries, Clock.systemUTC());
    }

    public AuditLog(Path auditFile, Path lockFile, int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.auditFile = auditFile;
        this.lockFile = lockFile;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public AuditEntry append(String action, String recordId, String actor, Map<String, Object> changes) {
        AuditEntry entry = new AuditEntry(Instant.now(clock).toString(), action, recordId, actor, changes);
        append(entry);
        return entry;
    }

    public synchronized void append(AuditEntry entry) {
        DocumentFiles.withExclusiveLock(lockFile, () -> {
            List<AuditEntry> entries = new ArrayList<>(readEntries());
            entries.add(entry);
            int overflow = entries.size() - maxEntries;
            if (overflow > 0) {
                entries.subList(0, overflow).clear();
                log.debug("[AUDIT] Dropped {} oldest entries from {}", overflow, auditFile);
            }
            write(entries);
            return null;
        });
    }

    /**
     * Every retained entry, oldest first.
     */
    public synchronized List<AuditEntry> entries() {
        return List.copyOf(readEntries());
    }

    public synchronized List<AuditEntry> tail(int limit) {
        List<AuditEntry> all = readEntries();
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public int maxEntries() {
        return maxEntries;
    }

    private List<AuditEntry> readEntries() {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            AuditDocument doc = Jsons.mapper().readValue(auditFile.toFile(), AuditDocument.class);
            return doc == null || doc.entries() == null ? List.of() : doc.entries();
        } catch (IOException e) {
            throw new RegistryIoException("Failed to read audit log: " + auditFile, e);
        }
    }

    private void write(List<AuditEntry> entries) {
        try {
            DocumentFiles.writeAtomically(auditFile, Jsons.mapper().writeValueAsBytes(new AuditDocument(entries)));
        } catch (JsonProcessingException e) {
            throw new RegistryIoException("Failed to serialize audit log: " + auditFile, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AuditDocument(@JsonProperty("entries") List<AuditEntry> entries) {
    }
}
