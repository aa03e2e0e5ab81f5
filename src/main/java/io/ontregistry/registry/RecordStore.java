package io.ontregistry.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.ontregistry.config.RegistryConfig;
import io.ontregistry.model.ExperimentChange;
import io.ontregistry.model.ExperimentRecord;
import io.ontregistry.storage.DocumentFiles;
import io.ontregistry.storage.RegistryIoException;
import io.ontregistry.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Owns the canonical set of experiment records, keyed by run_id, and persists them as one JSON
 * document.
 *
 * <p>Every mutation runs under an exclusive lock on the store's lock file. Inside the lock the
 * store re-reads the document if another writer touched it since this instance last read or
 * wrote it, applies the change, rebuilds the indexes and rewrites the whole document through a
 * temp file and rename. If the write fails the in-memory state stays ahead of disk: the next
 * mutation writes it again, or {@link #reload()} discards it.
 *
 * <p>Readers receive copies; mutate only through this class.
 */
public final class RecordStore {
    private static final Logger log = LoggerFactory.getLogger(RecordStore.class);

    private final Path documentFile;
    private final Path lockFile;
    private final Clock clock;
    private final MergeSelector mergeSelector;

    private LinkedHashMap<String, ExperimentRecord> experiments = new LinkedHashMap<>();
    private Map<String, Object> documentExtras = new LinkedHashMap<>();
    private RecordIndexes indexes = RecordIndexes.rebuild(List.of());
    private DocumentFiles.Stamp loadedStamp = DocumentFiles.Stamp.MISSING;

    public RecordStore(RegistryConfig config) {
        this(config.registryFile(), config.registryLockFile(), Clock.systemUTC(), new MergeSelector());
    }

    public RecordStore(RegistryConfig config, Clock clock) {
        this(config.registryFile(), config.registryLockFile(), clock, new MergeSelector());
    }

    public RecordStore(Path documentFile, Path lockFile, Clock clock, MergeSelector mergeSelector) {
        this.documentFile = documentFile;
        this.lockFile = lockFile;
        this.clock = clock;
        this.mergeSelector = mergeSelector;
        load();
    }

    public Path documentFile() {
        return documentFile;
    }

    /**
     * Discards in-memory state, including mutations whose write failed, and re-reads the document.
     */
    public synchronized void reload() {
        load();
    }

    public synchronized boolean exists(String runId) {
        return runId != null && experiments.containsKey(runId);
    }

    public synchronized Optional<String> existsByFingerprint(ExperimentRecord record) {
        String owner = indexes.runIdForFingerprint(FingerprintEngine.fingerprint(record));
        return Optional.ofNullable(owner);
    }

    /**
     * Registers a record, deduplicating by run_id and then by fingerprint unless {@code force}.
     *
     * <p>A known run_id or fingerprint absorbs the incoming record's paths into the existing
     * record's {@code all_paths} and reports {@code added=false}. With {@code force} the record is
     * inserted, or overwrites the one with the same run_id while keeping its paths and
     * registration time.
     */
    public synchronized AddResult add(ExperimentRecord incoming, boolean force) {
        Objects.requireNonNull(incoming, "record");
        String runId = incoming.getRunId();
        if (runId == null || runId.isBlank()) {
            List<String> paths = incoming.observedPaths();
            String where = paths.isEmpty() ? "<no path>" : paths.get(0);
            log.warn("[REGISTRY] Rejected record without run_id at {}", where);
            return AddResult.rejected("Missing run_id for record at " + where);
        }
        return mutate(() -> {
            String now = now();
            ExperimentRecord existing = experiments.get(runId);
            if (existing != null && !force) {
                if (mergePaths(existing, incoming, now)) {
                    log.info("[REGISTRY] Merged new paths into run_id={}", runId);
                    return Mutation.changed(AddResult.pathsMerged(runId));
                }
                return Mutation.unchanged(AddResult.duplicate(runId));
            }
            if (!force) {
                String owner = indexes.runIdForFingerprint(FingerprintEngine.fingerprint(incoming));
                if (owner != null && !owner.equals(runId) && experiments.containsKey(owner)) {
                    if (!FingerprintEngine.hasIdentity(incoming)) {
                        log.warn("[REGISTRY] run_id={} carries no identity fields; merging into run_id={} on the empty fingerprint",
                                runId, owner);
                    }
                    boolean grew = mergePaths(experiments.get(owner), incoming, now);
                    log.info("[REGISTRY] run_id={} matches fingerprint of run_id={} (paths merged={})", runId, owner, grew);
                    return new Mutation<>(AddResult.fingerprintMerged(runId, owner), grew);
                }
            }
            ExperimentRecord stored = incoming.copy();
            stored.setAllPaths(List.of());
            if (existing != null) {
                existing.getAllPaths().forEach(stored::addPath);
                stored.setRegisteredAt(existing.getRegisteredAt() == null ? now : existing.getRegisteredAt());
            } else {
                stored.setRegisteredAt(now);
            }
            incoming.observedPaths().forEach(stored::addPath);
            stored.setUpdatedAt(now);
            experiments.put(runId, stored);
            log.info("[REGISTRY] Added run_id={} flowcell={} device={} force={}",
                    runId, stored.getFlowcell(), stored.getDevice(), force);
            return Mutation.changed(AddResult.added(runId));
        });
    }

    /**
     * Applies field changes to one record. Changes are validated against a copy first so a bad
     * value leaves the record untouched.
     */
    public synchronized Optional<ExperimentRecord> update(String runId, List<ExperimentChange> changes) {
        return mutate(() -> {
            ExperimentRecord current = experiments.get(runId);
            if (current == null) {
                return Mutation.unchanged(Optional.<ExperimentRecord>empty());
            }
            if (changes == null || changes.isEmpty()) {
                return Mutation.unchanged(Optional.of(current.copy()));
            }
            ExperimentRecord working = current.copy();
            for (ExperimentChange change : changes) {
                working.applyField(change.field(), change.newValue());
            }
            working.setUpdatedAt(now());
            experiments.put(runId, working);
            log.info("[REGISTRY] Updated run_id={} fields={}", runId,
                    changes.stream().map(ExperimentChange::field).toList());
            return Mutation.changed(Optional.of(working.copy()));
        });
    }

    /**
     * Soft delete: the record stays in the store flagged {@code archived}.
     */
    public synchronized Optional<ExperimentRecord> archive(String runId, String reason) {
        return mutate(() -> {
            ExperimentRecord current = experiments.get(runId);
            if (current == null) {
                return Mutation.unchanged(Optional.<ExperimentRecord>empty());
            }
            if (current.isArchived()) {
                return Mutation.unchanged(Optional.of(current.copy()));
            }
            String now = now();
            current.setStatus(ExperimentRecord.STATUS_ARCHIVED);
            current.setArchivedReason(reason);
            current.setArchivedAt(now);
            current.setUpdatedAt(now);
            log.info("[REGISTRY] Archived run_id={} reason={}", runId, reason);
            return Mutation.changed(Optional.of(current.copy()));
        });
    }

    /**
     * Clears the archive flag of a record whose run directory came back.
     */
    public synchronized Optional<ExperimentRecord> restore(String runId) {
        return mutate(() -> {
            ExperimentRecord current = experiments.get(runId);
            if (current == null) {
                return Mutation.unchanged(Optional.<ExperimentRecord>empty());
            }
            if (!current.isArchived()) {
                return Mutation.unchanged(Optional.of(current.copy()));
            }
            current.setStatus(null);
            current.setArchivedReason(null);
            current.setArchivedAt(null);
            current.setUpdatedAt(now());
            log.info("[REGISTRY] Restored archived run_id={}", runId);
            return Mutation.changed(Optional.of(current.copy()));
        });
    }

    public synchronized Optional<ExperimentRecord> get(String runId) {
        ExperimentRecord record = runId == null ? null : experiments.get(runId);
        return Optional.ofNullable(record).map(ExperimentRecord::copy);
    }

    public synchronized int size() {
        return experiments.size();
    }

    public synchronized List<ExperimentRecord> all() {
        return experiments.values().stream().map(ExperimentRecord::copy).toList();
    }

    /**
     * Linear scan keeping records whose field equals every non-null criterion. Field names are the
     * document's wire names, extra fields included. Numbers compare by value.
     */
    public synchronized List<ExperimentRecord> search(Map<String, Object> criteria) {
        List<ExperimentRecord> out = new ArrayList<>();
        for (ExperimentRecord record : experiments.values()) {
            @SuppressWarnings("unchecked")
            Map<String, Object> fields = Jsons.mapper().convertValue(record, Map.class);
            boolean matches = true;
            for (Map.Entry<String, Object> criterion : criteria.entrySet()) {
                if (criterion.getValue() != null && !valuesEqual(fields.get(criterion.getKey()), criterion.getValue())) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                out.add(record.copy());
            }
        }
        return out;
    }

    /**
     * All records on a flowcell ordered by {@code date_time} ascending.
     */
    public synchronized List<ExperimentRecord> mergeCandidates(String flowcell) {
        return recordsFor(indexes.runIdsForFlowcell(flowcell)).stream()
                .sorted(Comparator.comparing(ExperimentRecord::dateTimeKey))
                .toList();
    }

    public synchronized Optional<ExperimentRecord> bestVersion(String flowcell) {
        List<ExperimentRecord> candidates = mergeCandidates(flowcell);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mergeSelector.selectBest(candidates));
    }

    public synchronized List<ExperimentRecord> findByDevice(String device) {
        return recordsFor(indexes.runIdsForDevice(device));
    }

    public synchronized List<ExperimentRecord> findByExperiment(String experimentName) {
        return recordsFor(indexes.runIdsForExperiment(experimentName));
    }

    public synchronized List<String> listDevices() {
        return indexes.byDevice().keySet().stream().sorted().toList();
    }

    public synchronized List<String> listFlowcells() {
        return indexes.byFlowcell().keySet().stream().sorted().toList();
    }

    public synchronized RecordIndexes indexes() {
        return indexes;
    }

    /**
     * Looks a record up by any path it has been observed at. Active records win over archived ones.
     */
    public synchronized Optional<ExperimentRecord> findByPath(String path) {
        ExperimentRecord archivedMatch = null;
        for (ExperimentRecord record : experiments.values()) {
            if (record.observedPaths().contains(path)) {
                if (!record.isArchived()) {
                    return Optional.of(record.copy());
                }
                if (archivedMatch == null) {
                    archivedMatch = record;
                }
            }
        }
        return Optional.ofNullable(archivedMatch).map(ExperimentRecord::copy);
    }

    /**
     * Path-keyed view of every active record, the "current" side of a reconciliation.
     */
    public synchronized Map<String, ExperimentRecord> byPath() {
        Map<String, ExperimentRecord> out = new LinkedHashMap<>();
        for (ExperimentRecord record : experiments.values()) {
            if (record.isArchived()) {
                continue;
            }
            for (String path : record.observedPaths()) {
                out.putIfAbsent(path, record.copy());
            }
        }
        return out;
    }

    public synchronized RegistryStats stats() {
        int canonical = 0;
        int withQc = 0;
        int withPod5 = 0;
        int archived = 0;
        long reads = 0L;
        for (ExperimentRecord record : experiments.values()) {
            if (record.canonicalOrFalse()) {
                canonical++;
            }
            if (truthy(record.extras().get("pct_signal_positive"))) {
                withQc++;
            }
            if (record.hasPod5OrFalse()) {
                withPod5++;
            }
            if (record.isArchived()) {
                archived++;
            }
            reads += record.totalReadsOrZero();
        }
        int mergeCandidates = (int) indexes.byFlowcell().values().stream().filter(ids -> ids.size() > 1).count();
        return new RegistryStats(
                experiments.size(),
                experiments.size(),
                indexes.byFlowcell().size(),
                indexes.byDevice().size(),
                indexes.byExperiment().size(),
                canonical,
                withQc,
                withPod5,
                mergeCandidates,
                reads,
                archived
        );
    }

    private List<ExperimentRecord> recordsFor(List<String> runIds) {
        List<ExperimentRecord> out = new ArrayList<>(runIds.size());
        for (String runId : runIds) {
            ExperimentRecord record = experiments.get(runId);
            if (record != null) {
                out.add(record.copy());
            }
        }
        return out;
    }

    private boolean mergePaths(ExperimentRecord target, ExperimentRecord incoming, String now) {
        boolean grew = false;
        for (String path : incoming.observedPaths()) {
            grew |= target.addPath(path);
        }
        if (grew) {
            target.setUpdatedAt(now);
        }
        return grew;
    }

    private <T> T mutate(Supplier<Mutation<T>> action) {
        return DocumentFiles.withExclusiveLock(lockFile, () -> {
            refreshIfChangedOnDisk();
            Mutation<T> mutation = action.get();
            if (mutation.dirty()) {
                persist();
            }
            return mutation.value();
        });
    }

    private void refreshIfChangedOnDisk() {
        DocumentFiles.Stamp onDisk = DocumentFiles.stamp(documentFile);
        if (!onDisk.equals(loadedStamp)) {
            log.debug("[REGISTRY] {} changed on disk, reloading before mutation", documentFile);
            load();
        }
    }

    private void load() {
        LinkedHashMap<String, ExperimentRecord> loaded = new LinkedHashMap<>();
        Map<String, Object> extras = new LinkedHashMap<>();
        DocumentFiles.Stamp stamp = DocumentFiles.stamp(documentFile);
        if (Files.exists(documentFile)) {
            try {
                RegistryDocument doc = Jsons.mapper().readValue(documentFile.toFile(), RegistryDocument.class);
                for (Map.Entry<String, ExperimentRecord> entry : doc.experiments().entrySet()) {
                    ExperimentRecord record = entry.getValue();
                    if (record == null) {
                        continue;
                    }
                    record.setRunId(entry.getKey());
                    loaded.put(entry.getKey(), record);
                }
                extras.putAll(doc.extras());
            } catch (IOException e) {
                throw new RegistryIoException("Failed to read registry: " + documentFile, e);
            }
        }
        this.experiments = loaded;
        this.documentExtras = extras;
        this.indexes = RecordIndexes.rebuild(loaded.values());
        this.loadedStamp = stamp;
        log.debug("[REGISTRY] Loaded {} records from {}", loaded.size(), documentFile);
    }

    private void persist() {
        indexes = RecordIndexes.rebuild(experiments.values());
        RegistryDocument doc = new RegistryDocument(
                RegistryConfig.REGISTRY_VERSION,
                now(),
                stats(),
                indexes,
                experiments,
                documentExtras
        );
        byte[] bytes;
        try {
            bytes = Jsons.mapper().writeValueAsBytes(doc);
        } catch (JsonProcessingException e) {
            throw new RegistryIoException("Failed to serialize registry: " + documentFile, e);
        }
        DocumentFiles.writeAtomically(documentFile, bytes);
        loadedStamp = DocumentFiles.stamp(documentFile);
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(e.toString())) == 0;
        }
        if (expected instanceof String text && !(actual instanceof String)) {
            return actual.toString().equals(text);
        }
        return actual.equals(expected);
    }

    private static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        return !value.toString().isEmpty();
    }

    private record Mutation<T>(T value, boolean dirty) {
        static <T> Mutation<T> changed(T value) {
            return new Mutation<>(value, true);
        }

        static <T> Mutation<T> unchanged(T value) {
            return new Mutation<>(value, false);
        }
    }
}
