package io.ontregistry.reconcile;

import io.ontregistry.config.RegistryConfig;
import io.ontregistry.model.ExperimentChange;
import io.ontregistry.model.ExperimentEntry;
import io.ontregistry.model.ExperimentRecord;
import io.ontregistry.model.Proposal;
import io.ontregistry.model.ProposalSummary;
import io.ontregistry.model.ScanProvenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Diffs a discovered batch against the current registry contents, keyed by experiment path.
 *
 * <p>Every path in the union of both sides lands in exactly one partition:
 * <ul>
 *   <li>discovered, not current: {@code new}</li>
 *   <li>discovered and current, file counts differ: {@code updated} with the changed fields</li>
 *   <li>discovered and current, same counts: {@code unchanged}</li>
 *   <li>current only, directory confirmed gone and the run seen at none of its other paths:
 *       {@code removed}</li>
 *   <li>current only, directory gone but the run still present at another path: {@code unchanged}</li>
 *   <li>current only, directory still there: {@code unchanged}</li>
 *   <li>current only, existence cannot be checked: {@code unverified}</li>
 * </ul>
 * Absence from a scan alone never removes anything, so partial scans are safe.
 *
 * <p>Pure apart from the oracle calls; nothing is written.
 */
public final class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);
    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    public static final List<String> COMPARE_FIELDS = List.of("pod5_files", "fast5_files", "fastq_files", "bam_files");

    private final PathOracle oracle;
    private final Clock clock;

    public ReconciliationEngine(PathOracle oracle) {
        this(oracle, Clock.systemUTC());
    }

    public ReconciliationEngine(PathOracle oracle, Clock clock) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.clock = clock;
    }

    public Proposal compare(List<ExperimentEntry> discovered, Map<String, ExperimentRecord> current) {
        return compare(discovered, current, ScanProvenance.none());
    }

    public Proposal compare(
            List<ExperimentEntry> discovered,
            Map<String, ExperimentRecord> current,
            ScanProvenance provenance
    ) {
        List<ExperimentEntry> batch = discovered == null ? List.of() : discovered;
        Map<String, ExperimentRecord> known = current == null ? Map.of() : current;

        List<ExperimentEntry> added = new ArrayList<>();
        List<ExperimentEntry> updated = new ArrayList<>();
        List<ExperimentEntry> removed = new ArrayList<>();
        List<ExperimentEntry> unchanged = new ArrayList<>();
        List<ExperimentEntry> unverified = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (ExperimentEntry entry : batch) {
            if (entry == null || entry.path().isBlank()) {
                log.warn("[RECONCILE] Skipping discovered entry without a path (id={})", entry == null ? null : entry.id());
                continue;
            }
            if (!seen.add(entry.path())) {
                log.warn("[RECONCILE] Duplicate discovered path {}, keeping the first entry", entry.path());
                continue;
            }
            ExperimentRecord stored = known.get(entry.path());
            if (stored == null) {
                added.add(entry);
                continue;
            }
            List<ExperimentChange> changes = detectChanges(entry, stored);
            if (changes.isEmpty()) {
                unchanged.add(entry);
            } else {
                updated.add(entry.withChanges(changes));
            }
        }

        Map<String, PathOracle.PathState> checked = new HashMap<>();
        for (Map.Entry<String, ExperimentRecord> currentEntry : known.entrySet()) {
            String path = currentEntry.getKey();
            if (seen.contains(path)) {
                continue;
            }
            ExperimentRecord record = currentEntry.getValue();
            ExperimentEntry entry = entryFor(path, record);
            PathOracle.PathState state = checked.computeIfAbsent(path, oracle::check);
            if (state == PathOracle.PathState.ABSENT) {
                state = siblingState(record, path, seen, checked);
                if (state == PathOracle.PathState.PRESENT) {
                    log.info("[RECONCILE] {} is gone but run_id={} is still present at another path",
                            path, record.getRunId());
                }
            }
            switch (state) {
                case ABSENT -> removed.add(entry.withRemovalReason(ExperimentEntry.REASON_NOT_FOUND));
                case PRESENT -> unchanged.add(entry);
                case UNKNOWN -> unverified.add(entry.withRemovalReason(ExperimentEntry.REASON_EXISTENCE_UNKNOWN));
            }
        }

        ProposalSummary summary = new ProposalSummary(
                batch.size(),
                known.size(),
                added.size(),
                updated.size(),
                removed.size(),
                unchanged.size(),
                unverified.size()
        );
        Instant now = Instant.now(clock);
        Proposal proposal = new Proposal(
                RegistryConfig.PROPOSAL_VERSION,
                "proposal_" + ID_FORMAT.format(now),
                now.toString(),
                provenance,
                added,
                updated,
                removed,
                unchanged,
                unverified,
                summary
        );
        log.info("[RECONCILE] {}: discovered={} current={} new={} updated={} removed={} unchanged={} unverified={}",
                proposal.id(), summary.totalDiscovered(), summary.currentInRegistry(), summary.newCount(),
                summary.updatedCount(), summary.removedCount(), summary.unchangedCount(), summary.unverifiedCount());
        return proposal;
    }

    /**
     * File-count differences between a discovered entry and the stored record; absent counts are
     * zero on both sides.
     */
    public static List<ExperimentChange> detectChanges(ExperimentEntry discovered, ExperimentRecord current) {
        List<ExperimentChange> changes = new ArrayList<>();
        for (String field : COMPARE_FIELDS) {
            int newValue = discovered.fileCount(field);
            int oldValue = current.fileCount(field);
            if (newValue != oldValue) {
                changes.add(new ExperimentChange(field, oldValue, newValue));
            }
        }
        return changes;
    }

    /**
     * Combines several path-keyed sources; earlier sources win when a path appears twice.
     */
    @SafeVarargs
    public static Map<String, ExperimentRecord> mergeSources(Map<String, ExperimentRecord>... sources) {
        return mergeSources(Arrays.asList(sources));
    }

    public static Map<String, ExperimentRecord> mergeSources(List<Map<String, ExperimentRecord>> sources) {
        Map<String, ExperimentRecord> out = new LinkedHashMap<>();
        for (Map<String, ExperimentRecord> source : sources) {
            if (source != null) {
                source.forEach(out::putIfAbsent);
            }
        }
        return out;
    }

    /**
     * Combined state of a record's other paths: present if the batch or the oracle finds any of
     * them, unknown if one cannot be checked, otherwise absent.
     */
    private PathOracle.PathState siblingState(
            ExperimentRecord record,
            String missingPath,
            Set<String> seen,
            Map<String, PathOracle.PathState> checked
    ) {
        PathOracle.PathState combined = PathOracle.PathState.ABSENT;
        for (String other : record.observedPaths()) {
            if (other.equals(missingPath)) {
                continue;
            }
            if (seen.contains(other)) {
                return PathOracle.PathState.PRESENT;
            }
            PathOracle.PathState state = checked.computeIfAbsent(other, oracle::check);
            if (state == PathOracle.PathState.PRESENT) {
                return state;
            }
            if (state == PathOracle.PathState.UNKNOWN) {
                combined = state;
            }
        }
        return combined;
    }

    private static ExperimentEntry entryFor(String path, ExperimentRecord record) {
        return new ExperimentEntry(
                record.getRunId(),
                path,
                record.getExperimentName(),
                record.getFlowcell(),
                null,
                null,
                record.getDevice(),
                null,
                null,
                null,
                record.fileCount("pod5_files"),
                record.fileCount("fast5_files"),
                record.fileCount("fastq_files"),
                record.fileCount("bam_files"),
                null,
                null,
                null
        );
    }
}
