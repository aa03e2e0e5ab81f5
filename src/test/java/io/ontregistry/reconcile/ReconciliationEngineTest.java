package io.ontregistry.reconcile;

import io.ontregistry.model.ExperimentChange;
import io.ontregistry.model.ExperimentEntry;
import io.ontregistry.model.ExperimentRecord;
import io.ontregistry.model.Proposal;
import io.ontregistry.model.ProposalSummary;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class ReconciliationEngineTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:34:56Z"), ZoneOffset.UTC);

    @Test
    void classifiesEveryPathIntoExactlyOnePartition() {
        Map<String, ExperimentRecord> current = new LinkedHashMap<>();
        current.put("/data/same", stored("same", 10));
        current.put("/data/changed", stored("changed", 400));
        current.put("/data/gone", stored("gone", 5));
        current.put("/data/still-there", stored("idle", 5));
        current.put("/offline/run", stored("offline", 5));

        PathOracle oracle = path -> switch (path) {
            case "/data/gone" -> PathOracle.PathState.ABSENT;
            case "/offline/run" -> PathOracle.PathState.UNKNOWN;
            default -> PathOracle.PathState.PRESENT;
        };
        List<ExperimentEntry> discovered = List.of(
                entry("same", "/data/same", 10),
                entry("changed", "/data/changed", 500),
                entry("fresh", "/data/fresh", 1));

        Proposal proposal = new ReconciliationEngine(oracle, CLOCK).compare(discovered, current);

        Assertions.assertEquals("proposal_20240501_123456", proposal.id());
        Assertions.assertEquals(List.of("/data/fresh"), paths(proposal.added()));
        Assertions.assertEquals(List.of("/data/changed"), paths(proposal.updated()));
        Assertions.assertEquals(List.of("/data/gone"), paths(proposal.removed()));
        Assertions.assertEquals(List.of("/data/same", "/data/still-there"), paths(proposal.unchanged()));
        Assertions.assertEquals(List.of("/offline/run"), paths(proposal.unverified()));

        Assertions.assertEquals(ExperimentEntry.REASON_NOT_FOUND, proposal.removed().get(0).removalReason());
        Assertions.assertEquals(ExperimentEntry.REASON_EXISTENCE_UNKNOWN, proposal.unverified().get(0).removalReason());
        Assertions.assertEquals(List.of(new ExperimentChange("pod5_files", 400, 500)), proposal.updated().get(0).changes());

        Set<String> union = new HashSet<>(current.keySet());
        discovered.forEach(e -> union.add(e.path()));
        ProposalSummary summary = proposal.summary();
        Assertions.assertEquals(union.size(), summary.classifiedTotal());
        Assertions.assertEquals(3, summary.totalDiscovered());
        Assertions.assertEquals(5, summary.currentInRegistry());
        Assertions.assertEquals(1, summary.unverifiedCount());
    }

    @Test
    void absenceFromScanAloneNeverRemoves() {
        Map<String, ExperimentRecord> current = new LinkedHashMap<>();
        current.put("/data/a", stored("a", 1));
        current.put("/data/b", stored("b", 1));

        Proposal proposal = new ReconciliationEngine(path -> PathOracle.PathState.PRESENT, CLOCK)
                .compare(List.of(), current);

        Assertions.assertTrue(proposal.removed().isEmpty());
        Assertions.assertEquals(2, proposal.unchanged().size());
    }

    @Test
    void duplicateAndBlankDiscoveredPathsAreDropped() {
        List<ExperimentEntry> discovered = List.of(
                entry("first", "/data/x", 1),
                entry("second", "/data/x", 99),
                entry("blank", "", 3));

        Proposal proposal = new ReconciliationEngine(path -> PathOracle.PathState.PRESENT, CLOCK)
                .compare(discovered, Map.of());

        Assertions.assertEquals(1, proposal.added().size());
        Assertions.assertEquals("first", proposal.added().get(0).id());
    }

    @Test
    void detectChangesTreatsMissingCountsAsZero() {
        ExperimentRecord record = new ExperimentRecord("r");
        ExperimentEntry entry = ExperimentEntry.ofPath("/data/r").withFileCounts(0, 0, 2, 0);

        List<ExperimentChange> changes = ReconciliationEngine.detectChanges(entry, record);

        Assertions.assertEquals(List.of(new ExperimentChange("fastq_files", 0, 2)), changes);
    }

    @Test
    void earlierSourcesWinWhenMerging() {
        ExperimentRecord fromDb = stored("db", 1);
        ExperimentRecord fromRegistry = stored("registry", 2);
        Map<String, ExperimentRecord> merged = ReconciliationEngine.mergeSources(
                Map.of("/data/x", fromDb),
                Map.of("/data/x", fromRegistry, "/data/y", fromRegistry),
                null);

        Assertions.assertSame(fromDb, merged.get("/data/x"));
        Assertions.assertSame(fromRegistry, merged.get("/data/y"));
    }

    @Test
    void missingCopyOfARunStillPresentElsewhereIsNotRemoved() {
        ExperimentRecord merged = stored("run1", 5);
        merged.setCurrentPath("/mnt/a/run1");
        merged.addPath("/mnt/b/run1");
        ExperimentRecord mirrored = stored("run2", 5);
        mirrored.setCurrentPath("/mnt/a/run2");
        mirrored.addPath("/mnt/b/run2");
        ExperimentRecord halfOffline = stored("run3", 5);
        halfOffline.setCurrentPath("/mnt/b/run3");
        halfOffline.addPath("/offline/run3");
        Map<String, ExperimentRecord> current = new LinkedHashMap<>();
        for (ExperimentRecord record : List.of(merged, mirrored, halfOffline)) {
            record.observedPaths().forEach(path -> current.put(path, record));
        }

        PathOracle oracle = path -> {
            if (path.startsWith("/mnt/b/")) {
                return PathOracle.PathState.ABSENT;
            }
            return path.startsWith("/offline/") ? PathOracle.PathState.UNKNOWN : PathOracle.PathState.PRESENT;
        };
        Proposal proposal = new ReconciliationEngine(oracle, CLOCK)
                .compare(List.of(entry("run1", "/mnt/a/run1", 5)), current);

        Assertions.assertTrue(proposal.removed().isEmpty());
        Assertions.assertEquals(List.of("/mnt/a/run1", "/mnt/b/run1", "/mnt/a/run2", "/mnt/b/run2"),
                paths(proposal.unchanged()));
        Assertions.assertEquals(List.of("/mnt/b/run3", "/offline/run3"), paths(proposal.unverified()));
        Assertions.assertEquals(current.size(), proposal.summary().classifiedTotal());
    }

    private static ExperimentRecord stored(String runId, int pod5) {
        ExperimentRecord record = new ExperimentRecord(runId);
        record.setPod5Files(pod5);
        return record;
    }

    private static ExperimentEntry entry(String id, String path, int pod5) {
        return new ExperimentEntry(id, path, id, "FC1", null, null, "D1", null, null, null,
                pod5, 0, 0, 0, null, null, null);
    }

    private static List<String> paths(List<ExperimentEntry> entries) {
        return entries.stream().map(ExperimentEntry::path).toList();
    }
}
