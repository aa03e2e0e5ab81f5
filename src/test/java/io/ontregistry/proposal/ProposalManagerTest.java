package io.ontregistry.proposal;

import io.ontregistry.config.RegistryConfig;
import io.ontregistry.model.ApprovalStatus;
import io.ontregistry.model.AuditEntry;
import io.ontregistry.model.ExperimentChange;
import io.ontregistry.model.ExperimentEntry;
import io.ontregistry.model.ExperimentRecord;
import io.ontregistry.model.Proposal;
import io.ontregistry.model.ProposalSummary;
import io.ontregistry.model.ScanProvenance;
import io.ontregistry.observability.AuditLog;
import io.ontregistry.reconcile.PathOracle;
import io.ontregistry.reconcile.ReconciliationEngine;
import io.ontregistry.registry.AddResult;
import io.ontregistry.registry.RecordStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class ProposalManagerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);

    @Test
    void updatedFileCountFlowsThroughApproveAndApply() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-update-");
        try {
            Fixture f = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            ExperimentRecord existing = new ExperimentRecord("ab12cd34");
            existing.setFlowcell("FC1");
            existing.setDevice("D1");
            existing.setDate("2024-01-01");
            existing.setTime("10:00");
            existing.setTotalReads(1000L);
            existing.setPod5Files(400);
            existing.setCurrentPath("/data/run1");
            f.store.add(existing, false);

            ExperimentEntry rescanned = new ExperimentEntry("ab12cd34", "/data/run1", null, "FC1", null, null, "D1",
                    null, null, null, 500, 0, 0, 0, null, null, null);
            Proposal proposal = f.manager.create(List.of(rescanned), ScanProvenance.none());

            Assertions.assertEquals(1, proposal.updated().size());
            Assertions.assertEquals(List.of(new ExperimentChange("pod5_files", 400, 500)),
                    proposal.updated().get(0).changes());
            Assertions.assertTrue(Files.exists(f.repository.pathFor(proposal.id())));

            f.manager.approve(proposal, "reviewer");
            ApplyReport report = f.manager.apply(proposal, "reviewer");

            Assertions.assertFalse(report.alreadyApplied());
            Assertions.assertEquals(1, report.appliedCount());
            Assertions.assertEquals(500, f.store.get("ab12cd34").orElseThrow().getPod5Files());
            List<AuditEntry> audit = f.audit.entries();
            Assertions.assertEquals(1, audit.size());
            Assertions.assertEquals("apply", audit.get(0).action());
            Assertions.assertEquals("ab12cd34", audit.get(0).recordId());
            Assertions.assertEquals(proposal.id(), audit.get(0).changes().get("proposal_id"));
            Assertions.assertEquals(ApprovalStatus.APPLIED, proposal.approvalStatus());
            Assertions.assertEquals("2024-05-01T08:00:00Z", proposal.appliedAt());
            Assertions.assertTrue(Files.exists(root.resolve("approved").resolve(proposal.id() + ".yaml")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void applyOnPendingIsRejectedAndSecondApplyIsNoOp() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-guard-");
        try {
            Fixture f = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            Proposal proposal = f.manager.create(List.of(newEntry("run_new", "/data/new")), ScanProvenance.none());

            ProposalStateException pending = Assertions.assertThrows(ProposalStateException.class,
                    () -> f.manager.apply(proposal, "someone"));
            Assertions.assertEquals(ApprovalStatus.PENDING, pending.state());
            Assertions.assertEquals(0, f.store.size());
            Assertions.assertTrue(f.audit.entries().isEmpty());

            f.manager.approve(proposal, "reviewer");
            Assertions.assertThrows(ProposalStateException.class, () -> f.manager.approve(proposal, "reviewer"));
            Assertions.assertThrows(ProposalStateException.class, () -> f.manager.reject(proposal, "reviewer"));

            f.manager.apply(proposal, "reviewer");
            Assertions.assertEquals(1, f.store.size());
            Assertions.assertEquals(1, f.audit.entries().size());

            ApplyReport second = f.manager.apply(proposal, "reviewer");
            Assertions.assertTrue(second.alreadyApplied());
            Assertions.assertEquals(1, f.audit.entries().size());

            Proposal reloaded = f.manager.load(proposal.id());
            Assertions.assertTrue(reloaded.isApplied());
            Assertions.assertTrue(f.manager.apply(reloaded, "reviewer").alreadyApplied());
            Assertions.assertEquals(1, f.audit.entries().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectedProposalCannotBeApplied() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-reject-");
        try {
            Fixture f = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            Proposal proposal = f.manager.create(List.of(newEntry("run_new", "/data/new")), ScanProvenance.none());
            f.manager.reject(proposal, "reviewer");

            Proposal reloaded = f.manager.load(proposal.id());
            Assertions.assertEquals(ApprovalStatus.REJECTED, reloaded.approvalStatus());
            Assertions.assertEquals("reviewer", reloaded.rejectedBy());
            Assertions.assertThrows(ProposalStateException.class, () -> f.manager.apply(reloaded, "reviewer"));
            Assertions.assertEquals(0, f.store.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void newEntriesAreMappedAndRemovedEntriesArchivedAcrossRestart() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-restart-");
        try {
            Fixture first = new Fixture(root, path -> path.equals("/data/gone")
                    ? PathOracle.PathState.ABSENT
                    : PathOracle.PathState.UNKNOWN);
            ExperimentRecord gone = new ExperimentRecord("run_gone");
            gone.setFlowcell("FC0");
            gone.setCurrentPath("/data/gone");
            first.store.add(gone, false);
            ExperimentRecord offline = new ExperimentRecord("run_offline");
            offline.setFlowcell("FC9");
            offline.setCurrentPath("/offline/run");
            first.store.add(offline, false);

            Proposal created = first.manager.create(
                    List.of(newEntry("run_new", "/data/new")),
                    new ScanProvenance("job-77", "gl-node-3", 12.5, List.of("/data")));
            Assertions.assertEquals(1, created.removed().size());
            Assertions.assertEquals(1, created.unverified().size());

            Fixture second = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            Proposal reloaded = second.manager.latest().orElseThrow();
            Assertions.assertEquals(created.id(), reloaded.id());
            Assertions.assertEquals("job-77", reloaded.provenance().jobId());
            Assertions.assertEquals(created.unchangedCount(), reloaded.unchangedCount());
            second.manager.approve(reloaded, "reviewer");

            Fixture third = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            Proposal approved = third.manager.load(created.id());
            Assertions.assertEquals(ApprovalStatus.APPROVED, approved.approvalStatus());
            ApplyReport report = third.manager.apply(approved, "reviewer");
            Assertions.assertEquals(2, report.appliedCount());

            ExperimentRecord added = third.store.get("run_new").orElseThrow();
            Assertions.assertEquals("FAB001", added.getFlowcell());
            Assertions.assertEquals("P2S-001", added.getDevice());
            Assertions.assertEquals("group_1", added.getExperimentName());
            Assertions.assertEquals("2024-03-01", added.getDate());
            Assertions.assertEquals("09:15", added.getTime());
            Assertions.assertEquals(Boolean.TRUE, added.getHasPod5());
            Assertions.assertEquals("discovery", added.extras().get("source"));

            Assertions.assertTrue(third.store.get("run_gone").orElseThrow().isArchived());
            Assertions.assertFalse(third.store.get("run_offline").orElseThrow().isArchived());
            Assertions.assertEquals(2, third.audit.entries().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void proposalsCreatedInTheSameSecondGetDistinctIds() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-ids-");
        try {
            Fixture f = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            Proposal one = f.manager.create(List.of(), ScanProvenance.none());
            Proposal two = f.manager.create(List.of(), ScanProvenance.none());

            Assertions.assertEquals("proposal_20240501_080000", one.id());
            Assertions.assertEquals("proposal_20240501_080000_2", two.id());
            Assertions.assertEquals(2, f.repository.list().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reviewReportListsSections() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-report-");
        try {
            Fixture f = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            Proposal proposal = f.manager.create(List.of(newEntry("run_new", "/data/new")),
                    new ScanProvenance("job-1", "", 3.0, List.of()));

            String report = ProposalReportFormatter.format(proposal);
            Assertions.assertTrue(report.contains("NEW EXPERIMENTS"));
            Assertions.assertTrue(report.contains("/data/new"));
            Assertions.assertTrue(report.contains("Batch Job: job-1"));
            Assertions.assertTrue(report.contains("Approval: pending"));
            Assertions.assertFalse(report.contains("REMOVED EXPERIMENTS"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runKeptWhenOnlyOneOfItsPathsDisappears() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-remount-");
        try {
            Fixture f = new Fixture(root, path -> path.startsWith("/mnt/b/")
                    ? PathOracle.PathState.ABSENT
                    : PathOracle.PathState.PRESENT);
            f.store.add(identified("run1", "/mnt/a/run1"), false);
            Assertions.assertEquals(AddResult.Outcome.FINGERPRINT_MERGED,
                    f.store.add(identified("run1_remount", "/mnt/b/run1"), false).outcome());

            ExperimentEntry rescanned = ExperimentEntry.ofPath("/mnt/a/run1");
            Proposal proposal = f.manager.create(List.of(rescanned), ScanProvenance.none());
            Assertions.assertTrue(proposal.removed().isEmpty());
            Assertions.assertEquals(2, proposal.unchanged().size());

            f.manager.approve(proposal, "reviewer");
            f.manager.apply(proposal, "reviewer");
            ExperimentRecord kept = f.store.get("run1").orElseThrow();
            Assertions.assertFalse(kept.isArchived());
            Assertions.assertEquals(List.of("/mnt/a/run1", "/mnt/b/run1"), kept.observedPaths());
            Assertions.assertTrue(f.audit.entries().isEmpty());

            Proposal next = f.manager.create(List.of(rescanned), ScanProvenance.none());
            Assertions.assertTrue(next.added().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void removalIsSkippedWhileAnotherPathIsNotConfirmedGone() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-live-path-");
        try {
            Fixture f = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            f.store.add(identified("run1", "/mnt/a/run1"), false);
            f.store.add(identified("run1_remount", "/mnt/b/run1"), false);

            Proposal handMade = proposal("proposal_20240501_070000",
                    List.of(),
                    List.of(ExperimentEntry.ofPath("/mnt/b/run1").withRemovalReason(ExperimentEntry.REASON_NOT_FOUND)),
                    List.of(ExperimentEntry.ofPath("/mnt/a/run1")));
            handMade.markApproved("reviewer", "2024-05-01T07:30:00Z");

            ApplyReport report = f.manager.apply(handMade, "reviewer");
            Assertions.assertEquals(0, report.appliedCount());
            Assertions.assertEquals("Run still at /mnt/a/run1", report.items().get(0).message());
            Assertions.assertFalse(f.store.get("run1").orElseThrow().isArchived());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void archivedRunThatReappearsIsRestored() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-restore-");
        try {
            Set<String> gone = new HashSet<>(Set.of("/data/back"));
            Fixture f = new Fixture(root, path -> gone.contains(path)
                    ? PathOracle.PathState.ABSENT
                    : PathOracle.PathState.PRESENT);
            ExperimentRecord record = new ExperimentRecord("run_back");
            record.setFlowcell("FAB001");
            record.setCurrentPath("/data/back");
            f.store.add(record, false);

            Proposal removal = f.manager.create(List.of(), ScanProvenance.none());
            f.manager.approve(removal, "reviewer");
            f.manager.apply(removal, "reviewer");
            Assertions.assertTrue(f.store.get("run_back").orElseThrow().isArchived());

            gone.clear();
            Proposal comeback = f.manager.create(List.of(newEntry("run_back", "/data/back")), ScanProvenance.none());
            Assertions.assertEquals(1, comeback.added().size());
            f.manager.approve(comeback, "reviewer");
            ApplyReport report = f.manager.apply(comeback, "reviewer");

            Assertions.assertEquals(1, report.appliedCount());
            Assertions.assertEquals("Restored archived record", report.items().get(0).message());
            ExperimentRecord restored = f.store.get("run_back").orElseThrow();
            Assertions.assertFalse(restored.isArchived());
            Assertions.assertNull(restored.getArchivedReason());
            Assertions.assertEquals(1, f.store.size());
            AuditEntry last = f.audit.entries().get(f.audit.entries().size() - 1);
            Assertions.assertEquals("restored", last.changes().get("outcome"));
            Assertions.assertEquals(ExperimentEntry.REASON_NOT_FOUND, last.changes().get("previous_archived_reason"));

            Proposal settled = f.manager.create(List.of(newEntry("run_back", "/data/back")), ScanProvenance.none());
            Assertions.assertTrue(settled.added().isEmpty());
            Assertions.assertEquals(1, settled.updated().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void secondHandleOnTheSameProposalDoesNotApplyAgain() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-handles-");
        try {
            Fixture f = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            Proposal created = f.manager.create(List.of(newEntry("run_new", "/data/new")), ScanProvenance.none());
            f.manager.approve(created, "reviewer");

            Proposal first = f.manager.load(created.id());
            Proposal second = f.manager.load(created.id());
            Assertions.assertFalse(f.manager.apply(first, "alice").alreadyApplied());

            ApplyReport again = f.manager.apply(second, "bob");
            Assertions.assertTrue(again.alreadyApplied());
            Assertions.assertTrue(second.isApplied());
            Assertions.assertEquals("alice", second.appliedBy());
            Assertions.assertEquals(1, f.audit.entries().size());
            Assertions.assertEquals(1, f.store.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidFieldChangeFailsBeforeAnyWrite() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-invalid-");
        try {
            Fixture f = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            ExperimentRecord existing = new ExperimentRecord("run1");
            existing.setCurrentPath("/data/run1");
            f.store.add(existing, false);

            ExperimentEntry badUpdate = ExperimentEntry.ofPath("/data/run1")
                    .withChanges(List.of(new ExperimentChange("pod5_files", 0, 10),
                            new ExperimentChange("run_id", "run1", "run9")));
            Proposal handMade = new Proposal(RegistryConfig.PROPOSAL_VERSION, "proposal_20240501_070000",
                    "2024-05-01T07:00:00Z", ScanProvenance.none(),
                    List.of(newEntry("run_new", "/data/new")), List.of(badUpdate), List.of(), List.of(), List.of(),
                    new ProposalSummary(2, 1, 1, 1, 0, 0, 0));
            handMade.markApproved("reviewer", "2024-05-01T07:30:00Z");

            IllegalArgumentException failure = Assertions.assertThrows(IllegalArgumentException.class,
                    () -> f.manager.apply(handMade, "reviewer"));
            Assertions.assertTrue(failure.getMessage().contains("/data/run1"));
            Assertions.assertEquals(1, f.store.size());
            Assertions.assertEquals(0, f.store.get("run1").orElseThrow().getPod5Files());
            Assertions.assertTrue(f.audit.entries().isEmpty());
            Assertions.assertFalse(handMade.isApplied());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void updateAlreadyInPlaceIsNotAuditedAgain() throws Exception {
        Path root = Files.createTempDirectory("ont-registry-proposal-rerun-");
        try {
            Fixture f = new Fixture(root, path -> PathOracle.PathState.PRESENT);
            ExperimentRecord existing = new ExperimentRecord("run1");
            existing.setPod5Files(400);
            existing.setCurrentPath("/data/run1");
            f.store.add(existing, false);

            Proposal proposal = f.manager.create(
                    List.of(ExperimentEntry.ofPath("/data/run1").withFileCounts(500, 0, 0, 0)), ScanProvenance.none());
            f.manager.approve(proposal, "reviewer");
            f.store.update("run1", proposal.updated().get(0).changes());

            ApplyReport report = f.manager.apply(proposal, "reviewer");
            Assertions.assertEquals(0, report.appliedCount());
            Assertions.assertEquals("Already up to date", report.items().get(0).message());
            Assertions.assertTrue(f.audit.entries().isEmpty());
            Assertions.assertTrue(proposal.isApplied());
        } finally {
            deleteRecursively(root);
        }
    }

    private static ExperimentRecord identified(String runId, String path) {
        ExperimentRecord record = new ExperimentRecord(runId);
        record.setFlowcell("FC1");
        record.setDevice("D1");
        record.setExperimentName("exp");
        record.setDate("2024-01-01");
        record.setTime("10:00");
        record.setCurrentPath(path);
        return record;
    }

    private static Proposal proposal(
            String id,
            List<ExperimentEntry> added,
            List<ExperimentEntry> removed,
            List<ExperimentEntry> unchanged
    ) {
        ProposalSummary summary = new ProposalSummary(added.size() + unchanged.size(), removed.size() + unchanged.size(),
                added.size(), 0, removed.size(), unchanged.size(), 0);
        return new Proposal(RegistryConfig.PROPOSAL_VERSION, id, "2024-05-01T07:00:00Z", ScanProvenance.none(),
                added, List.of(), removed, unchanged, List.of(), summary);
    }

    private static ExperimentEntry newEntry(String id, String path) {
        return new ExperimentEntry(id, path, "sample_1", "FAB001", "group_1", "seq", "P2S-001",
                "2024-03-01T09:15:00.000+00:00", null, null, 120, 0, 0, 4, null, null, null);
    }

    private static final class Fixture {
        final RecordStore store;
        final AuditLog audit;
        final ProposalRepository repository;
        final ProposalManager manager;

        Fixture(Path root, PathOracle oracle) {
            RegistryConfig config = new RegistryConfig(root);
            this.store = new RecordStore(config, CLOCK);
            this.audit = new AuditLog(config.auditFile(), config.auditLockFile(), 100, CLOCK);
            this.repository = new ProposalRepository(config, "yaml");
            this.manager = new ProposalManager(store, audit, repository, new ReconciliationEngine(oracle, CLOCK), CLOCK);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
