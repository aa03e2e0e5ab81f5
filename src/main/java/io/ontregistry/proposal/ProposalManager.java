package io.ontregistry.proposal;

import io.ontregistry.model.ApprovalStatus;
import io.ontregistry.model.ExperimentChange;
import io.ontregistry.model.ExperimentEntry;
import io.ontregistry.model.ExperimentRecord;
import io.ontregistry.model.Proposal;
import io.ontregistry.model.ScanProvenance;
import io.ontregistry.observability.AuditLog;
import io.ontregistry.reconcile.ReconciliationEngine;
import io.ontregistry.registry.AddResult;
import io.ontregistry.registry.RecordStore;
import io.ontregistry.storage.DocumentFiles;
import io.ontregistry.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Drives a proposal through {@code pending -> approved -> applied} (or {@code pending -> rejected})
 * and performs the registry writes when it is applied.
 *
 * <p>State changes of one proposal are serialized through its lock file and checked against the
 * saved copy, so two handles on the same file cannot both apply it. Every field change is
 * validated before the first registry write. If a write fails part-way, a re-run skips what
 * already landed: adds deduplicate, updates already in place and archived records are reported
 * as not applied and are not audited again.
 */
public final class ProposalManager {
    private static final Logger log = LoggerFactory.getLogger(ProposalManager.class);

    public static final String ACTION_APPLY = "apply";
    public static final String SOURCE_DISCOVERY = "discovery";

    private final RecordStore store;
    private final AuditLog auditLog;
    private final ProposalRepository repository;
    private final ReconciliationEngine engine;
    private final Clock clock;

    public ProposalManager(
            RecordStore store,
            AuditLog auditLog,
            ProposalRepository repository,
            ReconciliationEngine engine,
            Clock clock
    ) {
        this.store = store;
        this.auditLog = auditLog;
        this.repository = repository;
        this.engine = engine;
        this.clock = clock;
    }

    public Proposal create(List<ExperimentEntry> discovered, ScanProvenance provenance) {
        return create(discovered, provenance, Map.of());
    }

    /**
     * Reconciles a batch against the current experiments and saves the resulting pending
     * proposal. Database rows take precedence; active registry records fill in the other paths.
     */
    public Proposal create(
            List<ExperimentEntry> discovered,
            ScanProvenance provenance,
            Map<String, ExperimentRecord> databaseRows
    ) {
        Map<String, ExperimentRecord> current = ReconciliationEngine.mergeSources(databaseRows, store.byPath());
        Proposal proposal = engine.compare(discovered, current, provenance);
        String id = repository.uniqueId(proposal.id());
        if (!id.equals(proposal.id())) {
            proposal = proposal.withId(id);
        }
        repository.save(proposal);
        log.info("[PROPOSAL] Created {} at {}", proposal.id(), repository.pathFor(proposal.id()));
        return proposal;
    }

    public Proposal load(String proposalId) {
        return repository.load(proposalId);
    }

    public Optional<Proposal> latest() {
        return repository.latest().map(repository::load);
    }

    public Proposal approve(Proposal proposal, String actor) {
        return underLock(proposal, () -> {
            requireState(proposal, ApprovalStatus.PENDING, "approve");
            requireState(saved(proposal), ApprovalStatus.PENDING, "approve");
            proposal.markApproved(actor, now());
            repository.save(proposal);
            log.info("[PROPOSAL] {} approved by {}", proposal.id(), actor);
            return proposal;
        });
    }

    public Proposal reject(Proposal proposal, String actor) {
        return underLock(proposal, () -> {
            requireState(proposal, ApprovalStatus.PENDING, "reject");
            requireState(saved(proposal), ApprovalStatus.PENDING, "reject");
            proposal.markRejected(actor, now());
            repository.save(proposal);
            log.info("[PROPOSAL] {} rejected by {}", proposal.id(), actor);
            return proposal;
        });
    }

    /**
     * Writes an approved proposal into the registry: new entries are added, updated entries get
     * their field changes, removed entries are archived. Unverified entries are left alone. Each
     * registry change gets one audit entry. A record is archived only when every path it owns
     * is among the proposal's removed entries.
     *
     * @return a report with {@code alreadyApplied=true} and no writes when the proposal was
     *     applied before, through this handle or any other
     * @throws IllegalArgumentException when a field change cannot be applied; nothing is written
     */
    public ApplyReport apply(Proposal proposal, String actor) {
        return underLock(proposal, () -> applyLocked(proposal, actor));
    }

    private ApplyReport applyLocked(Proposal proposal, String actor) {
        Proposal saved = saved(proposal);
        if (!proposal.isApplied() && saved.isApplied()) {
            proposal.markApplied(saved.appliedBy(), saved.appliedAt());
        }
        if (proposal.isApplied()) {
            log.info("[PROPOSAL] {} already applied at {}, nothing to do", proposal.id(), proposal.appliedAt());
            return ApplyReport.alreadyApplied(proposal.id(), proposal.appliedAt());
        }
        requireState(proposal, ApprovalStatus.APPROVED, "apply");
        requireState(saved, ApprovalStatus.APPROVED, "apply");
        validateUpdates(proposal);

        List<ApplyReport.Item> items = new ArrayList<>();
        for (ExperimentEntry entry : proposal.added()) {
            items.add(applyNew(proposal, entry, actor));
        }
        for (ExperimentEntry entry : proposal.updated()) {
            items.add(applyUpdate(proposal, entry, actor));
        }
        for (ExperimentEntry entry : proposal.removed()) {
            items.add(applyRemoval(proposal, entry, actor));
        }
        if (!proposal.unverified().isEmpty()) {
            log.warn("[PROPOSAL] {}: {} unverified entries left untouched", proposal.id(), proposal.unverified().size());
        }

        String appliedAt = now();
        proposal.markApplied(actor, appliedAt);
        repository.save(proposal);
        repository.archive(proposal);
        ApplyReport report = new ApplyReport(proposal.id(), false, appliedAt, items);
        log.info("[PROPOSAL] {} applied by {}: applied={} skipped={}",
                proposal.id(), actor, report.appliedCount(), report.skippedCount());
        return report;
    }

    /**
     * Registry record for a newly discovered run directory.
     */
    public static ExperimentRecord toRecord(ExperimentEntry entry) {
        ExperimentRecord record = new ExperimentRecord(entry.id().isBlank() ? null : entry.id());
        record.setFlowcell(blankToNull(entry.flowCellId()));
        record.setDevice(blankToNull(entry.instrument()));
        String experimentName = entry.protocolGroupId().isBlank() ? entry.sampleId() : entry.protocolGroupId();
        record.setExperimentName(blankToNull(experimentName));
        String started = entry.started();
        if (started.length() >= 10) {
            record.setDate(started.substring(0, 10));
        }
        if (started.length() >= 16 && started.charAt(10) == 'T') {
            record.setTime(started.substring(11, 16));
        }
        record.setCurrentPath(entry.path());
        record.setPod5Files(entry.pod5Files());
        record.setFast5Files(entry.fast5Files());
        record.setFastqFiles(entry.fastqFiles());
        record.setBamFiles(entry.bamFiles());
        record.setHasPod5(entry.pod5Files() > 0);
        record.putExtra("source", SOURCE_DISCOVERY);
        if (!entry.sampleId().isBlank()) {
            record.putExtra("sample_id", entry.sampleId());
        }
        if (!entry.protocol().isBlank()) {
            record.putExtra("protocol", entry.protocol());
        }
        return record;
    }

    private ApplyReport.Item applyNew(Proposal proposal, ExperimentEntry entry, String actor) {
        Optional<ExperimentRecord> archived = archivedOwner(entry);
        if (archived.isPresent()) {
            return restore(proposal, entry, archived.get(), actor);
        }
        AddResult result = store.add(toRecord(entry), false);
        boolean changed = switch (result.outcome()) {
            case ADDED, PATHS_MERGED, FINGERPRINT_MERGED -> true;
            case DUPLICATE, REJECTED -> false;
        };
        if (changed) {
            Map<String, Object> details = details(proposal, "new", entry.path());
            details.put("outcome", result.outcome().name().toLowerCase(Locale.ROOT));
            auditLog.append(ACTION_APPLY, result.runId(), actor, details);
        } else if (result.outcome() == AddResult.Outcome.REJECTED) {
            log.warn("[PROPOSAL] {}: new entry {} not added: {}", proposal.id(), entry.path(), result.message());
        }
        return new ApplyReport.Item("new", entry.path(), result.runId(), changed, result.message());
    }

    private ApplyReport.Item applyUpdate(Proposal proposal, ExperimentEntry entry, String actor) {
        Optional<ExperimentRecord> target = store.findByPath(entry.path());
        if (target.isEmpty()) {
            log.warn("[PROPOSAL] {}: no record at {} to update", proposal.id(), entry.path());
            return new ApplyReport.Item("updated", entry.path(), null, false, "No record found at path");
        }
        String runId = target.get().getRunId();
        List<ExperimentChange> changes = entry.changes();
        if (alreadyInPlace(target.get(), changes)) {
            return new ApplyReport.Item("updated", entry.path(), runId, false, "Already up to date");
        }
        store.update(runId, changes);
        Map<String, Object> details = details(proposal, "updated", entry.path());
        details.put("changes", changes);
        auditLog.append(ACTION_APPLY, runId, actor, details);
        return new ApplyReport.Item("updated", entry.path(), runId, true, "Updated " + changes.size() + " fields");
    }

    private ApplyReport.Item applyRemoval(Proposal proposal, ExperimentEntry entry, String actor) {
        Optional<ExperimentRecord> target = store.findByPath(entry.path());
        if (target.isEmpty()) {
            log.warn("[PROPOSAL] {}: no record at {} to archive", proposal.id(), entry.path());
            return new ApplyReport.Item("removed", entry.path(), null, false, "No record found at path");
        }
        ExperimentRecord record = target.get();
        if (record.isArchived()) {
            return new ApplyReport.Item("removed", entry.path(), record.getRunId(), false, "Already archived");
        }
        Optional<String> livePath = livePath(proposal, record, entry.path());
        if (livePath.isPresent()) {
            log.warn("[PROPOSAL] {}: {} is gone but run_id={} is still at {}, not archiving",
                    proposal.id(), entry.path(), record.getRunId(), livePath.get());
            return new ApplyReport.Item("removed", entry.path(), record.getRunId(), false,
                    "Run still at " + livePath.get());
        }
        String reason = entry.removalReason().isBlank() ? ExperimentEntry.REASON_NOT_FOUND : entry.removalReason();
        store.archive(record.getRunId(), reason);
        Map<String, Object> details = details(proposal, "removed", entry.path());
        details.put("archived_reason", reason);
        auditLog.append(ACTION_APPLY, record.getRunId(), actor, details);
        return new ApplyReport.Item("removed", entry.path(), record.getRunId(), true, "Archived: " + reason);
    }

    private ApplyReport.Item restore(Proposal proposal, ExperimentEntry entry, ExperimentRecord archived, String actor) {
        String runId = archived.getRunId();
        store.restore(runId);
        if (runId.equals(entry.id())) {
            store.add(toRecord(entry), false);
        }
        Map<String, Object> details = details(proposal, "new", entry.path());
        details.put("outcome", "restored");
        details.put("previous_archived_reason", archived.getArchivedReason());
        auditLog.append(ACTION_APPLY, runId, actor, details);
        log.info("[PROPOSAL] {}: {} reappeared, restored run_id={}", proposal.id(), entry.path(), runId);
        return new ApplyReport.Item("new", entry.path(), runId, true, "Restored archived record");
    }

    /**
     * The archived record that already owns a "new" entry's path or run_id.
     */
    private Optional<ExperimentRecord> archivedOwner(ExperimentEntry entry) {
        Optional<ExperimentRecord> byPath = store.findByPath(entry.path());
        if (byPath.isPresent()) {
            return byPath.filter(ExperimentRecord::isArchived);
        }
        if (entry.id().isBlank()) {
            return Optional.empty();
        }
        return store.get(entry.id()).filter(ExperimentRecord::isArchived);
    }

    /**
     * Another path of the record that the proposal did not confirm gone.
     */
    private static Optional<String> livePath(Proposal proposal, ExperimentRecord record, String missingPath) {
        Set<String> confirmedGone = new HashSet<>();
        proposal.removed().forEach(entry -> confirmedGone.add(entry.path()));
        return record.observedPaths().stream()
                .filter(path -> !path.equals(missingPath))
                .filter(path -> !confirmedGone.contains(path))
                .findFirst();
    }

    private void validateUpdates(Proposal proposal) {
        for (ExperimentEntry entry : proposal.updated()) {
            Optional<ExperimentRecord> target = store.findByPath(entry.path());
            if (target.isEmpty()) {
                continue;
            }
            ExperimentRecord scratch = target.get().copy();
            try {
                for (ExperimentChange change : entry.changes()) {
                    scratch.applyField(change.field(), change.newValue());
                }
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Proposal " + proposal.id() + " cannot be applied at " + entry.path() + ": " + e.getMessage(), e);
            }
        }
    }

    private static boolean alreadyInPlace(ExperimentRecord target, List<ExperimentChange> changes) {
        ExperimentRecord scratch = target.copy();
        for (ExperimentChange change : changes) {
            scratch.applyField(change.field(), change.newValue());
        }
        return Jsons.mapper().valueToTree(scratch).equals(Jsons.mapper().valueToTree(target));
    }

    private <T> T underLock(Proposal proposal, Supplier<T> action) {
        return DocumentFiles.withExclusiveLock(repository.lockFileFor(proposal.id()), action);
    }

    private Proposal saved(Proposal proposal) {
        return repository.reload(proposal.id()).orElse(proposal);
    }

    private static Map<String, Object> details(Proposal proposal, String category, String path) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("proposal_id", proposal.id());
        details.put("category", category);
        details.put("path", path);
        return details;
    }

    private static void requireState(Proposal proposal, ApprovalStatus expected, String operation) {
        if (proposal.isApplied() || proposal.approvalStatus() != expected) {
            ApprovalStatus state = proposal.isApplied() ? ApprovalStatus.APPLIED : proposal.approvalStatus();
            throw new ProposalStateException(proposal.id(), state, operation);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
