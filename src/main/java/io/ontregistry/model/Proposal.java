package io.ontregistry.model;

import java.util.List;

/**
 * A reconciliation result under review. Created {@link ApprovalStatus#PENDING}; only the proposal
 * manager moves it through the approval lifecycle.
 */
public final class Proposal {
    private final String version;
    private final String id;
    private final String generatedAt;
    private final ScanProvenance provenance;
    private final ProposalSummary summary;
    private final List<ExperimentEntry> added;
    private final List<ExperimentEntry> updated;
    private final List<ExperimentEntry> removed;
    private final List<ExperimentEntry> unchanged;
    private final List<ExperimentEntry> unverified;
    private final int unchangedCount;

    private ApprovalStatus approvalStatus;
    private String approvedAt;
    private String approvedBy;
    private String rejectedAt;
    private String rejectedBy;
    private String appliedAt;
    private String appliedBy;

    public Proposal(
            String version,
            String id,
            String generatedAt,
            ScanProvenance provenance,
            List<ExperimentEntry> added,
            List<ExperimentEntry> updated,
            List<ExperimentEntry> removed,
            List<ExperimentEntry> unchanged,
            List<ExperimentEntry> unverified,
            ProposalSummary summary
    ) {
        this.version = version;
        this.id = id;
        this.generatedAt = generatedAt;
        this.provenance = provenance == null ? ScanProvenance.none() : provenance;
        this.added = List.copyOf(added);
        this.updated = List.copyOf(updated);
        this.removed = List.copyOf(removed);
        this.unchanged = List.copyOf(unchanged);
        this.unverified = List.copyOf(unverified);
        this.unchangedCount = unchanged.size();
        this.summary = summary;
        this.approvalStatus = ApprovalStatus.PENDING;
    }

    private Proposal(ProposalDocument doc) {
        ProposalDocument.Changes changes = doc.changes() == null
                ? new ProposalDocument.Changes(null, null, null, null)
                : doc.changes();
        this.version = doc.version();
        this.id = doc.id();
        this.generatedAt = doc.generatedAt();
        this.provenance = new ScanProvenance(doc.jobId(), doc.jobNode(), doc.scanDurationSeconds(), doc.scanPaths());
        this.summary = doc.summary() == null ? ProposalSummary.empty() : doc.summary();
        this.added = List.copyOf(changes.added());
        this.updated = List.copyOf(changes.updated());
        this.removed = List.copyOf(changes.removed());
        this.unverified = List.copyOf(changes.unverified());
        this.unchanged = List.of();
        this.unchangedCount = doc.unchangedCount();
        this.approvalStatus = doc.approvalStatus() == null ? ApprovalStatus.PENDING : doc.approvalStatus();
        this.approvedAt = doc.approvedAt();
        this.approvedBy = doc.approvedBy();
        this.rejectedAt = doc.rejectedAt();
        this.rejectedBy = doc.rejectedBy();
        this.appliedAt = doc.appliedAt();
        this.appliedBy = doc.appliedBy();
    }

    public static Proposal fromDocument(ProposalDocument doc) {
        return new Proposal(doc);
    }

    public ProposalDocument toDocument() {
        return new ProposalDocument(
                version,
                id,
                generatedAt,
                provenance.jobId(),
                provenance.node(),
                provenance.durationSeconds(),
                provenance.scanPaths(),
                summary,
                new ProposalDocument.Changes(added, updated, removed, unverified),
                unchangedCount,
                approvalStatus,
                approvedAt,
                approvedBy,
                rejectedAt,
                rejectedBy,
                appliedAt,
                appliedBy
        );
    }

    public void markApproved(String actor, String at) {
        this.approvalStatus = ApprovalStatus.APPROVED;
        this.approvedBy = actor;
        this.approvedAt = at;
    }

    public void markRejected(String actor, String at) {
        this.approvalStatus = ApprovalStatus.REJECTED;
        this.rejectedBy = actor;
        this.rejectedAt = at;
    }

    public void markApplied(String actor, String at) {
        this.approvalStatus = ApprovalStatus.APPLIED;
        this.appliedBy = actor;
        this.appliedAt = at;
    }

    /**
     * True once the completion stamp is set, whatever the status says.
     */
    public boolean isApplied() {
        return approvalStatus == ApprovalStatus.APPLIED || (appliedAt != null && !appliedAt.isBlank());
    }

    /**
     * The same pending proposal under another id.
     */
    public Proposal withId(String newId) {
        if (approvalStatus != ApprovalStatus.PENDING) {
            throw new IllegalStateException("Only a pending proposal can be renamed: " + id);
        }
        return new Proposal(version, newId, generatedAt, provenance, added, updated, removed, unchanged, unverified, summary);
    }

    public String version() {
        return version;
    }

    public String id() {
        return id;
    }

    public String generatedAt() {
        return generatedAt;
    }

    public ScanProvenance provenance() {
        return provenance;
    }

    public ProposalSummary summary() {
        return summary;
    }

    public List<ExperimentEntry> added() {
        return added;
    }

    public List<ExperimentEntry> updated() {
        return updated;
    }

    public List<ExperimentEntry> removed() {
        return removed;
    }

    /**
     * Unchanged entries are held only for a freshly generated proposal; a reloaded one keeps
     * just {@link #unchangedCount()}.
     */
    public List<ExperimentEntry> unchanged() {
        return unchanged;
    }

    public List<ExperimentEntry> unverified() {
        return unverified;
    }

    public int unchangedCount() {
        return unchangedCount;
    }

    public ApprovalStatus approvalStatus() {
        return approvalStatus;
    }

    public String approvedAt() {
        return approvedAt;
    }

    public String approvedBy() {
        return approvedBy;
    }

    public String rejectedAt() {
        return rejectedAt;
    }

    public String rejectedBy() {
        return rejectedBy;
    }

    public String appliedAt() {
        return appliedAt;
    }

    public String appliedBy() {
        return appliedBy;
    }
}
