package io.ontregistry.proposal;

import io.ontregistry.model.ExperimentChange;
import io.ontregistry.model.ExperimentEntry;
import io.ontregistry.model.Proposal;
import io.ontregistry.model.ProposalSummary;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text review report for a proposal.
 */
public final class ProposalReportFormatter {
    private static final String RULE = "=".repeat(70);
    private static final String SECTION_RULE = "-".repeat(40);

    private ProposalReportFormatter() {
    }

    public static String format(Proposal proposal) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("EXPERIMENT DISCOVERY PROPOSAL ").append(proposal.id()).append('\n');
        sb.append(RULE).append('\n');
        sb.append("Generated: ").append(proposal.generatedAt()).append('\n');
        if (!proposal.provenance().jobId().isBlank()) {
            sb.append("Batch Job: ").append(proposal.provenance().jobId());
            if (!proposal.provenance().node().isBlank()) {
                sb.append(" on ").append(proposal.provenance().node());
            }
            sb.append('\n');
        }
        if (proposal.provenance().durationSeconds() > 0) {
            sb.append(String.format(Locale.ROOT, "Scan Duration: %.1fs%n", proposal.provenance().durationSeconds()));
        }
        sb.append('\n');

        ProposalSummary s = proposal.summary();
        header(sb, "SUMMARY");
        line(sb, "Total discovered:", s.totalDiscovered());
        line(sb, "Currently in registry:", s.currentInRegistry());
        line(sb, "New experiments:", s.newCount());
        line(sb, "Updated:", s.updatedCount());
        line(sb, "Removed:", s.removedCount());
        line(sb, "Unchanged:", s.unchangedCount());
        line(sb, "Unverified:", s.unverifiedCount());
        sb.append('\n');

        if (!proposal.added().isEmpty()) {
            header(sb, "NEW EXPERIMENTS");
            for (ExperimentEntry e : proposal.added()) {
                sb.append("  + ").append(label(e)).append(" [").append(e.metadataSource()).append("]\n");
                sb.append("    Path: ").append(e.path()).append('\n');
                sb.append("    Flow Cell: ").append(e.flowCellId()).append('\n');
                sb.append("    Files: POD5=").append(e.pod5Files())
                        .append(", Fast5=").append(e.fast5Files())
                        .append(", FASTQ=").append(e.fastqFiles())
                        .append(", BAM=").append(e.bamFiles()).append("\n\n");
            }
        }
        if (!proposal.updated().isEmpty()) {
            header(sb, "UPDATED EXPERIMENTS");
            for (ExperimentEntry e : proposal.updated()) {
                sb.append("  ~ ").append(label(e)).append('\n');
                sb.append("    Path: ").append(e.path()).append('\n');
                for (ExperimentChange change : e.changes()) {
                    sb.append("    ").append(change.field()).append(": ")
                            .append(change.oldValue()).append(" -> ").append(change.newValue()).append('\n');
                }
                sb.append('\n');
            }
        }
        removalSection(sb, "REMOVED EXPERIMENTS", "  - ", proposal.removed());
        removalSection(sb, "UNVERIFIED (LEFT UNTOUCHED)", "  ? ", proposal.unverified());

        header(sb, "STATUS");
        sb.append("  Approval: ").append(proposal.approvalStatus().wireName()).append('\n');
        if (proposal.approvedAt() != null) {
            sb.append("  Approved: ").append(proposal.approvedAt()).append(" by ").append(proposal.approvedBy()).append('\n');
        }
        if (proposal.rejectedAt() != null) {
            sb.append("  Rejected: ").append(proposal.rejectedAt()).append(" by ").append(proposal.rejectedBy()).append('\n');
        }
        if (proposal.appliedAt() != null) {
            sb.append("  Applied: ").append(proposal.appliedAt());
            if (proposal.appliedBy() != null) {
                sb.append(" by ").append(proposal.appliedBy());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void removalSection(StringBuilder sb, String title, String marker, List<ExperimentEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        header(sb, title);
        for (ExperimentEntry e : entries) {
            sb.append(marker).append(label(e)).append('\n');
            sb.append("    Path: ").append(e.path()).append('\n');
            sb.append("    Reason: ").append(e.removalReason()).append("\n\n");
        }
    }

    private static void header(StringBuilder sb, String title) {
        sb.append(title).append('\n').append(SECTION_RULE).append('\n');
    }

    private static void line(StringBuilder sb, String label, int value) {
        sb.append(String.format(Locale.ROOT, "  %-24s%d%n", label, value));
    }

    private static String label(ExperimentEntry e) {
        if (!e.sampleId().isBlank()) {
            return e.sampleId();
        }
        return e.id().isBlank() ? "unknown" : e.id();
    }
}
