package io.ontregistry.cli;

import io.ontregistry.RegistryException;
import io.ontregistry.config.RegistryConfig;
import io.ontregistry.model.ExperimentRecord;
import io.ontregistry.model.Proposal;
import io.ontregistry.model.ScanProvenance;
import io.ontregistry.proposal.ApplyReport;
import io.ontregistry.proposal.ProposalReportFormatter;
import io.ontregistry.registry.AddResult;
import io.ontregistry.runtime.RegistryRuntime;
import io.ontregistry.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "ont-registry",
        mixinStandardHelpOptions = true,
        description = "Nanopore experiment registry and reconciliation CLI",
        subcommands = {
                RegistryCommand.StatsCommand.class,
                RegistryCommand.GetCommand.class,
                RegistryCommand.SearchCommand.class,
                RegistryCommand.AddCommand.class,
                RegistryCommand.BestCommand.class,
                RegistryCommand.FlowcellsCommand.class,
                RegistryCommand.DevicesCommand.class,
                RegistryCommand.ProposeCommand.class,
                RegistryCommand.ReviewCommand.class,
                RegistryCommand.ApproveCommand.class,
                RegistryCommand.RejectCommand.class,
                RegistryCommand.ApplyCommand.class,
                RegistryCommand.AuditTailCommand.class,
                RegistryCommand.DbInitCommand.class,
                RegistryCommand.DbImportCommand.class
        }
)
public final class RegistryCommand implements Runnable {

    @Option(names = {"--root"}, description = "Registry data root (default: $ONT_REGISTRY_HOME or ~/.ont-registry)")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: stats | get | search | add | best | flowcells | devices | propose | review | approve | reject | apply | audit-tail | db-init | db-import");
    }

    RegistryRuntime runtime() {
        return new RegistryRuntime(RegistryConfig.fromRoot(root));
    }

    static void printError(String message) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("error", message);
        System.out.println(Jsons.toJson(error));
    }

    @Command(name = "stats", description = "Show registry statistics")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().store().stats()));
            return 0;
        }
    }

    @Command(name = "get", description = "Show one record by run id")
    static final class GetCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            Optional<ExperimentRecord> record = parent.runtime().store().get(runId);
            if (record.isEmpty()) {
                printError("record not found");
                return 1;
            }
            System.out.println(Jsons.toJson(record.get()));
            return 0;
        }
    }

    @Command(name = "search", description = "List records whose fields equal every given value")
    static final class SearchCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Option(names = {"--field"}, description = "Criterion as field=value (repeatable)")
        Map<String, String> fields = new LinkedHashMap<>();

        @Override
        public Integer call() {
            Map<String, Object> criteria = new LinkedHashMap<>(fields);
            System.out.println(Jsons.toJson(parent.runtime().store().search(criteria)));
            return 0;
        }
    }

    @Command(name = "add", description = "Add records from a JSON file (one record or a list)")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Option(names = {"--file"}, required = true, description = "Record JSON file")
        String file;

        @Option(names = {"--force"}, description = "Insert even when run id or fingerprint already exists")
        boolean force;

        @Option(names = {"--actor"}, description = "Actor recorded in the audit log")
        String actor;

        @Override
        public Integer call() {
            List<AddResult> results;
            try {
                results = parent.runtime().addFromFile(Paths.get(file), force, actor);
            } catch (RegistryException | IllegalArgumentException e) {
                printError(e.getMessage());
                return 1;
            }
            System.out.println(Jsons.toJson(results));
            boolean anyRejected = results.stream().anyMatch(r -> r.outcome() == AddResult.Outcome.REJECTED);
            return anyRejected ? 1 : 0;
        }
    }

    @Command(name = "best", description = "Pick the best record among those sharing a flowcell")
    static final class BestCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Parameters(index = "0", description = "Flowcell id")
        String flowcell;

        @Override
        public Integer call() {
            Optional<ExperimentRecord> best = parent.runtime().store().bestVersion(flowcell);
            if (best.isEmpty()) {
                printError("no records for flowcell");
                return 1;
            }
            System.out.println(Jsons.toJson(best.get()));
            return 0;
        }
    }

    @Command(name = "flowcells", description = "List known flowcells")
    static final class FlowcellsCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().store().listFlowcells()));
            return 0;
        }
    }

    @Command(name = "devices", description = "List known devices")
    static final class DevicesCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().store().listDevices()));
            return 0;
        }
    }

    @Command(name = "propose", description = "Reconcile a discovery batch into a pending proposal")
    static final class ProposeCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Option(names = {"--discovered"}, required = true, description = "Discovery batch (JSON or YAML)")
        String discovered;

        @Option(names = {"--db"}, description = "Also compare against the SQLite experiments database")
        boolean includeDatabase;

        @Option(names = {"--job-id"}, description = "Batch job id that produced the scan")
        String jobId;

        @Option(names = {"--node"}, description = "Node the scan ran on")
        String node;

        @Option(names = {"--duration"}, defaultValue = "0", description = "Scan duration in seconds")
        double duration;

        @Option(names = {"--scan-path"}, description = "Scanned root (repeatable)")
        List<String> scanPaths;

        @Override
        public Integer call() {
            RegistryRuntime runtime = parent.runtime();
            Proposal proposal;
            try {
                proposal = runtime.propose(Paths.get(discovered), includeDatabase,
                        new ScanProvenance(jobId, node, duration, scanPaths));
            } catch (RegistryException | IllegalArgumentException e) {
                printError(e.getMessage());
                return 1;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", proposal.id());
            out.put("file", runtime.proposals().pathFor(proposal.id()).toString());
            out.put("summary", proposal.summary());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "review", description = "Print a proposal as a review report")
    static final class ReviewCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Option(names = {"--proposal"}, description = "Proposal id or file")
        String proposal;

        @Option(names = {"--latest"}, description = "Review the newest proposal")
        boolean latest;

        @Override
        public Integer call() {
            Optional<Proposal> loaded;
            try {
                loaded = resolveProposal(parent.runtime(), latest ? null : proposal);
            } catch (RegistryException | IllegalArgumentException e) {
                printError(e.getMessage());
                return 1;
            }
            if (loaded.isEmpty()) {
                printError("no proposal found");
                return 1;
            }
            System.out.print(ProposalReportFormatter.format(loaded.get()));
            return 0;
        }
    }

    @Command(name = "approve", description = "Approve a pending proposal")
    static final class ApproveCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Proposal id or file (default: newest)")
        String proposal;

        @Option(names = {"--actor"}, description = "Approver (default: settings defaultActor)")
        String actor;

        @Override
        public Integer call() {
            RegistryRuntime runtime = parent.runtime();
            try {
                Optional<Proposal> loaded = resolveProposal(runtime, proposal);
                if (loaded.isEmpty()) {
                    printError("no proposal found");
                    return 1;
                }
                Proposal approved = runtime.proposalManager().approve(loaded.get(), runtime.actorOrDefault(actor));
                System.out.println(Jsons.toJson(statusOf(approved)));
                return 0;
            } catch (RegistryException | IllegalArgumentException e) {
                printError(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "reject", description = "Reject a pending proposal")
    static final class RejectCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Proposal id or file (default: newest)")
        String proposal;

        @Option(names = {"--actor"}, description = "Reviewer (default: settings defaultActor)")
        String actor;

        @Override
        public Integer call() {
            RegistryRuntime runtime = parent.runtime();
            try {
                Optional<Proposal> loaded = resolveProposal(runtime, proposal);
                if (loaded.isEmpty()) {
                    printError("no proposal found");
                    return 1;
                }
                Proposal rejected = runtime.proposalManager().reject(loaded.get(), runtime.actorOrDefault(actor));
                System.out.println(Jsons.toJson(statusOf(rejected)));
                return 0;
            } catch (RegistryException | IllegalArgumentException e) {
                printError(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "apply", description = "Apply an approved proposal to the registry")
    static final class ApplyCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Proposal id or file (default: newest)")
        String proposal;

        @Option(names = {"--actor"}, description = "Actor recorded in the audit log (default: settings defaultActor)")
        String actor;

        @Override
        public Integer call() {
            RegistryRuntime runtime = parent.runtime();
            try {
                Optional<Proposal> loaded = resolveProposal(runtime, proposal);
                if (loaded.isEmpty()) {
                    printError("no proposal found");
                    return 1;
                }
                ApplyReport report = runtime.proposalManager().apply(loaded.get(), runtime.actorOrDefault(actor));
                System.out.println(Jsons.toJson(report));
                return 0;
            } catch (RegistryException | IllegalArgumentException e) {
                printError(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "audit-tail", description = "Show the newest audit entries")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Number of newest entries")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().auditLog().tail(limit)));
            return 0;
        }
    }

    @Command(name = "db-init", description = "Create the SQLite experiments database")
    static final class DbInitCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Override
        public Integer call() {
            RegistryRuntime runtime = parent.runtime();
            runtime.database().init();
            System.out.println("Initialized experiments database at: " + runtime.database().dbFile());
            return 0;
        }
    }

    @Command(name = "db-import", description = "Upsert a discovery batch into the SQLite experiments database")
    static final class DbImportCommand implements Callable<Integer> {
        @ParentCommand
        RegistryCommand parent;

        @Option(names = {"--discovered"}, required = true, description = "Discovery batch (JSON or YAML)")
        String discovered;

        @Override
        public Integer call() {
            int written;
            try {
                written = parent.runtime().importDiscovered(Paths.get(discovered));
            } catch (RegistryException | IllegalArgumentException e) {
                printError(e.getMessage());
                return 1;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("imported", written);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    static Optional<Proposal> resolveProposal(RegistryRuntime runtime, String ref) {
        if (ref == null || ref.isBlank()) {
            return runtime.proposalManager().latest();
        }
        Path asFile = Paths.get(ref);
        if (ref.contains("/") || ref.endsWith(".yaml") || ref.endsWith(".yml") || ref.endsWith(".json")) {
            return Optional.of(runtime.proposals().load(asFile));
        }
        return Optional.of(runtime.proposalManager().load(ref));
    }

    private static Map<String, Object> statusOf(Proposal proposal) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", proposal.id());
        out.put("approval_status", proposal.approvalStatus());
        out.put("approved_at", proposal.approvedAt());
        out.put("approved_by", proposal.approvedBy());
        out.put("rejected_at", proposal.rejectedAt());
        out.put("rejected_by", proposal.rejectedBy());
        return out;
    }
}
