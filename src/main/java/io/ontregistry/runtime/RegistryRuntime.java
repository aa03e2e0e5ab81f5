package io.ontregistry.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ontregistry.config.RegistryConfig;
import io.ontregistry.config.RegistrySettings;
import io.ontregistry.model.ExperimentEntry;
import io.ontregistry.model.ExperimentRecord;
import io.ontregistry.model.Proposal;
import io.ontregistry.model.ScanProvenance;
import io.ontregistry.observability.AuditLog;
import io.ontregistry.proposal.ProposalManager;
import io.ontregistry.proposal.ProposalRepository;
import io.ontregistry.reconcile.DiscoveryReader;
import io.ontregistry.reconcile.FilesystemPathOracle;
import io.ontregistry.reconcile.PathOracle;
import io.ontregistry.reconcile.ReconciliationEngine;
import io.ontregistry.registry.AddResult;
import io.ontregistry.registry.RecordStore;
import io.ontregistry.storage.ExperimentDatabase;
import io.ontregistry.storage.RegistryIoException;
import io.ontregistry.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Wires the registry components for one data root.
 */
public final class RegistryRuntime {
    private static final Logger log = LoggerFactory.getLogger(RegistryRuntime.class);

    public static final String ACTION_ADD = "add";

    private final RegistryConfig config;
    private final RegistrySettings settings;
    private final RecordStore store;
    private final AuditLog auditLog;
    private final ProposalRepository proposals;
    private final ProposalManager proposalManager;
    private final ExperimentDatabase database;

    public RegistryRuntime(RegistryConfig config) {
        this(config, RegistrySettings.load(config), Clock.systemUTC());
    }

    public RegistryRuntime(RegistryConfig config, RegistrySettings settings, Clock clock) {
        this(config, settings, clock, new FilesystemPathOracle(settings.scanRoots()));
    }

    public RegistryRuntime(RegistryConfig config, RegistrySettings settings, Clock clock, PathOracle oracle) {
        this.config = config;
        this.settings = settings;
        this.store = new RecordStore(config, clock);
        this.auditLog = new AuditLog(config.auditFile(), config.auditLockFile(), settings.auditMaxEntries(), clock);
        this.proposals = new ProposalRepository(config, settings.proposalFormat());
        this.proposalManager = new ProposalManager(store, auditLog, proposals, new ReconciliationEngine(oracle, clock), clock);
        this.database = new ExperimentDatabase(config.dbFile(), clock);
    }

    public RegistryConfig config() {
        return config;
    }

    public RegistrySettings settings() {
        return settings;
    }

    public RecordStore store() {
        return store;
    }

    public AuditLog auditLog() {
        return auditLog;
    }

    public ProposalRepository proposals() {
        return proposals;
    }

    public ProposalManager proposalManager() {
        return proposalManager;
    }

    public ExperimentDatabase database() {
        return database;
    }

    public String actorOrDefault(String actor) {
        return actor == null || actor.isBlank() ? settings.defaultActor() : actor;
    }

    /**
     * Adds every record in a JSON file holding one record object or a list of them. Records that
     * changed the store are audited as {@code add}.
     */
    public List<AddResult> addFromFile(Path file, boolean force, String actor) {
        List<ExperimentRecord> records = readRecords(file);
        List<AddResult> results = new ArrayList<>(records.size());
        String who = actorOrDefault(actor);
        for (ExperimentRecord record : records) {
            AddResult result = store.add(record, force);
            results.add(result);
            if (result.outcome() != AddResult.Outcome.DUPLICATE && result.outcome() != AddResult.Outcome.REJECTED) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("outcome", result.outcome().name().toLowerCase(Locale.ROOT));
                details.put("force", force);
                details.put("source", file.toString());
                auditLog.append(ACTION_ADD, result.runId(), who, details);
            }
        }
        return results;
    }

    public Proposal propose(Path discoveredFile, boolean includeDatabase, ScanProvenance provenance) {
        List<ExperimentEntry> discovered = DiscoveryReader.read(discoveredFile);
        Map<String, ExperimentRecord> databaseRows = includeDatabase ? database.loadByPath() : Map.of();
        log.info("[RUNTIME] Proposing from {} discovered entries ({} database rows)", discovered.size(), databaseRows.size());
        return proposalManager.create(discovered, provenance, databaseRows);
    }

    public int importDiscovered(Path discoveredFile) {
        database.init();
        return database.upsert(DiscoveryReader.read(discoveredFile));
    }

    private static List<ExperimentRecord> readRecords(Path file) {
        ObjectMapper mapper = Jsons.mapperFor(file);
        try {
            JsonNode root = mapper.readTree(Files.readAllBytes(file));
            List<ExperimentRecord> out = new ArrayList<>();
            if (root != null && root.isArray()) {
                for (JsonNode node : root) {
                    out.add(mapper.treeToValue(node, ExperimentRecord.class));
                }
            } else if (root != null && root.isObject()) {
                out.add(mapper.treeToValue(root, ExperimentRecord.class));
            } else {
                throw new IllegalArgumentException("Record file " + file + " holds no record object or list");
            }
            return out;
        } catch (IOException e) {
            throw new RegistryIoException("Failed to read record file: " + file, e);
        }
    }
}
