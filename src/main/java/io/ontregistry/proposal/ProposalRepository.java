package io.ontregistry.proposal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ontregistry.config.RegistryConfig;
import io.ontregistry.model.Proposal;
import io.ontregistry.model.ProposalDocument;
import io.ontregistry.storage.DocumentFiles;
import io.ontregistry.storage.RegistryIoException;
import io.ontregistry.util.Jsons;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Proposal documents on disk: one file per proposal under {@code proposals/}, named by proposal id,
 * and a copy under {@code approved/} once applied.
 */
public final class ProposalRepository {
    private final Path proposalsDir;
    private final Path approvedDir;
    private final String extension;

    public ProposalRepository(RegistryConfig config, String format) {
        this(config.proposalsDir(), config.approvedDir(), format);
    }

    public ProposalRepository(Path proposalsDir, Path approvedDir, String format) {
        this.proposalsDir = proposalsDir;
        this.approvedDir = approvedDir;
        this.extension = "json".equalsIgnoreCase(format) ? ".json" : ".yaml";
    }

    public Path pathFor(String proposalId) {
        return proposalsDir.resolve(proposalId + extension);
    }

    /**
     * Lock file serializing state changes of one proposal across processes.
     */
    public Path lockFileFor(String proposalId) {
        return proposalsDir.resolve("." + proposalId + ".lock");
    }

    /**
     * The proposal as last saved, or empty when no file carries its id.
     */
    public Optional<Proposal> reload(String proposalId) {
        return find(proposalId).map(this::load);
    }

    public boolean exists(String proposalId) {
        return find(proposalId).isPresent();
    }

    public void save(Proposal proposal) {
        Path file = pathFor(proposal.id());
        DocumentFiles.writeAtomically(file, serialize(proposal, file));
    }

    public Proposal load(String proposalId) {
        Path file = find(proposalId)
                .orElseThrow(() -> new IllegalArgumentException("Proposal not found: " + proposalId));
        return load(file);
    }

    public Proposal load(Path file) {
        try {
            ProposalDocument doc = Jsons.mapperFor(file).readValue(file.toFile(), ProposalDocument.class);
            if (doc.id() == null || doc.id().isBlank()) {
                String name = file.getFileName().toString();
                int dot = name.lastIndexOf('.');
                doc = withId(doc, dot > 0 ? name.substring(0, dot) : name);
            }
            return Proposal.fromDocument(doc);
        } catch (IOException e) {
            throw new RegistryIoException("Failed to read proposal: " + file, e);
        }
    }

    /**
     * Newest proposal file by name; ids sort chronologically.
     */
    public Optional<Path> latest() {
        return list().stream().max(Comparator.comparing(path -> path.getFileName().toString()));
    }

    public List<Path> list() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(proposalsDir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(proposalsDir, "proposal_*.{yaml,yml,json}")) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new RegistryIoException("Failed to list proposals in " + proposalsDir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    /**
     * Writes a copy of an applied proposal under {@code approved/}.
     */
    public Path archive(Proposal proposal) {
        Path target = approvedDir.resolve(proposal.id() + extension);
        DocumentFiles.writeAtomically(target, serialize(proposal, target));
        return target;
    }

    /**
     * {@code base}, or {@code base_2}, {@code base_3}... when an earlier proposal already took it.
     */
    public String uniqueId(String base) {
        String candidate = base;
        int suffix = 2;
        while (exists(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private Optional<Path> find(String proposalId) {
        for (String ext : List.of(extension, ".yaml", ".yml", ".json")) {
            Path candidate = proposalsDir.resolve(proposalId + ext);
            if (Files.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static byte[] serialize(Proposal proposal, Path file) {
        ObjectMapper mapper = Jsons.mapperFor(file);
        try {
            return mapper.writeValueAsBytes(proposal.toDocument());
        } catch (JsonProcessingException e) {
            throw new RegistryIoException("Failed to serialize proposal " + proposal.id(), e);
        }
    }

    private static ProposalDocument withId(ProposalDocument doc, String id) {
        return new ProposalDocument(doc.version(), id, doc.generatedAt(), doc.jobId(), doc.jobNode(),
                doc.scanDurationSeconds(), doc.scanPaths(), doc.summary(), doc.changes(), doc.unchangedCount(),
                doc.approvalStatus(), doc.approvedAt(), doc.approvedBy(), doc.rejectedAt(), doc.rejectedBy(),
                doc.appliedAt(), doc.appliedBy());
    }
}
