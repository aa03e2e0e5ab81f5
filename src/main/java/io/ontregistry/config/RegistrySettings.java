package io.ontregistry.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.ontregistry.storage.RegistryIoException;
import io.ontregistry.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Tunables read from {@code registry-settings.json}. Every field is optional; absent fields and an
 * absent file fall back to {@link #defaults()}.
 */
public record RegistrySettings(
        int auditMaxEntries,
        List<String> scanRoots,
        String defaultActor,
        String proposalFormat
) {
    public RegistrySettings {
        scanRoots = scanRoots == null ? List.of() : List.copyOf(scanRoots);
    }

    public static RegistrySettings defaults() {
        String user = System.getProperty("user.name");
        return new RegistrySettings(
                RegistryConfig.DEFAULT_AUDIT_MAX_ENTRIES,
                List.of(),
                user == null || user.isBlank() ? "unknown" : user,
                "yaml"
        );
    }

    public static RegistrySettings load(RegistryConfig config) {
        Path file = config.settingsFile();
        RegistrySettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RegistryIoException("Failed to read settings: " + file, e);
        }
    }

    static RegistrySettings fromFile(SettingsFile file, RegistrySettings defaults) {
        if (file == null) {
            return defaults;
        }
        int auditMax = file.auditMaxEntries() == null || file.auditMaxEntries() < 1
                ? defaults.auditMaxEntries()
                : file.auditMaxEntries();
        String actor = file.defaultActor() == null || file.defaultActor().isBlank()
                ? defaults.defaultActor()
                : file.defaultActor().trim();
        String format = file.proposalFormat() == null || file.proposalFormat().isBlank()
                ? defaults.proposalFormat()
                : file.proposalFormat().trim().toLowerCase(Locale.ROOT);
        if (!"yaml".equals(format) && !"json".equals(format)) {
            throw new IllegalArgumentException("Unsupported proposalFormat: " + file.proposalFormat());
        }
        return new RegistrySettings(
                auditMax,
                file.scanRoots() == null ? defaults.scanRoots() : file.scanRoots(),
                actor,
                format
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer auditMaxEntries,
            List<String> scanRoots,
            String defaultActor,
            String proposalFormat
    ) {
    }
}
