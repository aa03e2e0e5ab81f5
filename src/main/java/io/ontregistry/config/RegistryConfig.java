package io.ontregistry.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class RegistryConfig {
    public static final String ENV_HOME = "ONT_REGISTRY_HOME";
    public static final String DEFAULT_DIR_NAME = ".ont-registry";
    public static final String REGISTRY_VERSION = "2.1";
    public static final String PROPOSAL_VERSION = "1.0";
    public static final int DEFAULT_AUDIT_MAX_ENTRIES = 1_000;

    private final Path rootDir;

    public RegistryConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static RegistryConfig fromRoot(String root) {
        Path resolved;
        if (root != null && !root.isBlank()) {
            resolved = Paths.get(root);
        } else {
            String env = System.getenv(ENV_HOME);
            resolved = env == null || env.isBlank()
                    ? Paths.get(System.getProperty("user.home")).resolve(DEFAULT_DIR_NAME)
                    : Paths.get(env);
        }
        return new RegistryConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path registryFile() {
        return rootDir.resolve("experiments.json");
    }

    public Path registryLockFile() {
        return rootDir.resolve("experiments.json.lock");
    }

    public Path auditFile() {
        return rootDir.resolve("audit_log.json");
    }

    public Path auditLockFile() {
        return rootDir.resolve("audit_log.json.lock");
    }

    public Path proposalsDir() {
        return rootDir.resolve("proposals");
    }

    public Path approvedDir() {
        return rootDir.resolve("approved");
    }

    public Path dbFile() {
        return rootDir.resolve("experiments.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("registry-settings.json");
    }
}
