package io.ontregistry.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Local-filesystem oracle. A path under one of the configured scan roots is {@code UNKNOWN} while
 * that root itself is missing, so an unmounted share never reads as a mass removal.
 */
public final class FilesystemPathOracle implements PathOracle {
    private static final Logger log = LoggerFactory.getLogger(FilesystemPathOracle.class);

    private final List<Path> scanRoots;

    public FilesystemPathOracle(List<String> scanRoots) {
        List<Path> roots = new ArrayList<>();
        if (scanRoots != null) {
            for (String root : scanRoots) {
                if (root != null && !root.isBlank()) {
                    roots.add(Paths.get(root).toAbsolutePath().normalize());
                }
            }
        }
        this.scanRoots = List.copyOf(roots);
    }

    @Override
    public PathState check(String path) {
        Path target;
        try {
            target = Paths.get(path).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            log.warn("[ORACLE] Cannot interpret path {}: {}", path, e.getMessage());
            return PathState.UNKNOWN;
        }
        for (Path root : scanRoots) {
            if (target.startsWith(root) && !Files.isDirectory(root)) {
                log.warn("[ORACLE] Scan root {} is unavailable, existence of {} is unknown", root, path);
                return PathState.UNKNOWN;
            }
        }
        try {
            if (Files.isDirectory(target)) {
                return PathState.PRESENT;
            }
            // Neither exists() nor notExists() holds when the status cannot be read.
            if (Files.notExists(target) || Files.exists(target)) {
                return PathState.ABSENT;
            }
            return PathState.UNKNOWN;
        } catch (SecurityException e) {
            log.warn("[ORACLE] Access to {} denied: {}", path, e.getMessage());
            return PathState.UNKNOWN;
        }
    }
}
