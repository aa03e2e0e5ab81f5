package io.ontregistry.storage;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Whole-document persistence helpers shared by the registry, the audit log and the proposal
 * repository: an exclusive lock file around read-modify-write cycles and write-temp-then-rename.
 */
public final class DocumentFiles {
    private DocumentFiles() {
    }

    public static <T> T withExclusiveLock(Path lockFile, Supplier<T> action) {
        try {
            Path parent = lockFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.get();
            }
        } catch (IOException e) {
            throw new RegistryIoException("Failed to acquire lock: " + lockFile, e);
        }
    }

    public static void writeAtomically(Path target, byte[] content) {
        Path parent = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, "." + target.getFileName() + ".", ".tmp");
            Files.write(temp, content, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            RegistryIoException failure = new RegistryIoException("Failed to write document: " + target, e);
            discardTemp(temp, failure);
            throw failure;
        }
    }

    /**
     * Change detector for a document: file key, modification time and size, or
     * {@link Stamp#MISSING}. An atomic rewrite replaces the file, so its key changes as well.
     */
    public static Stamp stamp(Path file) {
        try {
            if (!Files.exists(file)) {
                return Stamp.MISSING;
            }
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return new Stamp(attrs.fileKey(), attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS), attrs.size());
        } catch (IOException e) {
            throw new RegistryIoException("Failed to stat document: " + file, e);
        }
    }

    private static void discardTemp(Path temp, RegistryIoException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    public record Stamp(Object fileKey, long modifiedNanos, long size) {
        public static final Stamp MISSING = new Stamp(null, -1L, -1L);
    }
}
