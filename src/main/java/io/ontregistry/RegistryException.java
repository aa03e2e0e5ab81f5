package io.ontregistry;

/**
 * Root of the registry's unchecked failures. Conflict outcomes (duplicates, path merges) are
 * reported through return values, never through this hierarchy.
 */
public class RegistryException extends RuntimeException {
    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
