package io.ontregistry.reconcile;

/**
 * Answers whether a run directory still exists. Used only to confirm removals.
 */
@FunctionalInterface
public interface PathOracle {

    PathState check(String path);

    enum PathState {
        PRESENT,
        ABSENT,
        /** The check could not be made: the mount is offline or the path is unreadable. */
        UNKNOWN
    }
}
