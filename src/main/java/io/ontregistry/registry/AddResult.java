package io.ontregistry.registry;

/**
 * Outcome of {@link RecordStore#add}. Duplicates are not errors: they report which existing record
 * absorbed the incoming paths.
 */
public record AddResult(boolean added, Outcome outcome, String runId, String message) {

    public enum Outcome {
        ADDED,
        PATHS_MERGED,
        DUPLICATE,
        FINGERPRINT_MERGED,
        REJECTED
    }

    static AddResult added(String runId) {
        return new AddResult(true, Outcome.ADDED, runId, "Added " + runId);
    }

    static AddResult pathsMerged(String runId) {
        return new AddResult(false, Outcome.PATHS_MERGED, runId, "Updated paths for existing run_id " + runId);
    }

    static AddResult duplicate(String runId) {
        return new AddResult(false, Outcome.DUPLICATE, runId, "Duplicate run_id " + runId);
    }

    static AddResult fingerprintMerged(String incomingRunId, String existingRunId) {
        return new AddResult(false, Outcome.FINGERPRINT_MERGED, existingRunId,
                "run_id " + incomingRunId + " is equivalent to existing " + existingRunId + " (same fingerprint)");
    }

    static AddResult rejected(String message) {
        return new AddResult(false, Outcome.REJECTED, null, message);
    }
}
