package io.ontregistry.registry;

import io.ontregistry.model.ExperimentRecord;
import io.ontregistry.util.Hashing;

import java.util.List;
import java.util.stream.Stream;

/**
 * Derives the secondary uniqueness key used to catch one run arriving under two run_ids.
 *
 * <p>The key covers only the identity fields, so paths, metrics and the run_id itself never
 * influence it. Missing fields count as empty strings.
 */
public final class FingerprintEngine {
    public static final List<String> IDENTITY_FIELDS = List.of("flowcell", "device", "experiment_name", "date", "time");
    public static final int FINGERPRINT_LENGTH = 16;

    private FingerprintEngine() {
    }

    public static String fingerprint(ExperimentRecord record) {
        return fingerprint(
                record.getFlowcell(),
                record.getDevice(),
                record.getExperimentName(),
                record.getDate(),
                record.getTime()
        );
    }

    public static String fingerprint(String flowcell, String device, String experimentName, String date, String time) {
        String key = String.join("|",
                nullToEmpty(flowcell),
                nullToEmpty(device),
                nullToEmpty(experimentName),
                nullToEmpty(date),
                nullToEmpty(time));
        return Hashing.sha256Hex(key).substring(0, FINGERPRINT_LENGTH);
    }

    /**
     * False when every identity field is blank; all such records share one fingerprint.
     */
    public static boolean hasIdentity(ExperimentRecord record) {
        return Stream.of(record.getFlowcell(), record.getDevice(), record.getExperimentName(), record.getDate(), record.getTime())
                .anyMatch(value -> value != null && !value.isBlank());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
