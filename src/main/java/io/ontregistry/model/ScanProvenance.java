package io.ontregistry.model;

import java.util.List;

/**
 * Where a discovery batch came from: the batch job that produced it, the node it ran on, how
 * long the scan took and which roots were scanned.
 */
public record ScanProvenance(
        String jobId,
        String node,
        double durationSeconds,
        List<String> scanPaths
) {
    public ScanProvenance {
        jobId = jobId == null ? "" : jobId;
        node = node == null ? "" : node;
        scanPaths = scanPaths == null ? List.of() : List.copyOf(scanPaths);
    }

    public static ScanProvenance none() {
        return new ScanProvenance("", "", 0.0, List.of());
    }
}
