package io.ontregistry.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ExperimentRecordTest {

    @Test
    void countFieldsAcceptWholeNumbersOfAnyNumericType() {
        ExperimentRecord record = new ExperimentRecord("run1");
        record.applyField("pod5_files", 42L);
        record.applyField("bam_files", 7.0d);
        record.applyField("fastq_files", "12");
        record.applyField("total_reads", 5_000_000_000L);

        Assertions.assertEquals(42, record.getPod5Files());
        Assertions.assertEquals(7, record.getBamFiles());
        Assertions.assertEquals(12, record.getFastqFiles());
        Assertions.assertEquals(5_000_000_000L, record.getTotalReads());
    }

    @Test
    void countsThatDoNotFitAreRejectedInsteadOfTruncated() {
        ExperimentRecord record = new ExperimentRecord("run1");
        record.setPod5Files(3);

        Assertions.assertThrows(IllegalArgumentException.class, () -> record.applyField("pod5_files", 3_000_000_000L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> record.applyField("pod5_files", 2.5d));
        Assertions.assertThrows(IllegalArgumentException.class, () -> record.applyField("pod5_files", Double.NaN));
        Assertions.assertThrows(IllegalArgumentException.class, () -> record.applyField("total_reads", 1.5e30));
        Assertions.assertEquals(3, record.getPod5Files());
    }
}
