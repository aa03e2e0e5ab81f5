package io.ontregistry.registry;

import io.ontregistry.model.ExperimentRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class MergeSelectorTest {
    private final MergeSelector selector = new MergeSelector();

    @Test
    void highestNumMergedWinsOverEverythingElse() {
        ExperimentRecord big = candidate("a", 10_000L, true, true, "2024-01-02", "10:00");
        ExperimentRecord merged = candidate("b", 10L, false, false, "2024-01-01", "09:00");
        merged.setNumMerged(3);
        ExperimentRecord merged2 = candidate("c", 10L, false, false, "2024-01-01", "09:00");
        merged2.setNumMerged(2);

        Assertions.assertEquals("b", selector.selectBest(List.of(big, merged2, merged)).getRunId());
    }

    @Test
    void ranksByReadsThenPod5ThenCanonicalThenRecency() {
        ExperimentRecord fewReads = candidate("few", 100L, true, true, "2024-02-01", "10:00");
        ExperimentRecord manyReads = candidate("many", 1_000L, false, false, "2024-01-01", "10:00");
        Assertions.assertEquals("many", selector.selectBest(List.of(fewReads, manyReads)).getRunId());

        ExperimentRecord noPod5 = candidate("nopod5", 1_000L, false, true, "2024-02-01", "10:00");
        ExperimentRecord pod5 = candidate("pod5", 1_000L, true, false, "2024-01-01", "10:00");
        Assertions.assertEquals("pod5", selector.selectBest(List.of(noPod5, pod5)).getRunId());

        ExperimentRecord plain = candidate("plain", 1_000L, true, false, "2024-02-01", "10:00");
        ExperimentRecord canonical = candidate("canon", 1_000L, true, true, "2024-01-01", "10:00");
        Assertions.assertEquals("canon", selector.selectBest(List.of(plain, canonical)).getRunId());

        ExperimentRecord older = candidate("older", 1_000L, true, true, "2024-01-01", "10:00");
        ExperimentRecord newer = candidate("newer", 1_000L, true, true, "2024-01-01", "11:00");
        Assertions.assertEquals("newer", selector.selectBest(List.of(older, newer)).getRunId());
    }

    @Test
    void missingValuesRankLowestAndTiesKeepInputOrder() {
        ExperimentRecord empty = new ExperimentRecord("empty");
        ExperimentRecord some = candidate("some", 1L, false, false, null, null);
        Assertions.assertEquals("some", selector.selectBest(List.of(empty, some)).getRunId());

        ExperimentRecord first = candidate("first", 5L, true, false, "2024-01-01", "10:00");
        ExperimentRecord second = candidate("second", 5L, true, false, "2024-01-01", "10:00");
        Assertions.assertEquals("first", selector.selectBest(List.of(first, second)).getRunId());
    }

    @Test
    void emptyInputIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> selector.selectBest(List.of()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> selector.selectBest(null));
    }

    private static ExperimentRecord candidate(String runId, Long reads, boolean pod5, boolean canonical, String date, String time) {
        ExperimentRecord record = new ExperimentRecord(runId);
        record.setFlowcell("FC1");
        record.setTotalReads(reads);
        record.setHasPod5(pod5);
        record.setCanonical(canonical);
        record.setDate(date);
        record.setTime(time);
        return record;
    }
}
