package io.ontregistry.registry;

import io.ontregistry.model.ExperimentRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the single best representative among records describing the same flow-cell run.
 *
 * <p>A record that already subsumes earlier merges wins outright (highest {@code num_merged}).
 * Otherwise candidates are ranked by {@link #rules()} in order, highest first. Candidates that tie
 * on every rule resolve to the earliest in the input list.
 */
public final class MergeSelector {
    public static final List<RankingRule> DEFAULT_RULES = List.of(
            new RankingRule("total_reads", Comparator.comparingLong(ExperimentRecord::totalReadsOrZero)),
            new RankingRule("has_pod5", Comparator.comparing(ExperimentRecord::hasPod5OrFalse)),
            new RankingRule("is_canonical", Comparator.comparing(ExperimentRecord::canonicalOrFalse)),
            new RankingRule("date_time", Comparator.comparing(ExperimentRecord::dateTimeKey))
    );

    private final List<RankingRule> rules;
    private final Comparator<ExperimentRecord> composite;

    public MergeSelector() {
        this(DEFAULT_RULES);
    }

    public MergeSelector(List<RankingRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one ranking rule is required");
        }
        this.rules = List.copyOf(rules);
        Comparator<ExperimentRecord> chain = this.rules.get(0).order();
        for (int i = 1; i < this.rules.size(); i++) {
            chain = chain.thenComparing(this.rules.get(i).order());
        }
        this.composite = chain;
    }

    public List<RankingRule> rules() {
        return rules;
    }

    public ExperimentRecord selectBest(List<ExperimentRecord> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("selectBest requires at least one candidate");
        }
        List<ExperimentRecord> merged = new ArrayList<>();
        for (ExperimentRecord candidate : candidates) {
            if (candidate.numMergedOrOne() > 1) {
                merged.add(candidate);
            }
        }
        if (!merged.isEmpty()) {
            return highest(merged, Comparator.comparingInt(ExperimentRecord::numMergedOrOne));
        }
        return highest(candidates, composite);
    }

    private static ExperimentRecord highest(List<ExperimentRecord> candidates, Comparator<ExperimentRecord> order) {
        ExperimentRecord best = candidates.get(0);
        for (int i = 1; i < candidates.size(); i++) {
            ExperimentRecord candidate = candidates.get(i);
            if (order.compare(candidate, best) > 0) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * One step of the ranking; higher compares as better.
     */
    public record RankingRule(String name, Comparator<ExperimentRecord> order) {
    }
}
