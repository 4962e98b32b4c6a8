package dev.careercrawler.model;

import java.util.List;

/**
 * Totals for one pipeline run.
 */
public record RunSummary(
        List<TargetResult> targets,
        int alertsSent) {

    public static RunSummary of(List<TargetResult> targets, int alertsSent) {
        return new RunSummary(List.copyOf(targets), alertsSent);
    }

    public int targetsFailed() {
        return (int) targets.stream().filter(TargetResult::isFailure).count();
    }

    public int candidatesFound() {
        return targets.stream().mapToInt(TargetResult::candidates).sum();
    }

    public int postingsStored() {
        return targets.stream().mapToInt(TargetResult::stored).sum();
    }

    public int duplicates() {
        return targets.stream().mapToInt(TargetResult::duplicates).sum();
    }
}
