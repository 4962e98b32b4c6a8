package dev.careercrawler.model;

/**
 * Outcome of crawling one configured target.
 */
public record TargetResult(
        String target,
        Status status,
        int candidates,
        int stored,
        int duplicates,
        int rejected) {

    public enum Status {
        OK,
        FETCH_FAILED,
        FAILED,
        SKIPPED
    }

    public static TargetResult ok(String target, int candidates, int stored, int duplicates, int rejected) {
        return new TargetResult(target, Status.OK, candidates, stored, duplicates, rejected);
    }

    public static TargetResult fetchFailed(String target) {
        return new TargetResult(target, Status.FETCH_FAILED, 0, 0, 0, 0);
    }

    public static TargetResult failed(String target) {
        return new TargetResult(target, Status.FAILED, 0, 0, 0, 0);
    }

    public static TargetResult skipped(String target) {
        return new TargetResult(target, Status.SKIPPED, 0, 0, 0, 0);
    }

    public boolean isFailure() {
        return status != Status.OK;
    }
}
