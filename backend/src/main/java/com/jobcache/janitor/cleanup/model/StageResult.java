package com.jobcache.janitor.cleanup.model;

/**
 * Outcome of one sweep stage. Stages never throw; the orchestrator decides
 * from the outcome whether the sweep continues.
 *
 * @param stage   stage name used in logs
 * @param outcome what happened
 * @param count   rows affected; always 0 unless {@link Outcome#SUCCEEDED}
 * @param reason  failure or skip reason, null on success
 */
public record StageResult(String stage, Outcome outcome, int count, String reason) {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public static StageResult succeeded(String stage, int count) {
        return new StageResult(stage, Outcome.SUCCEEDED, Math.max(0, count), null);
    }

    public static StageResult failed(String stage, String reason) {
        return new StageResult(stage, Outcome.FAILED, 0, reason);
    }

    public static StageResult skipped(String stage, String reason) {
        return new StageResult(stage, Outcome.SKIPPED, 0, reason);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
