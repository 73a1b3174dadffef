package aegisops.runner.model;

/**
 * Aggregate host counters extracted from one run.
 */
public record RunCounts(int ok, int changed, int unreachable, int failed) {

    public static final RunCounts ZERO = new RunCounts(0, 0, 0, 0);

    public RunCounts {
        if (ok < 0 || changed < 0 || unreachable < 0 || failed < 0) {
            throw new IllegalArgumentException("counters must be non-negative");
        }
    }

    public RunCounts plus(RunCounts other) {
        return new RunCounts(
                ok + other.ok,
                changed + other.changed,
                unreachable + other.unreachable,
                failed + other.failed);
    }
}
