package aegisops.runner.notify;

/**
 * End-of-run statistics for one host.
 */
public record HostStats(
        int ok,
        int changed,
        int unreachable,
        int failures,
        int skipped,
        int rescued,
        int ignored) {
}
