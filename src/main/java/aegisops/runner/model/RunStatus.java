package aegisops.runner.model;

/**
 * Outcome of a single playbook run as stored in history and sent in
 * notifications.
 */
public enum RunStatus {
    /** No failed tasks and no unreachable hosts */
    OK("ok"),
    /** At least one failure, unreachable host, non-zero exit or timeout */
    FAIL("fail");

    private final String wire;

    RunStatus(String wire) {
        this.wire = wire;
    }

    /** Lower-case form used in the database and JSON payloads. */
    public String wire() {
        return wire;
    }

    public static RunStatus of(int failures, int unreachable) {
        return failures > 0 || unreachable > 0 ? FAIL : OK;
    }

    public static RunStatus fromWire(String value) {
        for (RunStatus s : values()) {
            if (s.wire.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
