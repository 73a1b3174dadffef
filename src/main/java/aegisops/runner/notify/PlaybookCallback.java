package aegisops.runner.notify;

import java.util.Map;

/**
 * Event hooks fired while a playbook run is replayed, in the order the
 * automation tool emits them: start, one event per host and task, then the
 * end-of-run stats.
 */
public interface PlaybookCallback {

    default void onPlaybookStart(String playbook) {
    }

    default void onRunnerOk(String host, String task) {
    }

    default void onRunnerFailed(String host, String task, boolean ignoreErrors) {
    }

    default void onRunnerUnreachable(String host, String task) {
    }

    default void onRunnerSkipped(String host, String task) {
    }

    /**
     * Final per-host statistics; the run is complete after this call.
     */
    default void onStats(Map<String, HostStats> stats) {
    }
}
