package aegisops.runner.notify;

import aegisops.runner.model.RunStatus;

/**
 * Per-run counters collected from callback events. Created at run start,
 * read once to build the notification, then discarded. Not thread-safe:
 * events for one run arrive on one thread.
 */
public final class RunAccumulator {

    private String playbook = "";
    private int ok;
    private int changed;
    private int failures;
    private int unreachable;

    public void playbook(String playbook) {
        this.playbook = playbook != null ? playbook : "";
    }

    public void addOk() {
        ok++;
    }

    public void addFailure() {
        failures++;
    }

    public void addUnreachable() {
        unreachable++;
    }

    public void addChanged(int count) {
        if (count > 0) {
            changed += count;
        }
    }

    public String playbook() {
        return playbook;
    }

    public int ok() {
        return ok;
    }

    public int changed() {
        return changed;
    }

    public int failures() {
        return failures;
    }

    public int unreachable() {
        return unreachable;
    }

    public RunStatus status() {
        return RunStatus.of(failures, unreachable);
    }

    public NotificationPayload toPayload(String target) {
        return NotificationPayload.of(playbook, status(), ok, changed, failures, unreachable, target);
    }
}
