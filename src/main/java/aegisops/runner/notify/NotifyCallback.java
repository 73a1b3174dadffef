package aegisops.runner.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Counts per-host outcomes of one run and posts a summary when the run
 * completes. {@code changed} comes from the final stats only, since many
 * modules report changes there and not per task.
 *
 * A failed post never reaches the caller: the run's own outcome must not
 * depend on the notification intake.
 */
public class NotifyCallback implements PlaybookCallback {

    private static final Logger log = LoggerFactory.getLogger(NotifyCallback.class);

    private final NotificationSender sender;
    private final String target;
    private RunAccumulator accumulator = new RunAccumulator();

    public NotifyCallback(NotificationSender sender, String target) {
        this.sender = sender;
        this.target = target != null ? target : "";
    }

    @Override
    public void onPlaybookStart(String playbook) {
        accumulator = new RunAccumulator();
        accumulator.playbook(playbook);
    }

    @Override
    public void onRunnerOk(String host, String task) {
        accumulator.addOk();
    }

    @Override
    public void onRunnerFailed(String host, String task, boolean ignoreErrors) {
        accumulator.addFailure();
    }

    @Override
    public void onRunnerUnreachable(String host, String task) {
        accumulator.addUnreachable();
    }

    @Override
    public void onStats(Map<String, HostStats> stats) {
        RunAccumulator run = accumulator;
        accumulator = new RunAccumulator();

        if (stats != null) {
            for (HostStats s : stats.values()) {
                run.addChanged(s.changed());
            }
        }

        NotificationPayload payload = run.toPayload(target);
        try {
            sender.send(payload);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Notification for {} interrupted", payload.playbook());
        } catch (Exception e) {
            log.debug("Notification for {} not delivered: {}", payload.playbook(), e.toString());
        }
    }

    /** Counters of the run in progress. */
    RunAccumulator current() {
        return accumulator;
    }
}
