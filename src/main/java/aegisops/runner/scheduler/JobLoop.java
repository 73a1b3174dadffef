package aegisops.runner.scheduler;

import aegisops.runner.executor.JobExecutor;
import aegisops.runner.model.JobDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Timer loop of a single job: run when due, otherwise sleep one polling
 * quantum and look again.
 *
 * The next due time is the start of the previous run plus the interval. A
 * run that overruns its interval is followed immediately by the next one;
 * runs of one job never overlap because the executor is called on this
 * thread. The loop ends only when its thread is interrupted.
 */
public class JobLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobLoop.class);

    private final JobDescriptor job;
    private final JobExecutor executor;
    private final Clock clock;
    private final long pollMillis;
    private final long intervalMillis;
    private final ScheduleState state;

    public JobLoop(JobDescriptor job, JobExecutor executor, Clock clock, Duration pollQuantum) {
        this.job = job;
        this.executor = executor;
        this.clock = clock;
        this.pollMillis = Math.max(1, pollQuantum.toMillis());
        // Intervals shorter than one quantum would spin; clamp them.
        this.intervalMillis = Math.max(pollMillis, toMillis(job.intervalSeconds()));
        this.state = new ScheduleState(clock.millis());
    }

    @Override
    public void run() {
        log.info("Job {} loop started (every {}s, playbook {})", job.id(), intervalMillis / 1000, job.playbook());
        while (!Thread.currentThread().isInterrupted()) {
            if (!runIfDue()) {
                try {
                    Thread.sleep(pollMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        log.info("Job {} loop stopped after {} run(s)", job.id(), state.runs());
    }

    /**
     * Run the job if it is due.
     *
     * @return true if the executor was called
     */
    boolean runIfDue() {
        long now = clock.millis();
        if (!state.isDue(now)) {
            return false;
        }
        state.markRunning();
        try {
            executor.execute(job);
        } catch (RuntimeException e) {
            log.error("Job {} executor error", job.id(), e);
        } finally {
            state.markWaiting(saturatedAdd(now, intervalMillis));
        }
        return true;
    }

    private static long toMillis(long seconds) {
        return seconds > Long.MAX_VALUE / 1000 ? Long.MAX_VALUE : seconds * 1000L;
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return ((a ^ sum) & (b ^ sum)) < 0 ? Long.MAX_VALUE : sum;
    }

    ScheduleState state() {
        return state;
    }

    long intervalMillis() {
        return intervalMillis;
    }
}
