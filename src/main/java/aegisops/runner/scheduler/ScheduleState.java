package aegisops.runner.scheduler;

import aegisops.runner.model.JobState;

/**
 * Mutable schedule of one job. Owned by that job's loop thread and never
 * shared, so it needs no synchronization.
 */
public final class ScheduleState {

    private long nextDueMillis;
    private JobState state = JobState.WAITING;
    private long runs;

    ScheduleState(long firstDueMillis) {
        this.nextDueMillis = firstDueMillis;
    }

    public long nextDueMillis() {
        return nextDueMillis;
    }

    public JobState state() {
        return state;
    }

    public long runs() {
        return runs;
    }

    public boolean isDue(long nowMillis) {
        return nowMillis >= nextDueMillis;
    }

    void markRunning() {
        state = JobState.RUNNING;
    }

    void markWaiting(long nextDueMillis) {
        this.nextDueMillis = nextDueMillis;
        this.state = JobState.WAITING;
        this.runs++;
    }
}
