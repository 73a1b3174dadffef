package aegisops.runner.model;

/**
 * Scheduling state of a single job loop. There is no terminal state: a loop
 * alternates between the two until the process stops.
 */
public enum JobState {
    /** Sleeping until the next due time */
    WAITING,
    /** Executor call in progress on the loop's own thread */
    RUNNING
}
