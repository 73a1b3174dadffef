package aegisops.runner.executor;

import aegisops.runner.model.JobDescriptor;
import aegisops.runner.model.RunOutcome;

/**
 * Runs one job to completion on the calling thread.
 * Implementations must not throw: every failure becomes a failed outcome.
 */
@FunctionalInterface
public interface JobExecutor {

    RunOutcome execute(JobDescriptor job);
}
