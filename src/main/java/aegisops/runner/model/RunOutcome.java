package aegisops.runner.model;

/**
 * What the executor observed for one invocation of the automation tool.
 *
 * @param success  true only for exit code 0 with no failed or unreachable hosts
 * @param exitCode process exit code, or -1 if the process never finished
 * @param timedOut true if the run was killed at the timeout
 */
public record RunOutcome(
        boolean success,
        int exitCode,
        boolean timedOut,
        String stdout,
        String stderr,
        RunCounts counts) {

    public static RunOutcome failed(String reason) {
        return new RunOutcome(false, -1, false, "", reason, RunCounts.ZERO);
    }

    public static RunOutcome timedOut(String stdout, String stderr) {
        return new RunOutcome(false, -1, true, stdout, stderr, RunCounts.ZERO);
    }

    public RunStatus status() {
        return success ? RunStatus.OK : RunStatus.FAIL;
    }
}
