package aegisops.runner.model;

import java.time.Instant;

/**
 * One row of run history. Created once per execution attempt and never
 * modified afterwards.
 */
public record RunRecord(
        long id,
        Instant timestamp,
        String playbook,
        RunStatus status,
        int okCount,
        int changedCount,
        int failCount,
        int unreachableCount,
        String targetKey) {
}
