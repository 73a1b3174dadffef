package aegisops.runner.api.v1.dto;

import aegisops.runner.model.RunRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for one run history row.
 * GET /api/v1/runs
 */
public record RunResponse(
        @JsonProperty("id") long id,
        @JsonProperty("ts") Instant timestamp,
        @JsonProperty("playbook") String playbook,
        @JsonProperty("status") String status,
        @JsonProperty("ok") int ok,
        @JsonProperty("changed") int changed,
        @JsonProperty("failed") int failed,
        @JsonProperty("unreachable") int unreachable,
        @JsonProperty("targetKey") String targetKey) {

    /** Create response from domain model */
    public static RunResponse from(RunRecord run) {
        return new RunResponse(
                run.id(),
                run.timestamp(),
                run.playbook(),
                run.status().wire(),
                run.okCount(),
                run.changedCount(),
                run.failCount(),
                run.unreachableCount(),
                run.targetKey());
    }
}
