package aegisops.runner.api.v1.dto;

import aegisops.runner.model.JobDescriptor;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One configured job.
 * GET /api/v1/jobs
 */
public record JobResponse(
        @JsonProperty("id") String id,
        @JsonProperty("playbook") String playbook,
        @JsonProperty("servers") List<String> servers,
        @JsonProperty("every") String every,
        @JsonProperty("intervalSeconds") long intervalSeconds,
        @JsonProperty("forks") int forks,
        @JsonProperty("targetKey") String targetKey) {

    public static JobResponse from(JobDescriptor job) {
        return new JobResponse(
                job.id(),
                job.playbook(),
                job.servers(),
                job.every(),
                job.intervalSeconds(),
                job.forks(),
                job.targetKey());
    }
}
