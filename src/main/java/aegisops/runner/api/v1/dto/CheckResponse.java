package aegisops.runner.api.v1.dto;

import aegisops.runner.model.CheckRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * GET /api/v1/checks
 */
public record CheckResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("ts") Instant timestamp,
        @JsonProperty("host") String host,
        @JsonProperty("check") String checkName,
        @JsonProperty("mode") String mode,
        @JsonProperty("status") String status,
        @JsonProperty("detail") String detail) {

    public static CheckResponse from(CheckRecord check) {
        return new CheckResponse(
                check.id(),
                check.timestamp(),
                check.host(),
                check.checkName(),
                check.mode(),
                check.status(),
                check.detail());
    }
}
