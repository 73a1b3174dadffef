package aegisops.runner.config;

import aegisops.runner.model.JobDescriptor;
import aegisops.runner.model.NotifyPolicy;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of {@code schedules.json} as written by the dashboard.
 * Missing fields fall back to the defaults in {@link #toDescriptor(int)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleEntry(
        @JsonProperty("id") String id,
        @JsonProperty("playbook") String playbook,
        @JsonProperty("servers") List<String> servers,
        @JsonProperty("every") String every,
        @JsonProperty("forks") Integer forks,
        @JsonProperty("notify") Notify notifySettings) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Notify(
            @JsonProperty("on_success") Boolean onSuccess,
            @JsonProperty("on_fail") Boolean onFail,
            @JsonProperty("only_on_state_change") Boolean onlyOnStateChange,
            @JsonProperty("cooldown_min") Integer cooldownMin,
            @JsonProperty("quiet_hours") String quietHours,
            @JsonProperty("target_key") String targetKey) {

        NotifyPolicy toPolicy() {
            NotifyPolicy d = NotifyPolicy.DEFAULT;
            return new NotifyPolicy(
                    onSuccess != null ? onSuccess : d.onSuccess(),
                    onFail != null ? onFail : d.onFail(),
                    onlyOnStateChange != null ? onlyOnStateChange : d.onlyOnStateChange(),
                    cooldownMin != null ? cooldownMin : d.cooldownMin(),
                    quietHours,
                    targetKey);
        }
    }

    public boolean hasPlaybook() {
        return playbook != null && !playbook.isBlank();
    }

    /**
     * @param index position in the file, used for the id when none is given
     */
    public JobDescriptor toDescriptor(int index) {
        if (!hasPlaybook()) {
            throw new IllegalArgumentException("schedule entry " + index + " has no playbook");
        }
        return JobDescriptor.builder()
                .id(id != null && !id.isBlank() ? id.trim() : "job-" + index)
                .playbook(playbook.trim())
                .servers(servers != null
                        ? servers.stream().filter(s -> s != null && !s.isBlank()).map(String::trim).toList()
                        : List.of())
                .every(every != null && !every.isBlank() ? every : "5m")
                .forks(forks != null ? forks : 1)
                .notifyPolicy(notifySettings != null ? notifySettings.toPolicy() : NotifyPolicy.DEFAULT)
                .build();
    }
}
