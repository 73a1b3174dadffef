package aegisops.runner.model;

import aegisops.runner.util.IntervalParser;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one scheduled playbook job.
 * Loaded once at startup; each descriptor gets exactly one scheduling loop.
 */
public final class JobDescriptor {
    private final String id;
    private final String playbook;
    private final List<String> servers;
    private final String every;
    private final int forks;
    private final NotifyPolicy notifyPolicy;

    private JobDescriptor(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.playbook = Objects.requireNonNull(builder.playbook, "playbook is required");
        this.servers = builder.servers != null ? List.copyOf(builder.servers) : List.of();
        this.every = builder.every != null ? builder.every : "5m";
        this.forks = Math.max(1, builder.forks);
        this.notifyPolicy = builder.notifyPolicy != null ? builder.notifyPolicy : NotifyPolicy.DEFAULT;
    }

    // Getters
    public String id() {
        return id;
    }

    public String playbook() {
        return playbook;
    }

    /** Host groups the run is limited to; empty means no limit. */
    public List<String> servers() {
        return servers;
    }

    public String every() {
        return every;
    }

    public int forks() {
        return forks;
    }

    public NotifyPolicy notifyPolicy() {
        return notifyPolicy;
    }

    public String targetKey() {
        return notifyPolicy.targetKey();
    }

    public long intervalSeconds() {
        return IntervalParser.parseSeconds(every);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String playbook;
        private List<String> servers;
        private String every;
        private int forks = 1;
        private NotifyPolicy notifyPolicy;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder playbook(String playbook) {
            this.playbook = playbook;
            return this;
        }

        public Builder servers(List<String> servers) {
            this.servers = servers;
            return this;
        }

        public Builder every(String every) {
            this.every = every;
            return this;
        }

        public Builder forks(int forks) {
            this.forks = forks;
            return this;
        }

        public Builder notifyPolicy(NotifyPolicy notifyPolicy) {
            this.notifyPolicy = notifyPolicy;
            return this;
        }

        public JobDescriptor build() {
            return new JobDescriptor(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobDescriptor job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobDescriptor{id='" + id + "', playbook='" + playbook + "', every=" + every + "}";
    }
}
