package aegisops.runner.config;

import aegisops.runner.model.JobDescriptor;
import aegisops.runner.util.IntervalParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads job descriptors from {@code schedules.json}.
 *
 * A broken or missing file never stops the runner: it yields an empty list
 * and a warning. Entries without a playbook are skipped; duplicate ids keep
 * the first entry.
 */
public class ScheduleLoader {

    private static final Logger log = LoggerFactory.getLogger(ScheduleLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path schedulesFile;

    public ScheduleLoader(RunnerConfig config) {
        this(config.schedulesFile());
    }

    public ScheduleLoader(Path schedulesFile) {
        this.schedulesFile = schedulesFile;
    }

    public List<JobDescriptor> load() {
        String raw;
        try {
            raw = Files.readString(schedulesFile, StandardCharsets.UTF_8).strip();
        } catch (NoSuchFileException e) {
            log.warn("Schedules file not found: {}", schedulesFile);
            return List.of();
        } catch (IOException e) {
            log.warn("Cannot read schedules file {}: {}", schedulesFile, e.getMessage());
            return List.of();
        }
        if (raw.isEmpty()) {
            return List.of();
        }
        return parse(raw);
    }

    /**
     * Parse the JSON text of a schedules file.
     */
    public List<JobDescriptor> parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Schedules file {} is invalid JSON: {}; treating as empty", schedulesFile, e.getMessage());
            return List.of();
        }
        if (root == null || !root.isArray()) {
            log.warn("Schedules file {} is not a JSON array; treating as empty", schedulesFile);
            return List.of();
        }

        List<JobDescriptor> jobs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < root.size(); i++) {
            ScheduleEntry entry;
            try {
                entry = MAPPER.convertValue(root.get(i), ScheduleEntry.class);
            } catch (IllegalArgumentException e) {
                log.warn("Schedule entry {} is malformed: {}; skipped", i, e.getMessage());
                continue;
            }
            if (entry == null || !entry.hasPlaybook()) {
                log.warn("Schedule entry {} has no playbook; skipped", i);
                continue;
            }
            JobDescriptor job = entry.toDescriptor(i);
            if (!seen.add(job.id())) {
                log.warn("Duplicate schedule id '{}' at entry {}; skipped", job.id(), i);
                continue;
            }
            if (!IntervalParser.isValid(job.every())) {
                log.warn("Job {} has unreadable interval '{}'; using {}s",
                        job.id(), job.every(), IntervalParser.DEFAULT_SECONDS);
            }
            jobs.add(job);
        }

        log.info("Loaded {} job(s) from {}", jobs.size(), schedulesFile);
        return List.copyOf(jobs);
    }
}
