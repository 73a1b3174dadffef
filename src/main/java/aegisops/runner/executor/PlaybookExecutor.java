package aegisops.runner.executor;

import aegisops.runner.config.RunnerConfig;
import aegisops.runner.model.CheckRecord;
import aegisops.runner.model.JobDescriptor;
import aegisops.runner.model.NotifyPolicy;
import aegisops.runner.model.RunCounts;
import aegisops.runner.model.RunOutcome;
import aegisops.runner.notify.NotificationSender;
import aegisops.runner.notify.NotifyCallback;
import aegisops.runner.notify.PlaybookEventDispatcher;
import aegisops.runner.parser.CheckResultExtractor;
import aegisops.runner.parser.ResultParser;
import aegisops.runner.repository.RunHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Launches {@code ansible-playbook} for one job and bounds it by the run
 * timeout.
 *
 * Every call writes exactly one run record, whatever happens: a missing
 * playbook, a launch failure, a timeout or a non-zero exit all end up as a
 * "fail" row with whatever counters could be read. Nothing is thrown to the
 * scheduler.
 */
public class PlaybookExecutor implements JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlaybookExecutor.class);

    private final RunnerConfig config;
    private final RunHistoryRepository history;
    private final ResultParser parser;
    private final CheckResultExtractor checkExtractor;
    private final PlaybookEventDispatcher dispatcher;
    private final NotificationSender sender;

    public PlaybookExecutor(RunnerConfig config, RunHistoryRepository history, ResultParser parser,
            CheckResultExtractor checkExtractor, PlaybookEventDispatcher dispatcher, NotificationSender sender) {
        this.config = config;
        this.history = history;
        this.parser = parser;
        this.checkExtractor = checkExtractor;
        this.dispatcher = dispatcher;
        this.sender = sender;
    }

    @Override
    public RunOutcome execute(JobDescriptor job) {
        RunOutcome outcome;
        try {
            outcome = run(job);
        } catch (RuntimeException e) {
            log.error("Job {} crashed before completion", job.id(), e);
            outcome = RunOutcome.failed(e.toString());
        }

        recordRun(job, outcome);

        if (outcome.exitCode() >= 0) {
            recordChecks(job, outcome);
            if (config.outputMode() == RunnerConfig.OutputMode.JSON) {
                notifyCallbacks(job, outcome);
            }
        }
        return outcome;
    }

    /**
     * Command line for one run of the job.
     */
    public List<String> buildCommand(JobDescriptor job) {
        List<String> cmd = new ArrayList<>();
        cmd.add(config.ansibleExecutable());
        cmd.add("-i");
        cmd.add(config.inventoryFile().toString());
        cmd.add(playbookPath(job).toString());
        cmd.add("-f");
        cmd.add(String.valueOf(job.forks()));
        if (!job.servers().isEmpty()) {
            cmd.add("-l");
            cmd.add(String.join(",", job.servers()));
        }
        return cmd;
    }

    /**
     * Variables added to the inherited environment. The notification policy
     * travels to the tool's own callback plugins through these.
     */
    public Map<String, String> buildEnvironment(JobDescriptor job) {
        NotifyPolicy policy = job.notifyPolicy();
        Map<String, String> env = new LinkedHashMap<>();
        env.put("ANSIBLE_CONFIG", config.ansibleConfigFile().toString());
        env.put("J_ON_SUCCESS", String.valueOf(policy.onSuccess()));
        env.put("J_ON_FAIL", String.valueOf(policy.onFail()));
        env.put("J_ONLY_ON_STATE_CHANGE", String.valueOf(policy.onlyOnStateChange()));
        env.put("J_COOLDOWN_MIN", String.valueOf(policy.cooldownMin()));
        env.put("J_QUIET_HOURS", policy.quietHours());
        env.put("J_TARGET_KEY", policy.targetKey());
        env.put("AEGISOPS_PLAYBOOK", job.playbook());
        env.put("AEGISOPS_TARGET_KEY", policy.targetKey());
        env.put("AEGISOPS_NOTIFY_URL", config.notifyUrl());
        env.put("AEGISOPS_NOTIFY_INBOX", String.valueOf(config.notifyEnabled()));
        if (config.outputMode() == RunnerConfig.OutputMode.JSON) {
            env.put("ANSIBLE_STDOUT_CALLBACK", "json");
        }
        return env;
    }

    private RunOutcome run(JobDescriptor job) {
        Path playbook = playbookPath(job);
        if (!playbook.startsWith(config.playbooksDir().normalize())) {
            log.warn("Job {}: playbook {} is outside {}", job.id(), job.playbook(), config.playbooksDir());
            return RunOutcome.failed("playbook outside playbooks directory: " + job.playbook());
        }
        if (!Files.isRegularFile(playbook)) {
            log.warn("Job {}: playbook not found: {}", job.id(), playbook);
            return RunOutcome.failed("playbook not found: " + playbook);
        }

        List<String> cmd = buildCommand(job);
        log.info("Job {}: exec {}", job.id(), String.join(" ", cmd));

        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            String prefix = tempFilePrefix(job);
            stdoutFile = Files.createTempFile(prefix, ".out");
            stderrFile = Files.createTempFile(prefix, ".err");

            ProcessBuilder builder = new ProcessBuilder(cmd)
                    .directory(config.baseDir().toFile().isDirectory() ? config.baseDir().toFile() : null)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            builder.environment().putAll(buildEnvironment(job));

            long started = System.nanoTime();
            process = builder.start();
            closeStdin(process);

            boolean finished = process.waitFor(config.runTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyTree(process);
                log.warn("Job {}: timed out after {}s", job.id(), config.runTimeout().toSeconds());
                return RunOutcome.timedOut(readQuietly(stdoutFile), readQuietly(stderrFile));
            }

            int exitCode = process.exitValue();
            String stdout = readQuietly(stdoutFile);
            String stderr = readQuietly(stderrFile);
            RunCounts counts = parser.parse(stdout + "\n" + stderr);
            boolean success = exitCode == 0 && counts.failed() == 0 && counts.unreachable() == 0;

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            log.debug("Job {}: exit={} in {}ms", job.id(), exitCode, elapsedMs);
            return new RunOutcome(success, exitCode, false, stdout, stderr, counts);

        } catch (IOException e) {
            log.warn("Job {}: cannot launch {}: {}", job.id(), config.ansibleExecutable(), e.getMessage());
            return RunOutcome.failed("launch failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                destroyTree(process);
            }
            log.warn("Job {}: interrupted while running", job.id());
            return RunOutcome.failed("interrupted");
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    // Job ids are free text; keep only characters safe in a file name.
    static String tempFilePrefix(JobDescriptor job) {
        return "aegisops-" + job.id().replaceAll("[^A-Za-z0-9._-]", "_") + "-";
    }

    private Path playbookPath(JobDescriptor job) {
        return config.playbooksDir().resolve(job.playbook()).normalize();
    }

    private void recordRun(JobDescriptor job, RunOutcome outcome) {
        RunCounts c = outcome.counts();
        try {
            history.record(job.playbook(), outcome.status(), c.ok(), c.changed(), c.failed(), c.unreachable(),
                    job.targetKey());
        } catch (RuntimeException e) {
            log.error("Job {}: failed to record run", job.id(), e);
        }

        if (outcome.success()) {
            log.info("Job {}: ok (ok={} changed={})", job.id(), c.ok(), c.changed());
        } else {
            log.warn("Job {}: fail (exit={} timedOut={} ok={} changed={} failed={} unreachable={})",
                    job.id(), outcome.exitCode(), outcome.timedOut(), c.ok(), c.changed(), c.failed(),
                    c.unreachable());
        }
    }

    private void recordChecks(JobDescriptor job, RunOutcome outcome) {
        try {
            List<CheckRecord> checks = checkExtractor.extract(outcome.stdout());
            if (!checks.isEmpty()) {
                history.recordChecks(checks);
                log.debug("Job {}: recorded {} check results", job.id(), checks.size());
            }
        } catch (RuntimeException e) {
            log.error("Job {}: failed to record check results", job.id(), e);
        }
    }

    private void notifyCallbacks(JobDescriptor job, RunOutcome outcome) {
        NotifyCallback callback = new NotifyCallback(sender, job.targetKey());
        boolean replayed = dispatcher.dispatch(job.playbook(), outcome.stdout(), List.of(callback));
        if (!replayed) {
            log.debug("Job {}: no structured output, notification skipped", job.id());
        }
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Cannot close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String readQuietly(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Cannot delete {}: {}", file, e.getMessage());
        }
    }
}
