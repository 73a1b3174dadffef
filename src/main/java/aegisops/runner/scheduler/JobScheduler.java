package aegisops.runner.scheduler;

import aegisops.runner.config.RunnerConfig;
import aegisops.runner.executor.JobExecutor;
import aegisops.runner.model.JobDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Starts one daemon thread per configured job and keeps them running for
 * the life of the process.
 *
 * Threads share nothing but the executor's store, so a job stuck in a long
 * run never delays another job's cadence. There is no pool: each loop
 * thread is also the thread that runs its playbook.
 */
public class JobScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final List<JobDescriptor> jobs;
    private final JobExecutor executor;
    private final Clock clock;
    private final Duration pollQuantum;
    private final List<Thread> threads = new ArrayList<>();

    private volatile boolean running = false;

    public JobScheduler(List<JobDescriptor> jobs, JobExecutor executor, RunnerConfig config) {
        this(jobs, executor, Clock.systemUTC(), config.pollQuantum());
    }

    public JobScheduler(List<JobDescriptor> jobs, JobExecutor executor, Clock clock, Duration pollQuantum) {
        Map<String, JobDescriptor> unique = new LinkedHashMap<>();
        for (JobDescriptor job : jobs) {
            if (unique.putIfAbsent(job.id(), job) != null) {
                log.warn("Duplicate job id {}; only the first is scheduled", job.id());
            }
        }
        this.jobs = List.copyOf(unique.values());
        this.executor = executor;
        this.clock = clock;
        this.pollQuantum = pollQuantum;
    }

    /**
     * Start one loop per job. Calling it again is a no-op.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        for (JobDescriptor job : jobs) {
            JobLoop loop = new JobLoop(job, executor, clock, pollQuantum);
            Thread t = new Thread(loop, "aegisops-job-" + job.id());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, e) -> log.error("Loop thread {} died", th.getName(), e));
            threads.add(t);
            t.start();
        }

        log.info("Scheduler started with {} job loop(s)", jobs.size());
    }

    /**
     * Interrupt all loops. A run in progress has its process killed; the
     * loops exit at their next check.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        for (Thread t : threads) {
            t.interrupt();
        }

        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        for (Thread t : threads) {
            long remainingMs = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
            try {
                t.join(remainingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (t.isAlive()) {
                log.warn("Loop {} did not stop in time", t.getName());
            }
        }
        threads.clear();
        log.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Number of loop threads currently alive.
     */
    public synchronized int activeLoops() {
        int alive = 0;
        for (Thread t : threads) {
            if (t.isAlive()) {
                alive++;
            }
        }
        return alive;
    }

    public List<JobDescriptor> jobs() {
        return jobs;
    }
}
