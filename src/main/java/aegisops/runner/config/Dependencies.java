package aegisops.runner.config;

import aegisops.runner.api.v1.HealthController;
import aegisops.runner.api.v1.JobController;
import aegisops.runner.api.v1.RunController;
import aegisops.runner.executor.PlaybookExecutor;
import aegisops.runner.model.JobDescriptor;
import aegisops.runner.notify.HttpNotificationSender;
import aegisops.runner.notify.NotificationSender;
import aegisops.runner.notify.PlaybookEventDispatcher;
import aegisops.runner.parser.ChainedResultParser;
import aegisops.runner.parser.CheckResultExtractor;
import aegisops.runner.repository.RunHistoryRepository;
import aegisops.runner.scheduler.JobScheduler;
import aegisops.runner.server.RouterHandler;
import aegisops.runner.server.StatusServer;
import aegisops.runner.service.RunHistoryService;
import aegisops.runner.store.Database;
import aegisops.runner.store.JdbcRunHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires the store, executor, scheduler and status API.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(RunnerConfig.fromEnv());
 * deps.start(); // job loops and optional status API
 * // ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final RunnerConfig config;
    private final List<JobDescriptor> jobs;
    private final Database database;
    private final RunHistoryRepository runHistoryRepository;
    private final RunHistoryService runHistoryService;
    private final NotificationSender notificationSender;
    private final PlaybookExecutor executor;
    private final JobScheduler scheduler;

    // Status API (lazy-initialized)
    private RouterHandler routerHandler;
    private StatusServer statusServer;

    private Dependencies(RunnerConfig config, List<JobDescriptor> jobs) {
        this.config = config;
        this.jobs = List.copyOf(jobs);

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.runHistoryRepository = new JdbcRunHistoryRepository(database);

        // Services
        this.runHistoryService = new RunHistoryService(runHistoryRepository);
        this.notificationSender = config.notifyEnabled()
                ? new HttpNotificationSender(config)
                : NotificationSender.disabled();
        this.executor = new PlaybookExecutor(
                config,
                runHistoryRepository,
                ChainedResultParser.standard(),
                new CheckResultExtractor(),
                new PlaybookEventDispatcher(),
                notificationSender);
        this.scheduler = new JobScheduler(this.jobs, executor, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies, loading jobs from the configured schedules file.
     */
    public static Dependencies create(RunnerConfig config) {
        return new Dependencies(config, new ScheduleLoader(config).load());
    }

    /**
     * Create dependencies for an explicit job list.
     */
    public static Dependencies create(RunnerConfig config, List<JobDescriptor> jobs) {
        return new Dependencies(config, jobs);
    }

    // Getters
    public RunnerConfig config() {
        return config;
    }

    public List<JobDescriptor> jobs() {
        return jobs;
    }

    public Database database() {
        return database;
    }

    public RunHistoryRepository runHistoryRepository() {
        return runHistoryRepository;
    }

    public RunHistoryService runHistoryService() {
        return runHistoryService;
    }

    public PlaybookExecutor executor() {
        return executor;
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, scheduler, runHistoryService))
                    .registerController(new JobController(scheduler))
                    .registerController(new RunController(runHistoryService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Status server bound to the given port (0 picks a free one).
     */
    public synchronized StatusServer statusServer(int port) {
        if (statusServer == null) {
            statusServer = new StatusServer(config.statusHost(), port, routerHandler());
        }
        return statusServer;
    }

    /**
     * Start the job loops, and the status API when a port is configured.
     *
     * @return false if the status API was wanted but could not be started;
     *         the job loops run either way
     */
    public boolean start() {
        scheduler.start();
        if (config.statusApiEnabled() && !statusServer(config.statusPort()).start()) {
            log.warn("Status API unavailable on port {}; runner continues without it", config.statusPort());
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        synchronized (this) {
            if (statusServer != null) {
                try {
                    statusServer.stop();
                } catch (RuntimeException e) {
                    log.warn("Error stopping status API: {}", e.getMessage());
                }
            }
        }

        try {
            scheduler.stop();
        } catch (RuntimeException e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
