package aegisops.runner;

import aegisops.runner.config.Dependencies;
import aegisops.runner.config.RunnerConfig;
import aegisops.runner.store.StoreInitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Process entry point: wires everything from the environment, starts the
 * job loops and blocks until the JVM is asked to stop.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        RunnerConfig config = RunnerConfig.fromEnv();
        log.info("AegisOps runner starting, base dir {}", config.baseDir());

        Dependencies deps;
        try {
            deps = Dependencies.create(config);
        } catch (StoreInitializationException e) {
            log.error("Run history store unavailable, aborting: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            shutdown.countDown();
        }, "aegisops-shutdown"));

        deps.start();
        if (deps.jobs().isEmpty()) {
            log.warn("No jobs configured in {}", config.schedulesFile());
        }

        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
