package aegisops.runner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for the runner.
 * Built once at startup and handed to every component that needs it.
 * All settings have sensible defaults.
 */
public final class RunnerConfig {

    private static final Logger log = LoggerFactory.getLogger(RunnerConfig.class);

    public static final String DEFAULT_BASE_DIR = "/share/jarvis_prime/aegisops";
    public static final String DEFAULT_NOTIFY_URL = "http://127.0.0.1:2599/internal/aegisops";

    /** How the automation tool is asked to report results. */
    public enum OutputMode {
        /** Structured JSON document on stdout (preferred) */
        JSON,
        /** Human-readable output; only the recap line is scraped */
        TEXT
    }

    // Paths
    private Path baseDir = Path.of(DEFAULT_BASE_DIR);

    // Database settings
    private String databaseUrl = null; // derived from baseDir unless overridden
    private int databasePoolSize = 4;

    // Executor settings
    private String ansibleExecutable = "ansible-playbook";
    private Duration runTimeout = Duration.ofSeconds(300);
    private OutputMode outputMode = OutputMode.JSON;

    // Scheduler settings
    private Duration pollQuantum = Duration.ofSeconds(1);

    // Notification settings
    private String notifyUrl = DEFAULT_NOTIFY_URL;
    private boolean notifyEnabled = true;
    private Duration notifyTimeout = Duration.ofSeconds(5);

    // Status API (0 = disabled)
    private int statusPort = 0;
    private String statusHost = "0.0.0.0";

    private RunnerConfig() {
    }

    public static RunnerConfig defaults() {
        return new RunnerConfig();
    }

    public static RunnerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static RunnerConfig fromEnv(Map<String, String> env) {
        RunnerConfig config = new RunnerConfig();

        String base = env.get("AEGISOPS_BASE");
        if (base != null && !base.isBlank()) {
            config.baseDir = Path.of(stripTrailingSlash(base.trim()));
        }

        String dbUrl = env.get("AEGISOPS_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl.trim();
        }

        String notifyUrl = env.get("AEGISOPS_NOTIFY_URL");
        if (notifyUrl != null && !notifyUrl.isBlank()) {
            config.notifyUrl = notifyUrl.trim();
        }

        String inbox = env.get("AEGISOPS_NOTIFY_INBOX");
        if (inbox != null && !inbox.isBlank()) {
            config.notifyEnabled = "true".equalsIgnoreCase(inbox.trim());
        }

        String bin = env.get("AEGISOPS_ANSIBLE_BIN");
        if (bin != null && !bin.isBlank()) {
            config.ansibleExecutable = bin.trim();
        }

        String timeout = env.get("AEGISOPS_RUN_TIMEOUT_SEC");
        if (timeout != null && !timeout.isBlank()) {
            int seconds = parseInt("AEGISOPS_RUN_TIMEOUT_SEC", timeout, 300, 1);
            config.runTimeout = Duration.ofSeconds(seconds);
        }

        String mode = env.get("AEGISOPS_OUTPUT_MODE");
        if (mode != null && !mode.isBlank()) {
            try {
                config.outputMode = OutputMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring AEGISOPS_OUTPUT_MODE={}, expected json or text", mode);
            }
        }

        String port = env.get("AEGISOPS_STATUS_PORT");
        if (port != null && !port.isBlank()) {
            config.statusPort = parseInt("AEGISOPS_STATUS_PORT", port, 0, 0);
        }

        return config;
    }

    // Getters
    public Path baseDir() {
        return baseDir;
    }

    public Path schedulesFile() {
        return baseDir.resolve("schedules.json");
    }

    public Path inventoryFile() {
        return baseDir.resolve("inventory.ini");
    }

    public Path ansibleConfigFile() {
        return baseDir.resolve("ansible.cfg");
    }

    public Path playbooksDir() {
        return baseDir.resolve("playbooks");
    }

    public Path databaseDir() {
        return baseDir.resolve("db");
    }

    public String databaseUrl() {
        if (databaseUrl != null) {
            return databaseUrl;
        }
        return "jdbc:h2:file:" + databaseDir().resolve("aegisops").toAbsolutePath()
                + ";AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    /** True when the database lives in a file under the base directory. */
    public boolean usesFileDatabase() {
        return databaseUrl == null;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String ansibleExecutable() {
        return ansibleExecutable;
    }

    public Duration runTimeout() {
        return runTimeout;
    }

    public OutputMode outputMode() {
        return outputMode;
    }

    public Duration pollQuantum() {
        return pollQuantum;
    }

    public String notifyUrl() {
        return notifyUrl;
    }

    public boolean notifyEnabled() {
        return notifyEnabled;
    }

    public Duration notifyTimeout() {
        return notifyTimeout;
    }

    public int statusPort() {
        return statusPort;
    }

    public String statusHost() {
        return statusHost;
    }

    public boolean statusApiEnabled() {
        return statusPort > 0;
    }

    // Fluent setters for testing/customization
    public RunnerConfig withBaseDir(Path baseDir) {
        this.baseDir = baseDir;
        return this;
    }

    public RunnerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public RunnerConfig withAnsibleExecutable(String executable) {
        this.ansibleExecutable = executable;
        return this;
    }

    public RunnerConfig withRunTimeout(Duration timeout) {
        this.runTimeout = timeout;
        return this;
    }

    public RunnerConfig withOutputMode(OutputMode mode) {
        this.outputMode = mode;
        return this;
    }

    public RunnerConfig withPollQuantum(Duration quantum) {
        this.pollQuantum = quantum;
        return this;
    }

    public RunnerConfig withNotifyUrl(String url) {
        this.notifyUrl = url;
        return this;
    }

    public RunnerConfig withNotifyEnabled(boolean enabled) {
        this.notifyEnabled = enabled;
        return this;
    }

    public RunnerConfig withNotifyTimeout(Duration timeout) {
        this.notifyTimeout = timeout;
        return this;
    }

    public RunnerConfig withStatusPort(int port) {
        this.statusPort = port;
        return this;
    }

    private static int parseInt(String name, String value, int fallback, int min) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            parsed = Integer.MIN_VALUE;
        }
        if (parsed < min) {
            log.warn("Ignoring {}={}, using {}", name, value, fallback);
            return fallback;
        }
        return parsed;
    }

    private static String stripTrailingSlash(String path) {
        String p = path;
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "baseDir=" + baseDir +
                ", ansible='" + ansibleExecutable + '\'' +
                ", runTimeout=" + runTimeout.toSeconds() + "s" +
                ", outputMode=" + outputMode +
                ", notifyUrl='" + notifyUrl + '\'' +
                ", notifyEnabled=" + notifyEnabled +
                ", statusPort=" + statusPort +
                '}';
    }
}
