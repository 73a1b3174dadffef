package aegisops.runner.store;

import aegisops.runner.config.RunnerConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management for run history.
 * Uses HikariCP for connection pooling over an embedded H2 file.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(RunnerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize(),
                config.usesFileDatabase() ? config.databaseDir() : null);
    }

    public Database(String jdbcUrl, int poolSize) {
        this(jdbcUrl, poolSize, null);
    }

    private Database(String jdbcUrl, int poolSize, Path directory) {
        if (directory != null) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new StoreInitializationException("Cannot create database directory " + directory, e);
            }
        }

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("aegisops-db-pool");
        hikariConfig.setAutoCommit(false);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            throw new StoreInitializationException("Cannot open database " + jdbcUrl, e);
        }

        log.info("Database pool initialized: {}", jdbcUrl);

        try {
            initSchema();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Create tables and indexes if missing. Safe to call any number of times.
     */
    public void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- RUN HISTORY ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS ansible_runs (
                            id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            ts                  TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            playbook            VARCHAR(512),
                            status              VARCHAR(8),
                            ok_count            INT DEFAULT 0,
                            changed_count       INT DEFAULT 0,
                            fail_count          INT DEFAULT 0,
                            unreachable_count   INT DEFAULT 0,
                            target_key          VARCHAR(256)
                        );
                    """);

            // ---------- PER-CHECK RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS uptime_runs (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            ts          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            host        VARCHAR(256),
                            check_name  VARCHAR(256),
                            mode        VARCHAR(32),
                            status      VARCHAR(32),
                            detail      VARCHAR(4096)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_ansible_runs_ts ON ansible_runs(ts);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_ansible_runs_playbook ON ansible_runs(playbook, ts);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_uptime_runs_ts ON uptime_runs(ts);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreInitializationException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
