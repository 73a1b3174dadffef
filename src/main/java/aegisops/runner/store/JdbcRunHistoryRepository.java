package aegisops.runner.store;

import aegisops.runner.model.CheckRecord;
import aegisops.runner.model.RunRecord;
import aegisops.runner.model.RunStatus;
import aegisops.runner.repository.RunHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of RunHistoryRepository.
 */
public class JdbcRunHistoryRepository implements RunHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunHistoryRepository.class);

    private static final int MAX_DETAIL = 4096;

    private final Database db;

    public JdbcRunHistoryRepository(Database db) {
        this.db = db;
    }

    @Override
    public void record(String playbook, RunStatus status, int ok, int changed, int failed, int unreachable,
            String targetKey) {
        String sql = """
                    INSERT INTO ansible_runs (ts, playbook, status, ok_count, changed_count, fail_count, unreachable_count, target_key)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, playbook);
            ps.setString(3, status.wire());
            ps.setInt(4, Math.max(0, ok));
            ps.setInt(5, Math.max(0, changed));
            ps.setInt(6, Math.max(0, failed));
            ps.setInt(7, Math.max(0, unreachable));
            ps.setString(8, targetKey != null ? targetKey : "");

            ps.executeUpdate();
            conn.commit();

            log.debug("Recorded run: playbook={} status={}", playbook, status.wire());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record run for playbook: " + playbook, e);
        }
    }

    @Override
    public int recordChecks(List<CheckRecord> checks) {
        if (checks == null || checks.isEmpty()) {
            return 0;
        }

        String sql = """
                    INSERT INTO uptime_runs (ts, host, check_name, mode, status, detail)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            for (CheckRecord check : checks) {
                ps.setTimestamp(1, now);
                ps.setString(2, check.host());
                ps.setString(3, check.checkName());
                ps.setString(4, check.mode());
                ps.setString(5, check.status());
                ps.setString(6, truncate(check.detail()));
                ps.addBatch();
            }

            ps.executeBatch();
            conn.commit();
            return checks.size();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record " + checks.size() + " check results", e);
        }
    }

    @Override
    public List<RunRecord> findRecent(int limit) {
        String sql = "SELECT * FROM ansible_runs ORDER BY ts DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent runs", e);
        }
    }

    @Override
    public List<RunRecord> findRecentByPlaybook(String playbook, int limit) {
        String sql = "SELECT * FROM ansible_runs WHERE playbook = ? ORDER BY ts DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, playbook);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find runs for playbook: " + playbook, e);
        }
    }

    @Override
    public List<CheckRecord> findRecentChecks(int limit) {
        String sql = "SELECT * FROM uptime_runs ORDER BY ts DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<CheckRecord> checks = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    checks.add(new CheckRecord(
                            rs.getLong("id"),
                            toInstant(rs.getTimestamp("ts")),
                            rs.getString("host"),
                            rs.getString("check_name"),
                            rs.getString("mode"),
                            rs.getString("status"),
                            rs.getString("detail")));
                }
            }
            return checks;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent checks", e);
        }
    }

    @Override
    public long count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM ansible_runs");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count runs", e);
        }
    }

    // --- Helpers ---

    private List<RunRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<RunRecord> runs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                runs.add(mapRow(rs));
            }
        }
        return runs;
    }

    private RunRecord mapRow(ResultSet rs) throws SQLException {
        return new RunRecord(
                rs.getLong("id"),
                toInstant(rs.getTimestamp("ts")),
                rs.getString("playbook"),
                RunStatus.fromWire(rs.getString("status")),
                rs.getInt("ok_count"),
                rs.getInt("changed_count"),
                rs.getInt("fail_count"),
                rs.getInt("unreachable_count"),
                rs.getString("target_key"));
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_DETAIL) {
            return s;
        }
        return s.substring(0, MAX_DETAIL);
    }
}
