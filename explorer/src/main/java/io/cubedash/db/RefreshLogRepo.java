package io.cubedash.db;

import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.model.RefreshRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Database access for summary refresh run logs.
 */
public class RefreshLogRepo {
    private static final Logger log = LoggerFactory.getLogger(RefreshLogRepo.class);

    private final HikariDataSource ds;

    public RefreshLogRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Starts a new refresh run and returns its unique ID.
     */
    public UUID startRun(String jobName, String productName) throws Exception {
        UUID runId = UUID.randomUUID();
        if (ds.isClosed()) {
            log.warn("startRun skipped (datasource closed): {} {}", jobName, productName);
            return runId;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO cubedash.refresh_run (run_id, job_name, product_name, started_at, status) "
                                + "VALUES (?, ?, ?, now(), 'RUNNING')")) {
            ps.setObject(1, runId);
            ps.setString(2, jobName);
            ps.setString(3, productName);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (ds.isClosed() || String.valueOf(e.getMessage()).toLowerCase().contains("closed")) {
                log.warn("startRun skipped (datasource closed): {} {}", jobName, productName);
                return runId;
            }
            throw e;
        }
        log.debug("startRun: {} {} -> {}", jobName, productName, runId);
        return runId;
    }

    /**
     * Marks a refresh run as success or failure with notes.
     */
    public void finishRun(UUID runId, boolean success, String notes) throws Exception {
        if (ds.isClosed()) {
            log.warn("finishRun skipped (datasource closed): {}", runId);
            return;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE cubedash.refresh_run SET finished_at = now(), status = ?, notes = ? WHERE run_id = ?")) {
            ps.setString(1, success ? "SUCCESS" : "FAILED");
            ps.setString(2, notes);
            ps.setObject(3, runId);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (ds.isClosed() || String.valueOf(e.getMessage()).toLowerCase().contains("closed")) {
                log.warn("finishRun skipped (datasource closed): {}", runId);
                return;
            }
            throw e;
        }
        log.debug("finishRun: {} success={} notes={}", runId, success, notes);
    }

    /**
     * Most recent runs first, optionally for one product.
     */
    public List<RefreshRun> recentRuns(String productName, int limit) throws Exception {
        String sql = "SELECT run_id, job_name, product_name, started_at, finished_at, status, notes "
                + "FROM cubedash.refresh_run WHERE (?::text IS NULL OR product_name = ?) "
                + "ORDER BY started_at DESC LIMIT ?";
        List<RefreshRun> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, productName);
            ps.setString(2, productName);
            ps.setInt(3, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new RefreshRun(
                            rs.getObject("run_id", UUID.class),
                            rs.getString("job_name"),
                            rs.getString("product_name"),
                            CatalogRepo.toInstant(rs.getTimestamp("started_at")),
                            CatalogRepo.toInstant(rs.getTimestamp("finished_at")),
                            rs.getString("status"),
                            rs.getString("notes")));
                }
            }
        }
        return out;
    }
}
