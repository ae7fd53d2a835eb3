package org.ionresults.datapipeline.resources.database;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.ionresults.datapipeline.api.model.IonImageIds;
import org.ionresults.datapipeline.api.model.ResultRecord;
import org.ionresults.datapipeline.api.resources.IMonitorable;
import org.ionresults.datapipeline.api.resources.IResultDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * H2 result database using HikariCP for connection pooling.
 * <p>
 * <strong>Schema contract</strong>
 * <pre>
 * CREATE TABLE IF NOT EXISTS iso_image_metrics (
 *   job_id        BIGINT            NOT NULL,
 *   formula_i     INT               NOT NULL,
 *   sf            VARCHAR           NOT NULL,
 *   adduct        VARCHAR           NOT NULL,
 *   msm           DOUBLE PRECISION  NULL,
 *   fdr           DOUBLE PRECISION  NULL,
 *   stats         VARCHAR           NOT NULL,
 *   iso_image_ids VARCHAR ARRAY     NOT NULL,
 *   PRIMARY KEY (job_id, formula_i)
 * );
 * </pre>
 * {@link #insert(String, List)} runs all rows as one JDBC batch in one transaction and rolls
 * back on failure, so a job's rows are committed completely or not at all.
 * <p>
 * Implements {@link AutoCloseable} to release the connection pool on shutdown.
 */
public class H2ResultDatabase implements IResultDatabase, IMonitorable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(H2ResultDatabase.class);

    static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS iso_image_metrics (
          job_id        BIGINT            NOT NULL,
          formula_i     INT               NOT NULL,
          sf            VARCHAR           NOT NULL,
          adduct        VARCHAR           NOT NULL,
          msm           DOUBLE PRECISION,
          fdr           DOUBLE PRECISION,
          stats         VARCHAR           NOT NULL,
          iso_image_ids VARCHAR ARRAY     NOT NULL,
          PRIMARY KEY (job_id, formula_i)
        )""";

    private final String name;
    private final HikariDataSource dataSource;

    private final AtomicLong rowsInserted = new AtomicLong(0);
    private final AtomicLong batchesInserted = new AtomicLong(0);
    private final AtomicLong insertErrors = new AtomicLong(0);

    private volatile boolean tablesCreated = false;

    public H2ResultDatabase(String name, Config options) {
        this.name = name;
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for H2ResultDatabase.");
        }
        final String jdbcUrl = options.getString("jdbcUrl");
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 4);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 1);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("H2 result database '{}' connection pool started (max={}, minIdle={})",
                name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String errorMsg = String.format(
                    "Cannot open H2 database '%s': file already in use by another process. URL: %s", name, jdbcUrl);
                log.error(errorMsg);
                throw new RuntimeException(errorMsg, e);
            }

            String errorMsg = String.format("Failed to initialize H2 database '%s': %s. Database: %s. Error: %s",
                name, cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }
    }

    public String getResourceName() {
        return name;
    }

    /**
     * Creates the result table if it does not exist yet. Idempotent and thread-safe.
     */
    public void createTables() throws SQLException {
        if (tablesCreated) {
            return;
        }
        synchronized (this) {
            if (tablesCreated) {
                return;
            }
            try (Connection conn = dataSource.getConnection();
                 Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_TABLE);
                if (!conn.getAutoCommit()) {
                    conn.commit();
                }
            }
            tablesCreated = true;
            log.debug("Result table created in '{}'", name);
        }
    }

    @Override
    public void insert(String statement, List<Object[]> rows) throws SQLException {
        createTables();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(statement)) {
                for (Object[] row : rows) {
                    for (int i = 0; i < row.length; i++) {
                        bind(conn, stmt, i + 1, row[i]);
                    }
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
                rowsInserted.addAndGet(rows.size());
                batchesInserted.incrementAndGet();
            } catch (SQLException e) {
                insertErrors.incrementAndGet();
                // Rollback to keep connection clean for pool reuse
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
                }
                throw e;
            }
        }
    }

    /**
     * Reads back the rows of one job ordered by {@code formula_i}.
     */
    public List<ResultRecord> findByJob(long jobId) throws SQLException {
        createTables();
        List<ResultRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT job_id, formula_i, sf, adduct, msm, fdr, stats, iso_image_ids "
                     + "FROM iso_image_metrics WHERE job_id = ? ORDER BY formula_i")) {
            stmt.setLong(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Object[] ids = (Object[]) rs.getArray("iso_image_ids").getArray();
                    String[] imageIds = Arrays.copyOf(ids, ids.length, String[].class);
                    records.add(new ResultRecord(
                        rs.getLong("job_id"),
                        rs.getInt("formula_i"),
                        rs.getString("sf"),
                        rs.getString("adduct"),
                        rs.getObject("msm", Double.class),
                        rs.getObject("fdr", Double.class),
                        rs.getString("stats"),
                        IonImageIds.of(imageIds)));
                }
            }
        }
        return records;
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("rows_inserted", rowsInserted.get());
        metrics.put("batches_inserted", batchesInserted.get());
        metrics.put("insert_errors", insertErrors.get());
        if (!dataSource.isClosed()) {
            metrics.put("h2_pool_active_connections", dataSource.getHikariPoolMXBean().getActiveConnections());
            metrics.put("h2_pool_idle_connections", dataSource.getHikariPoolMXBean().getIdleConnections());
        }
        return metrics;
    }

    /**
     * Shuts H2 down and closes the connection pool.
     * <p>
     * {@code SHUTDOWN} makes H2 flush all pages before the pool releases its connections.
     */
    @Override
    public void close() {
        if (dataSource.isClosed()) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
            log.debug("H2 database '{}' shutdown command executed", name);
        } catch (SQLException e) {
            // 90121 = database is already closed
            if (e.getErrorCode() == 90121) {
                log.debug("H2 database '{}' already closed", name);
            } else {
                log.warn("H2 database '{}' shutdown command failed: {}", name, e.getMessage());
            }
        }
        dataSource.close();
        log.debug("H2 database '{}' connection pool closed", name);
    }

    private static void bind(Connection conn, PreparedStatement stmt, int index, Object value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.NULL);
        } else if (value instanceof String[] strings) {
            Array array = conn.createArrayOf("VARCHAR", strings);
            stmt.setArray(index, array);
        } else {
            stmt.setObject(index, value);
        }
    }
}
