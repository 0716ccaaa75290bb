package agentyard.coordinator.store;

import agentyard.coordinator.config.CoordinatorConfig;
import agentyard.coordinator.repository.StoreException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; every repository method commits its own work.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("agentyard-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
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

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS (work queue) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              VARCHAR(64) PRIMARY KEY,
                            agent_id        VARCHAR(128) NOT NULL,
                            kind            VARCHAR(16) NOT NULL,
                            payload         CLOB NOT NULL,
                            status          VARCHAR(20) DEFAULT 'PENDING',
                            consumer_id     VARCHAR(128),
                            attempts        INT DEFAULT 0,
                            max_attempts    INT DEFAULT 5,
                            error_message   VARCHAR(4096),
                            enqueued_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            visible_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            claimed_at      TIMESTAMP,
                            finished_at     TIMESTAMP
                        );
                    """);

            // ---------- BUILDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS builds (
                            id                  VARCHAR(64) PRIMARY KEY,
                            job_id              VARCHAR(64),
                            agent_id            VARCHAR(128) NOT NULL,
                            source_ref          VARCHAR(2048) NOT NULL,
                            target_image        VARCHAR(512) NOT NULL,
                            image_reference     VARCHAR(512),
                            status              VARCHAR(20) NOT NULL,
                            backend_job_handle  VARCHAR(256),
                            error_detail        VARCHAR(4096),
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP,
                            completed_at        TIMESTAMP
                        );
                    """);

            // ---------- DEPLOYMENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS deployments (
                            id                  VARCHAR(64) PRIMARY KEY,
                            job_id              VARCHAR(64),
                            agent_id            VARCHAR(128) NOT NULL,
                            build_id            VARCHAR(64),
                            image_reference     VARCHAR(512) NOT NULL,
                            resolved_port       INT NOT NULL,
                            port_source         VARCHAR(16) NOT NULL,
                            workload_name       VARCHAR(256) NOT NULL,
                            service_endpoint    VARCHAR(512),
                            status              VARCHAR(20) NOT NULL,
                            error_detail        VARCHAR(4096),
                            superseded_by       VARCHAR(64),
                            retired_at          TIMESTAMP,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP,
                            completed_at        TIMESTAMP
                        );
                    """);

            // ---------- AGENTS (registry metadata) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS agents (
                            id              VARCHAR(128) PRIMARY KEY,
                            name            VARCHAR(256),
                            port            INT,
                            source_ref      VARCHAR(2048),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- AGENT LEASES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS agent_leases (
                            agent_id        VARCHAR(128) PRIMARY KEY,
                            holder          VARCHAR(128) NOT NULL,
                            acquired_at     TIMESTAMP NOT NULL,
                            expires_at      TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- DISCOVERED BACKENDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS discovered_backends (
                            agent_id        VARCHAR(128) PRIMARY KEY,
                            host            VARCHAR(512) NOT NULL,
                            port            INT NOT NULL,
                            workload_name   VARCHAR(256),
                            last_seen_at    TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status_visible ON jobs(status, visible_at, enqueued_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_agent ON jobs(agent_id, enqueued_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_builds_agent ON builds(agent_id, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_builds_job ON builds(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_deployments_agent ON deployments(agent_id, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_deployments_job ON deployments(job_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
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
