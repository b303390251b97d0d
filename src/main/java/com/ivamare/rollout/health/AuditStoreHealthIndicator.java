package com.ivamare.rollout.health;

import com.ivamare.rollout.repository.AuditRepository;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Health indicator for the audit and idempotency store.
 *
 * <p>Reports the number of stored events and, for a JDBC store, connection
 * validity and HikariCP pool statistics.
 */
public class AuditStoreHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final AuditRepository auditRepository;
    private final DataSource dataSource;

    public AuditStoreHealthIndicator(AuditRepository auditRepository) {
        this(auditRepository, null);
    }

    public AuditStoreHealthIndicator(AuditRepository auditRepository, DataSource dataSource) {
        this.auditRepository = auditRepository;
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Health.Builder builder = Health.up()
                .withDetail("store", auditRepository.getClass().getSimpleName())
                .withDetail("auditEvents", auditRepository.countEvents());
            addPoolStats(builder);
            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
