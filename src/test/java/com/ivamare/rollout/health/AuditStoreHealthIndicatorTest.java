package com.ivamare.rollout.health;

import com.ivamare.rollout.repository.AuditRepository;
import com.ivamare.rollout.repository.impl.InMemoryAuditRepository;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@DisplayName("AuditStoreHealthIndicator")
class AuditStoreHealthIndicatorTest {

    @Test
    @DisplayName("should return UP with the event count for an in-memory store")
    void shouldReturnUpForInMemoryStore() {
        AuditStoreHealthIndicator indicator = new AuditStoreHealthIndicator(new InMemoryAuditRepository());

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("InMemoryAuditRepository", health.getDetails().get("store"));
        assertEquals(0L, health.getDetails().get("auditEvents"));
    }

    @Test
    @DisplayName("should include pool statistics for a Hikari data source")
    void shouldIncludePoolStats() throws SQLException {
        AuditRepository repository = mock(AuditRepository.class);
        when(repository.countEvents()).thenReturn(42L);
        HikariDataSource dataSource = mock(HikariDataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        HikariPoolMXBean pool = mock(HikariPoolMXBean.class);
        when(dataSource.getHikariPoolMXBean()).thenReturn(pool);
        when(pool.getActiveConnections()).thenReturn(2);
        when(pool.getIdleConnections()).thenReturn(3);
        when(pool.getTotalConnections()).thenReturn(5);
        when(pool.getThreadsAwaitingConnection()).thenReturn(0);

        Health health = new AuditStoreHealthIndicator(repository, dataSource).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(42L, health.getDetails().get("auditEvents"));
        assertEquals(2, health.getDetails().get("pool.active"));
        assertEquals(5, health.getDetails().get("pool.total"));
    }

    @Test
    @DisplayName("should return DOWN when the connection is invalid")
    void shouldReturnDownWhenConnectionInvalid() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(false);

        Health health = new AuditStoreHealthIndicator(mock(AuditRepository.class), dataSource).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Database connection invalid", health.getDetails().get("error"));
    }

    @Test
    @DisplayName("should return DOWN when counting events fails")
    void shouldReturnDownWhenQueryFails() {
        AuditRepository repository = mock(AuditRepository.class);
        when(repository.countEvents()).thenThrow(new RuntimeException("Connection failed"));

        Health health = new AuditStoreHealthIndicator(repository).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Connection failed", health.getDetails().get("error"));
    }
}
