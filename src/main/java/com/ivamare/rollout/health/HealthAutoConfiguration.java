package com.ivamare.rollout.health;

import com.ivamare.rollout.RolloutAutoConfiguration;
import com.ivamare.rollout.connector.ConnectorDispatcher;
import com.ivamare.rollout.repository.AuditRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for rollout health indicators.
 */
@AutoConfiguration(after = RolloutAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "rollout", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnBean(AuditRepository.class)
    @ConditionalOnMissingBean(AuditStoreHealthIndicator.class)
    public AuditStoreHealthIndicator auditStoreHealthIndicator(AuditRepository auditRepository,
                                                               ObjectProvider<DataSource> dataSource) {
        return new AuditStoreHealthIndicator(auditRepository, dataSource.getIfAvailable());
    }

    @Bean
    @ConditionalOnBean(ConnectorDispatcher.class)
    @ConditionalOnMissingBean(ConnectorHealthIndicator.class)
    public ConnectorHealthIndicator connectorHealthIndicator(ConnectorDispatcher dispatcher) {
        return new ConnectorHealthIndicator(dispatcher);
    }
}
