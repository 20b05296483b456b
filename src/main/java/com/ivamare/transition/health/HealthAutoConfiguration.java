package com.ivamare.transition.health;

import com.ivamare.transition.TransitionEngineAutoConfiguration;
import com.ivamare.transition.rules.RuleStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for Transition Engine health indicators.
 */
@AutoConfiguration(after = TransitionEngineAutoConfiguration.class)
@ConditionalOnClass({HealthIndicator.class, JdbcTemplate.class})
@ConditionalOnBean(RuleStore.class)
@ConditionalOnProperty(prefix = "transition", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(TransitionEngineHealthIndicator.class)
    public TransitionEngineHealthIndicator transitionEngineHealthIndicator(
            JdbcTemplate jdbcTemplate,
            RuleStore ruleStore,
            ObjectProvider<DataSource> dataSource) {
        return new TransitionEngineHealthIndicator(jdbcTemplate, ruleStore, dataSource.getIfAvailable());
    }
}
