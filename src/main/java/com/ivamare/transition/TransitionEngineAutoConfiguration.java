package com.ivamare.transition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.transition.api.TransitionEngine;
import com.ivamare.transition.api.impl.DefaultTransitionEngine;
import com.ivamare.transition.compliance.ComplianceRecorder;
import com.ivamare.transition.coordinator.DefaultTransactionCoordinator;
import com.ivamare.transition.coordinator.TransactionCoordinator;
import com.ivamare.transition.model.EntityTypeRegistry;
import com.ivamare.transition.repository.ComplianceRepository;
import com.ivamare.transition.repository.TransactionLogRepository;
import com.ivamare.transition.repository.impl.JdbcComplianceRepository;
import com.ivamare.transition.repository.impl.JdbcTransactionLogRepository;
import com.ivamare.transition.rules.CompositeRuleSource;
import com.ivamare.transition.rules.DefaultRuleStore;
import com.ivamare.transition.rules.JsonResourceRuleSource;
import com.ivamare.transition.rules.PropertiesRuleSource;
import com.ivamare.transition.rules.RuleSource;
import com.ivamare.transition.rules.RuleStore;
import com.ivamare.transition.validation.DefaultTransitionValidator;
import com.ivamare.transition.validation.TransitionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for the Transition Engine.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Entity type registry</li>
 *   <li>Rule source and rule store</li>
 *   <li>Transition validator</li>
 *   <li>Repositories (Transaction Log, Compliance)</li>
 *   <li>Compliance recorder</li>
 *   <li>Transaction coordinator</li>
 *   <li>Transition engine facade</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * transition.enabled=false
 * </pre>
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "transition", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TransitionEngineProperties.class)
public class TransitionEngineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TransitionEngineAutoConfiguration.class);

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper transitionEngineObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Rules ---

    @Bean
    @ConditionalOnMissingBean
    public EntityTypeRegistry entityTypeRegistry() {
        return new EntityTypeRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleSource ruleSource(
            TransitionEngineProperties properties,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper) {
        List<RuleSource> sources = new ArrayList<>();
        sources.add(new PropertiesRuleSource(properties));

        String location = properties.getRulesLocation();
        if (location != null && !location.isBlank()) {
            log.info("Reading transition rules from {}", location);
            sources.add(new JsonResourceRuleSource(resourceLoader.getResource(location), objectMapper));
        }
        return new CompositeRuleSource(sources);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleStore ruleStore(
            RuleSource ruleSource,
            EntityTypeRegistry entityTypeRegistry,
            TransitionEngineProperties properties) {
        DefaultRuleStore store = new DefaultRuleStore(ruleSource, entityTypeRegistry);
        if (properties.isReloadOnStartup()) {
            store.reload();
        }
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public TransitionValidator transitionValidator(RuleStore ruleStore) {
        return new DefaultTransitionValidator(ruleStore);
    }

    // --- Repositories ---

    @Bean
    @ConditionalOnMissingBean
    public TransactionLogRepository transactionLogRepository(
            JdbcTemplate jdbcTemplate,
            ObjectMapper objectMapper,
            TransitionEngineProperties properties) {
        return new JdbcTransactionLogRepository(jdbcTemplate, objectMapper, properties.getHistory().getMaxLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplianceRepository complianceRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcComplianceRepository(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplianceRecorder complianceRecorder(ComplianceRepository complianceRepository) {
        return new ComplianceRecorder(complianceRepository);
    }

    // --- Coordinator ---

    @Bean
    @ConditionalOnMissingBean
    public TransactionCoordinator transactionCoordinator(
            TransitionValidator transitionValidator,
            TransactionLogRepository transactionLogRepository) {
        return new DefaultTransactionCoordinator(transitionValidator, transactionLogRepository);
    }

    // --- Transition Engine ---

    @Bean
    @ConditionalOnMissingBean
    public TransitionEngine transitionEngine(
            RuleStore ruleStore,
            EntityTypeRegistry entityTypeRegistry,
            TransitionValidator transitionValidator,
            TransactionCoordinator transactionCoordinator,
            TransactionLogRepository transactionLogRepository,
            ComplianceRecorder complianceRecorder,
            TransitionEngineProperties properties) {
        return new DefaultTransitionEngine(
            ruleStore,
            entityTypeRegistry,
            transitionValidator,
            transactionCoordinator,
            transactionLogRepository,
            complianceRecorder,
            properties.getHistory().getDefaultLimit()
        );
    }
}
