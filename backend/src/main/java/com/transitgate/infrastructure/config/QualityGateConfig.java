package com.transitgate.infrastructure.config;

import com.transitgate.domain.dataset.model.DatasetSchema;
import com.transitgate.domain.quality.model.SeverityPolicy;
import com.transitgate.infrastructure.quality.classification.SeverityTable;
import com.transitgate.infrastructure.quality.classification.SeverityTableLoader;
import com.transitgate.infrastructure.quality.cleaning.CleaningOptions;
import com.transitgate.infrastructure.quality.validation.domain.DomainRule;
import com.transitgate.infrastructure.quality.validation.domain.DomainRuleRegistry;
import com.transitgate.infrastructure.quality.validation.relational.RelationalRule;
import com.transitgate.infrastructure.quality.validation.relational.RelationalRuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.HashSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Builds the quality-gate rule catalog and policy from {@link QualityGateProperties}.
 * A malformed catalog fails application startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(QualityGateProperties.class)
public class QualityGateConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SeverityPolicy defaultSeverityPolicy(QualityGateProperties properties) {
        return properties.getPolicy().toSeverityPolicy();
    }

    @Bean
    public CleaningOptions cleaningOptions(QualityGateProperties properties) {
        QualityGateProperties.Cleaning cleaning = properties.getCleaning();
        return new CleaningOptions(
                new HashSet<>(cleaning.getNullSentinels()),
                cleaning.isStripThousandsSeparators(),
                RuleCatalogFactory.rangeSplits(cleaning.getRangeSplits()));
    }

    @Bean
    public DatasetSchema datasetSchema(QualityGateProperties properties) {
        DatasetSchema schema = RuleCatalogFactory.schema(properties.getFields());
        log.info("[Config] {} field specs", schema.fields().size());
        return schema;
    }

    /**
     * Catalog rules first, then every {@link DomainRule} bean in {@code @Order} order.
     */
    @Bean
    public DomainRuleRegistry domainRuleRegistry(QualityGateProperties properties,
                                                 ObjectProvider<DomainRule> ruleBeans) {
        DomainRuleRegistry registry = new DomainRuleRegistry(RuleCatalogFactory.domainRules(properties.getDomainRules()));
        int catalogRules = registry.size();
        ruleBeans.orderedStream().forEach(registry::register);
        log.info("[Config] {} domain rules ({} from beans)", registry.size(), registry.size() - catalogRules);
        return registry;
    }

    @Bean
    public RelationalRuleRegistry relationalRuleRegistry(QualityGateProperties properties,
                                                         ObjectProvider<RelationalRule> ruleBeans) {
        RelationalRuleRegistry registry = new RelationalRuleRegistry(
                RuleCatalogFactory.relationalRules(properties.getRelationalRules()));
        int catalogRules = registry.size();
        ruleBeans.orderedStream().forEach(registry::register);
        log.info("[Config] {} relational rules ({} from beans), reference tables {}",
                registry.size(), registry.size() - catalogRules, registry.requiredReferenceTables());
        return registry;
    }

    @Bean
    public SeverityTable severityTable(QualityGateProperties properties,
                                       SeverityTableLoader loader,
                                       ResourceLoader resourceLoader) {
        return loader.load(resourceLoader.getResource(properties.getSeverityTable()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService validatorExecutor(QualityGateProperties properties) {
        return Executors.newFixedThreadPool(properties.getValidatorThreads(),
                new CustomizableThreadFactory("quality-gate-validator-"));
    }
}
