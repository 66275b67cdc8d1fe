package io.sqlsugar.starter;

import io.sqlsugar.SqlSugar;
import io.sqlsugar.audit.DecisionLog;
import io.sqlsugar.audit.ReductionObserver;
import io.sqlsugar.engine.PebbleTemplateEngine;
import io.sqlsugar.engine.TemplateEngine;
import io.sqlsugar.variable.TypeInference;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(SqlSugar.class)
@EnableConfigurationProperties(SqlSugarProperties.class)
public class SqlSugarAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlSugarAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "sqlsugar.engine", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TemplateEngine sqlSugarTemplateEngine() {
        return new PebbleTemplateEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public TypeInference sqlSugarTypeInference(SqlSugarProperties properties) {
        return properties.getTypeInference().build();
    }

    @Bean
    @ConditionalOnMissingBean
    public List<ReductionObserver> reductionObservers(SqlSugarProperties properties) {
        DecisionLog decisionLog = properties.getDecisionLog().build(LOGGER::info);
        if (decisionLog == null) {
            return List.of();
        }
        List<ReductionObserver> observers = new ArrayList<>();
        observers.add(decisionLog);
        return observers;
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlSugar sqlSugar(
        ObjectProvider<TemplateEngine> engine,
        TypeInference typeInference,
        List<ReductionObserver> observers
    ) {
        SqlSugar.Builder builder = SqlSugar.builder()
            .typeInference(typeInference)
            .observers(observers);
        TemplateEngine templateEngine = engine.getIfAvailable();
        if (templateEngine == null) {
            builder.withoutEngine();
        } else {
            builder.engine(templateEngine);
        }
        return builder.build();
    }
}
