package io.sqlsugar.starter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.sqlsugar.SqlSugar;
import io.sqlsugar.audit.DecisionLog;
import io.sqlsugar.audit.ReductionObserver;
import io.sqlsugar.engine.TemplateEngine;
import io.sqlsugar.template.ProcessingResult;
import io.sqlsugar.variable.TypeInference;
import io.sqlsugar.variable.VariableType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class SqlSugarAutoConfigurationTest {
    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(SqlSugarAutoConfiguration.class));

    @Test
    void createsFacadeWithPebbleEngineByDefault() {
        runner.run(context -> {
            assertTrue(context.containsBean("sqlSugar"));
            assertTrue(context.getBeanNamesForType(TemplateEngine.class).length == 1);
            SqlSugar sqlSugar = context.getBean(SqlSugar.class);
            assertTrue(sqlSugar.engine().isPresent());
            ProcessingResult result = sqlSugar.reduce(
                "SELECT * FROM t WHERE {% if active %}status='on'{% else %}status='off'{% endif %}",
                Map.of("active", true)
            );
            assertEquals("SELECT * FROM t WHERE status='on'", result.reducedTemplate());
        });
    }

    @Test
    void engineCanBeDisabled() {
        runner.withPropertyValues("sqlsugar.engine.enabled=false").run(context -> {
            assertEquals(0, context.getBeanNamesForType(TemplateEngine.class).length);
            assertFalse(context.getBean(SqlSugar.class).engine().isPresent());
        });
    }

    @Test
    void decisionLogIsRegisteredUnlessDisabled() {
        runner.run(context -> {
            @SuppressWarnings("unchecked")
            List<ReductionObserver> observers = context.getBean("reductionObservers", List.class);
            assertEquals(1, observers.size());
            assertTrue(observers.get(0) instanceof DecisionLog);
        });
        runner.withPropertyValues("sqlsugar.decision-log.enabled=false").run(context -> {
            @SuppressWarnings("unchecked")
            List<ReductionObserver> observers = context.getBean("reductionObservers", List.class);
            assertTrue(observers.isEmpty());
        });
    }

    @Test
    void customTypeRulesTakePrecedence() {
        runner.withPropertyValues(
            "sqlsugar.type-inference.custom-rules[0].name=tenant",
            "sqlsugar.type-inference.custom-rules[0].pattern=^tenant",
            "sqlsugar.type-inference.custom-rules[0].type=NUMBER"
        ).run(context -> {
            TypeInference inference = context.getBean(TypeInference.class);
            assertEquals("tenant", inference.rules().get(0).name());
            assertEquals(VariableType.NUMBER, inference.infer("tenant_code"));
        });
    }
}
