package io.sqlsugar.variable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.sqlsugar.engine.PebbleTemplateEngine;
import io.sqlsugar.engine.TemplateEngine;
import io.sqlsugar.engine.TemplateEngineException;
import io.sqlsugar.engine.VariableReference;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VariableExtractorTest {
    private final VariableExtractor extractor = new VariableExtractor(new PebbleTemplateEngine(), TypeInference.defaults());

    @Test
    void structuralExtractionOfDottedPath() {
        List<VariableDescriptor> variables = extractor.extract("SELECT * FROM users WHERE id = {{ user.id }}");
        assertEquals(1, variables.size());
        VariableDescriptor descriptor = variables.get(0);
        assertEquals("user.id", descriptor.name());
        assertEquals(VariableType.NUMBER, descriptor.type());
        assertEquals(ExtractionMethod.STRUCTURAL, descriptor.extractionMethod());
        assertTrue(descriptor.required());
    }

    @Test
    void filtersAccumulateOnOneDescriptor() {
        List<VariableDescriptor> variables = extractor.extract("{{ amt | float }} ... {{ amt | round(2) }}");
        assertEquals(1, variables.size());
        assertEquals(List.of("float", "round"), variables.get(0).filters());
    }

    @Test
    void deepPathsAreTruncated() {
        List<VariableDescriptor> variables = extractor.extract("{{ order.customer.email }} {{ order.customer.name }}");
        assertEquals(1, variables.size());
        assertEquals("order.customer", variables.get(0).name());
    }

    @Test
    void fallsBackToValidatedPatternWhenEngineRejectsTemplate() {
        List<VariableDescriptor> variables = extractor.extract("SELECT {{ name }} FROM t {% if active %}");
        assertEquals(2, variables.size());
        assertEquals("name", variables.get(0).name());
        assertEquals("active", variables.get(1).name());
        for (VariableDescriptor descriptor : variables) {
            assertEquals(ExtractionMethod.VALIDATED_PATTERN, descriptor.extractionMethod());
            assertTrue(descriptor.valid());
            assertNull(descriptor.validationError());
        }
    }

    @Test
    void failedTestRenderMarksDescriptorInvalid() {
        TemplateEngine failing = new TemplateEngine() {
            @Override
            public List<VariableReference> references(String template) {
                throw new TemplateEngineException("no tree", null);
            }

            @Override
            public void validate(String template) {
            }

            @Override
            public String render(String template, Map<String, Object> context) {
                throw new TemplateEngineException("boom", null);
            }
        };
        List<VariableDescriptor> variables = new VariableExtractor(failing, TypeInference.defaults())
            .extract("{{ total | money }}");
        assertEquals(1, variables.size());
        assertFalse(variables.get(0).valid());
        assertEquals("boom", variables.get(0).validationError());
        assertEquals(List.of("money"), variables.get(0).filters());
    }

    @Test
    void patternOnlyExtractor() {
        List<VariableDescriptor> variables = VariableExtractor.patternOnly(TypeInference.defaults())
            .extract("{% if status in ['a', 'b'] %}{{ created_at }}{% endif %}");
        assertEquals(2, variables.size());
        assertEquals("status", variables.get(0).name());
        assertEquals(VariableType.DATETIME, variables.get(1).type());
        assertEquals(ExtractionMethod.PATTERN, variables.get(1).extractionMethod());
    }
}
