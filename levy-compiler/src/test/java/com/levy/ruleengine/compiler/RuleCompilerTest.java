package com.levy.ruleengine.compiler;

import com.levy.ruleengine.api.CompilationListener;
import com.levy.ruleengine.api.exceptions.RuleValidationException;
import com.levy.ruleengine.api.model.RuleDocument;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RuleCompilerTest {

    private static final String RULE = """
            {
              "$version": "1.0.0",
              "name": "Percentage tax",
              "jurisdiction": "PH",
              "taxpayer_type": "SOLE_PROPRIETORSHIP",
              "constants": { "rate": 0.03 },
              "inputs": { "gross_sales": { "type": "number" } },
              "outputs": { "liability": { "type": "number" } },
              "flow": [
                { "name": "tax",
                  "operations": [
                    {"type": "set", "target": "liability", "value": "$gross_sales"},
                    {"type": "multiply", "target": "liability", "value": "$$rate"}
                  ] }
              ]
            }
            """;

    @Mock
    private CompilationListener listener;

    private RuleCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new RuleCompiler(OpenTelemetry.noop().getTracer("test"));
        compiler.setCompilationListener(listener);
    }

    @Test
    @DisplayName("Should report the three stages in order")
    void shouldNotifyStages() {
        RuleDocument rule = compiler.compile(RULE);

        assertThat(rule.constants()).containsKey("rate");

        InOrder order = inOrder(listener);
        order.verify(listener).onStageStart("PARSING", 1, 3);
        order.verify(listener).onStageComplete(eq("PARSING"), any());
        order.verify(listener).onStageStart("VALIDATION", 2, 3);
        order.verify(listener).onStageComplete(eq("VALIDATION"), any());
        order.verify(listener).onStageStart("BINDING", 3, 3);

        ArgumentCaptor<CompilationListener.StageResult> binding =
                ArgumentCaptor.forClass(CompilationListener.StageResult.class);
        order.verify(listener).onStageComplete(eq("BINDING"), binding.capture());
        assertThat(binding.getValue().metrics()).containsEntry("stepCount", 1);
        verify(listener, never()).onError(any(), any());
    }

    @Test
    @DisplayName("Should report a refused document to the listener")
    void shouldNotifyValidationError() {
        String invalid = RULE.replace("\"multiply\"", "\"power\"");

        assertThatThrownBy(() -> compiler.compile(invalid))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("Invalid operation type: power");

        verify(listener).onError(eq("VALIDATION"), any(RuleValidationException.class));
        verify(listener, never()).onStageStart(eq("BINDING"), eq(3), eq(3));
    }

    @Test
    @DisplayName("Should compile without a listener")
    void shouldCompileWithoutListener() {
        compiler.setCompilationListener(null);

        assertThat(compiler.compile(RULE).flow().get(0).operations()).hasSize(2);
    }
}
