package com.levy.ruleengine.runtime.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.levy.ruleengine.api.EvaluationListener;
import com.levy.ruleengine.api.config.EngineConfig;
import com.levy.ruleengine.api.exceptions.DivisionByZeroException;
import com.levy.ruleengine.api.exceptions.OperationTypeException;
import com.levy.ruleengine.api.exceptions.RuleEvaluationException;
import com.levy.ruleengine.api.exceptions.RuleViolationException;
import com.levy.ruleengine.api.exceptions.UnresolvedReferenceException;
import com.levy.ruleengine.api.model.EvaluationResult;
import com.levy.ruleengine.api.model.EvaluationTrace;
import com.levy.ruleengine.api.model.OperationRecord;
import com.levy.ruleengine.api.model.OperationType;
import com.levy.ruleengine.api.model.RuleDocument;
import com.levy.ruleengine.api.model.Value;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RuleFlowEvaluatorTest {

    private static final String INCOME_TAX = """
            {
              "$version": "1.0.0",
              "name": "Flat income tax",
              "jurisdiction": "XX",
              "taxpayer_type": "INDIVIDUAL",
              "constants": { "rate": 0.25 },
              "tables": [
                { "name": "flat",
                  "brackets": [ {"min": 0, "max": "$$MAX_TAXABLE_INCOME", "rate": 0.25, "base_tax": 0} ] }
              ],
              "inputs": {
                "income": { "type": "number" },
                "deductions": { "type": "number" }
              },
              "outputs": {
                "taxable": { "type": "number" },
                "liability": { "type": "number" }
              },
              "flow": [
                { "name": "compute_taxable",
                  "operations": [ {"type": "set", "target": "taxable", "value": "diff($income, $deductions)"} ] },
                { "name": "apply_table",
                  "operations": [ {"type": "lookup", "target": "liability", "table": "flat", "value": "taxable"} ] }
              ]
            }
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");

    private RuleFlowEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new RuleFlowEvaluator(EngineConfig.builder().traceEnabled(false).build(), tracer);
    }

    private RuleDocument rule(String json) throws Exception {
        return mapper.readValue(json, RuleDocument.class);
    }

    @Nested
    @DisplayName("Flow execution")
    class FlowExecution {

        @Test
        @DisplayName("Should compute liability through a bracket table")
        void shouldComputeLiability() throws Exception {
            EvaluationResult result = evaluator.evaluate(rule(INCOME_TAX),
                    Map.of("income", Value.of(500_000), "deductions", Value.of(250_000)));

            assertThat(result.ruleName()).isEqualTo("Flat income tax");
            assertThat(result.output("taxable")).isEqualTo(Value.of(250_000));
            assertThat(result.liability()).isEqualTo(62_500);
            assertThat(result.outputs()).containsOnlyKeys("taxable", "liability");
            assertThat(result.trace()).isNull();
        }

        @Test
        @DisplayName("Should let each operation see the previous result")
        void shouldApplyOperationsSequentially() throws Exception {
            RuleDocument rule = rule("""
                    {
                      "name": "Sequential",
                      "inputs": { "amount": { "type": "number" } },
                      "outputs": { "liability": { "type": "number" } },
                      "flow": [
                        { "name": "calc",
                          "operations": [
                            {"type": "set", "target": "base", "value": "$amount"},
                            {"type": "deduct", "target": "base", "value": 100},
                            {"type": "multiply", "target": "base", "value": 0.1},
                            {"type": "add", "target": "liability", "value": "base"},
                            {"type": "max", "target": "liability", "value": 0}
                          ] }
                      ]
                    }
                    """);

            EvaluationResult result = evaluator.evaluate(rule, Map.of("amount", Value.of(1_100)));

            assertThat(result.liability()).isEqualTo(100);
            assertThat(result.calculated()).containsEntry("base", Value.of(100));
        }

        @Test
        @DisplayName("Should run only the first matching case")
        void shouldSelectFirstMatchingCase() throws Exception {
            RuleDocument rule = rule("""
                    {
                      "name": "Filing status",
                      "inputs": { "status": { "type": "string" }, "income": { "type": "number" } },
                      "outputs": { "allowance": { "type": "number" } },
                      "flow": [
                        { "name": "allowance",
                          "cases": [
                            { "when": {"$status": {"eq": "MARRIED"}},
                              "operations": [ {"type": "set", "target": "allowance", "value": 20000} ] },
                            { "when": {"$income": {"gt": 0}},
                              "operations": [ {"type": "set", "target": "allowance", "value": 10000} ] },
                            { "operations": [ {"type": "set", "target": "allowance", "value": 5000} ] }
                          ] }
                      ]
                    }
                    """);

            assertThat(evaluator.evaluate(rule, Map.of("status", Value.of("MARRIED"), "income", Value.of(1)))
                    .output("allowance")).isEqualTo(Value.of(20_000));
            assertThat(evaluator.evaluate(rule, Map.of("status", Value.of("SINGLE"), "income", Value.of(1)))
                    .output("allowance")).isEqualTo(Value.of(10_000));
            assertThat(evaluator.evaluate(rule, Map.of("status", Value.of("SINGLE"), "income", Value.of(0)))
                    .output("allowance")).isEqualTo(Value.of(5_000));
        }

        @Test
        @DisplayName("Should leave the context unchanged when no case matches")
        void shouldSkipStepWithoutMatch() throws Exception {
            RuleDocument rule = rule("""
                    {
                      "name": "No match",
                      "inputs": { "income": { "type": "number" } },
                      "outputs": {
                        "credit": { "type": "number" },
                        "eligible": { "type": "boolean" },
                        "note": { "type": "string" }
                      },
                      "flow": [
                        { "name": "credit",
                          "cases": [
                            { "when": {"$income": {"lt": 0}},
                              "operations": [ {"type": "set", "target": "credit", "value": 1} ] }
                          ] }
                      ]
                    }
                    """);

            EvaluationResult result = evaluator.evaluate(rule, Map.of("income", Value.of(10)));

            assertThat(result.calculated()).isEmpty();
            assertThat(result.outputs())
                    .containsEntry("credit", Value.of(0))
                    .containsEntry("eligible", Value.of(false))
                    .containsEntry("note", Value.of(""));
        }
    }

    @Nested
    @DisplayName("Validation rules")
    class ValidationRules {

        private static final String GUARDED = """
                {
                  "name": "Guarded",
                  "inputs": {
                    "income": { "type": "number" },
                    "spouse_income": { "type": "number", "when": {"$status": {"eq": "MARRIED"}} },
                    "status": { "type": "string" }
                  },
                  "validate": [
                    { "when": {"$income": {"lt": 0}}, "error": "Income cannot be negative" },
                    { "when": {"$spouse_income": {"lt": 0}}, "error": "Spouse income cannot be negative" }
                  ],
                  "outputs": { "liability": { "type": "number" } },
                  "flow": [
                    { "name": "calc", "operations": [ {"type": "set", "target": "liability", "value": "$income"} ] }
                  ]
                }
                """;

        @Test
        @DisplayName("Should abort with the rule's message when a guard holds")
        void shouldAbortOnViolation() throws Exception {
            assertThatThrownBy(() -> evaluator.evaluate(rule(GUARDED),
                    Map.of("income", Value.of(-1), "status", Value.of("SINGLE"))))
                    .isInstanceOf(RuleViolationException.class)
                    .hasMessage("Validation failed: Income cannot be negative");
        }

        @Test
        @DisplayName("Should skip a guard that names an omitted input")
        void shouldSkipUnevaluableGuard() throws Exception {
            EvaluationResult result = evaluator.evaluate(rule(GUARDED),
                    Map.of("income", Value.of(100), "status", Value.of("SINGLE")));

            assertThat(result.liability()).isEqualTo(100);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should name the rule and step of a failing operation")
        void shouldWrapStepFailures() throws Exception {
            RuleDocument rule = rule("""
                    {
                      "name": "Broken",
                      "outputs": { "liability": { "type": "number" } },
                      "flow": [
                        { "name": "ok", "operations": [ {"type": "set", "target": "liability", "value": 10} ] },
                        { "name": "divide", "operations": [ {"type": "divide", "target": "liability", "value": 0} ] }
                      ]
                    }
                    """);

            assertThatThrownBy(() -> evaluator.evaluate(rule, Map.of()))
                    .isInstanceOf(RuleEvaluationException.class)
                    .hasMessageStartingWith("Rule 'Broken', step 'divide'")
                    .hasCauseInstanceOf(DivisionByZeroException.class)
                    .satisfies(e -> assertThat(((RuleEvaluationException) e).getStepName()).isEqualTo("divide"));
        }

        @Test
        @DisplayName("Should report unresolved references with their domain")
        void shouldWrapUnresolvedReference() throws Exception {
            RuleDocument rule = rule("""
                    {
                      "name": "Missing",
                      "flow": [
                        { "name": "calc", "operations": [ {"type": "set", "target": "x", "value": "$$rate"} ] }
                      ]
                    }
                    """);

            assertThatThrownBy(() -> evaluator.evaluate(rule, Map.of()))
                    .isInstanceOf(RuleEvaluationException.class)
                    .hasMessageContaining("Constant 'rate' not found")
                    .hasCauseInstanceOf(UnresolvedReferenceException.class);
        }

        @Test
        @DisplayName("Should refuse an output assigned a value of another type")
        void shouldRejectMistypedOutput() throws Exception {
            RuleDocument rule = rule("""
                    {
                      "name": "Mistyped",
                      "outputs": { "liability": { "type": "number" } },
                      "flow": [
                        { "name": "tax", "operations": [ {"type": "set", "target": "liability", "value": "'abc'"} ] }
                      ]
                    }
                    """);

            assertThatThrownBy(() -> evaluator.evaluate(rule, Map.of()))
                    .isInstanceOf(RuleEvaluationException.class)
                    .hasMessage("Rule 'Mistyped': Output 'liability' is declared as number but the flow assigned"
                            + " a string ('abc')");
        }

        @Test
        @DisplayName("Should not read a non-numeric liability as zero")
        void shouldRejectNonNumericLiability() throws Exception {
            RuleDocument rule = rule("""
                    {
                      "name": "Undeclared",
                      "flow": [
                        { "name": "tax", "operations": [ {"type": "set", "target": "liability", "value": "'abc'"} ] }
                      ]
                    }
                    """);

            EvaluationResult result = evaluator.evaluate(rule, Map.of());

            assertThat(result.calculated()).containsEntry("liability", Value.of("abc"));
            assertThatThrownBy(result::liability)
                    .isInstanceOf(OperationTypeException.class)
                    .hasMessageContaining("a number is required");
        }

        @Test
        @DisplayName("Should read an unset liability as zero")
        void shouldDefaultMissingLiability() throws Exception {
            RuleDocument rule = rule("""
                    {
                      "name": "Nothing due",
                      "flow": [ { "name": "noop", "operations": [ {"type": "set", "target": "x", "value": 1} ] } ]
                    }
                    """);

            assertThat(evaluator.evaluate(rule, Map.of()).liability()).isZero();
        }

        @Test
        @DisplayName("Should reject a step with both operations and cases")
        void shouldRejectMixedStep() throws Exception {
            RuleDocument rule = rule("""
                    {
                      "name": "Mixed",
                      "flow": [
                        { "name": "mixed",
                          "operations": [ {"type": "set", "target": "x", "value": 1} ],
                          "cases": [ { "operations": [ {"type": "set", "target": "x", "value": 2} ] } ] }
                      ]
                    }
                    """);

            assertThatThrownBy(() -> evaluator.evaluate(rule, Map.of()))
                    .isInstanceOf(RuleEvaluationException.class)
                    .hasMessageContaining("either operations or cases");
        }
    }

    @Nested
    @DisplayName("Observation")
    class Observation {

        @Mock
        private EvaluationListener listener;

        @Test
        @DisplayName("Should notify the listener of every step and operation")
        void shouldNotifyListener() throws Exception {
            evaluator.setEvaluationListener(listener);

            evaluator.evaluate(rule(INCOME_TAX), Map.of("income", Value.of(500_000), "deductions", Value.of(0)));

            InOrder order = inOrder(listener);
            order.verify(listener).onStepStart("compute_taxable", 1, 2);
            order.verify(listener).onOperationApplied(new OperationRecord(
                    "compute_taxable", OperationType.SET, "taxable", null, Value.of(500_000)));
            order.verify(listener).onStepComplete(eq("compute_taxable"), anyLong());
            order.verify(listener).onStepStart("apply_table", 2, 2);

            ArgumentCaptor<OperationRecord> records = ArgumentCaptor.forClass(OperationRecord.class);
            verify(listener, times(2)).onOperationApplied(records.capture());
            assertThat(records.getAllValues().get(1).after()).isEqualTo(Value.of(125_000));
        }

        @Test
        @DisplayName("Should attach a trace when tracing is enabled")
        void shouldRecordTrace() throws Exception {
            RuleFlowEvaluator tracing = new RuleFlowEvaluator(
                    EngineConfig.builder().traceEnabled(true).build(), tracer);

            EvaluationTrace trace = tracing.evaluate(rule(INCOME_TAX),
                    Map.of("income", Value.of(500_000), "deductions", Value.of(250_000))).trace();

            assertThat(trace).isNotNull();
            assertThat(trace.steps()).extracting(EvaluationTrace.StepTrace::stepName)
                    .containsExactly("compute_taxable", "apply_table");
            assertThat(trace.steps().get(0).selectedCase()).isNull();
            assertThat(trace.operations()).extracting(OperationRecord::target)
                    .containsExactly("taxable", "liability");
        }
    }
}
