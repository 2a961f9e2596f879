package com.levy.ruleengine.compiler;

import com.levy.ruleengine.api.config.EngineConfig;
import com.levy.ruleengine.api.config.ValidationMode;
import com.levy.ruleengine.api.exceptions.RuleValidationException;
import com.levy.ruleengine.api.model.RuleDocument;
import com.levy.ruleengine.api.model.ValidationIssue;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleCompilerValidationTest {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");

    private RuleCompiler compiler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        compiler = new RuleCompiler(tracer, EngineConfig.builder().validationMode(ValidationMode.WARNING).build());
    }

    private Path writeRule(String json) throws IOException {
        Path ruleFile = tempDir.resolve("rule.json");
        Files.writeString(ruleFile, json);
        return ruleFile;
    }

    /**
     * A valid document whose flow is replaced by {@code flow}.
     */
    private static String withFlow(String flow) {
        return """
                {
                  "$version": "1.0.0",
                  "name": "Test rule",
                  "jurisdiction": "PH",
                  "taxpayer_type": "INDIVIDUAL",
                  "constants": { "exemption": 250000 },
                  "tables": [
                    { "name": "flat", "brackets": [ {"min": 0, "max": null, "rate": 0.25, "base_tax": 0} ] }
                  ],
                  "inputs": { "gross_income": { "type": "number", "minimum": 0 } },
                  "outputs": { "liability": { "type": "number" } },
                  "flow": %s
                }
                """.formatted(flow);
    }

    private ValidationIssue singleError(String json) {
        try {
            compiler.compile(json);
        } catch (RuleValidationException e) {
            assertThat(e.getIssues().stream().filter(ValidationIssue::isError)).hasSize(1);
            return e.getIssues().stream().filter(ValidationIssue::isError).findFirst().orElseThrow();
        }
        throw new AssertionError("Expected the document to be refused");
    }

    @Test
    @DisplayName("Should compile the end-to-end example from a file")
    void shouldCompileValidRule() throws IOException {
        Path ruleFile = writeRule(withFlow("""
                [
                  { "name": "taxable",
                    "operations": [
                      {"type": "set", "target": "taxable_income", "value": "$gross_income"},
                      {"type": "subtract", "target": "taxable_income", "value": "$$exemption"},
                      {"type": "max", "target": "taxable_income", "value": 0}
                    ] },
                  { "name": "tax",
                    "operations": [ {"type": "lookup", "target": "liability", "table": "flat", "value": "taxable_income"} ] }
                ]
                """));

        RuleDocument rule = compiler.compile(ruleFile);

        assertThat(rule.name()).isEqualTo("Test rule");
        assertThat(rule.flow()).hasSize(2);
        assertThat(rule.table("flat")).isPresent();
    }

    @Test
    @DisplayName("Should refuse text that is not JSON")
    void shouldRejectInvalidJson() {
        assertThatThrownBy(() -> compiler.compile("{ not json"))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    @DisplayName("Should list every missing required field")
    void shouldReportMissingFields() {
        assertThatThrownBy(() -> compiler.compile("""
                { "name": "Incomplete" }
                """))
                .isInstanceOf(RuleValidationException.class)
                .satisfies(e -> assertThat(((RuleValidationException) e).getIssues())
                        .extracting(ValidationIssue::path)
                        .containsExactly("/$version", "/jurisdiction", "/taxpayer_type", "/flow"));
    }

    @Nested
    @DisplayName("Metadata")
    class Metadata {

        @Test
        @DisplayName("Should reject a malformed version and jurisdiction")
        void shouldRejectMetadata() {
            String json = withFlow("[{\"name\": \"s\", \"operations\": [{\"type\": \"set\", \"target\": \"x\", \"value\": 1}]}]")
                    .replace("\"1.0.0\"", "\"v1\"")
                    .replace("\"PH\"", "\"PHL\"");

            assertThatThrownBy(() -> compiler.compile(json))
                    .isInstanceOf(RuleValidationException.class)
                    .hasMessageContaining("Invalid version format")
                    .hasMessageContaining("Invalid jurisdiction code");
        }

        @Test
        @DisplayName("Should only warn about unknown taxpayer types")
        void shouldWarnAboutTaxpayerType() {
            String json = withFlow("[{\"name\": \"s\", \"operations\": [{\"type\": \"set\", \"target\": \"x\", \"value\": 1}]}]")
                    .replace("INDIVIDUAL", "TRUST");

            assertThat(compiler.compile(json).taxpayerType()).isEqualTo("TRUST");

            RuleCompiler strict = new RuleCompiler(tracer, EngineConfig.builder()
                    .validationMode(ValidationMode.STRICT).build());
            assertThatThrownBy(() -> strict.compile(json))
                    .isInstanceOf(RuleValidationException.class)
                    .hasMessageContaining("Unknown taxpayer type: TRUST");
        }

        @Test
        @DisplayName("Should require effective_from before effective_to")
        void shouldCheckEffectiveDates() {
            String json = withFlow("[{\"name\": \"s\", \"operations\": [{\"type\": \"set\", \"target\": \"x\", \"value\": 1}]}]")
                    .replace("\"taxpayer_type\"", "\"effective_from\": \"2025-01-01\", \"effective_to\": \"2024-01-01\", \"taxpayer_type\"");

            assertThat(singleError(json).message()).isEqualTo("effective_from must be before effective_to");
        }
    }

    @Nested
    @DisplayName("Flow")
    class Flow {

        @Test
        @DisplayName("Should reject a default case that is not last")
        void shouldRejectMisplacedDefault() {
            ValidationIssue issue = singleError(withFlow("""
                    [ { "name": "allowance",
                        "cases": [
                          { "operations": [ {"type": "set", "target": "allowance", "value": 1} ] },
                          { "when": {"$gross_income": {"gt": 0}},
                            "operations": [ {"type": "set", "target": "allowance", "value": 2} ] }
                        ] } ]
                    """));

            assertThat(issue.message()).isEqualTo("Default case must be the last case in the array");
            assertThat(issue.path()).isEqualTo("/flow/0/cases/0");
        }

        @Test
        @DisplayName("Should reject a step with both operations and cases")
        void shouldRejectMixedStep() {
            ValidationIssue issue = singleError(withFlow("""
                    [ { "name": "mixed",
                        "operations": [ {"type": "set", "target": "x", "value": 1} ],
                        "cases": [ { "operations": [ {"type": "set", "target": "x", "value": 2} ] } ] } ]
                    """));

            assertThat(issue.message()).isEqualTo("Flow step cannot have both operations and cases");
        }

        @Test
        @DisplayName("Should reject unknown operation types and bad targets")
        void shouldRejectBadOperations() {
            assertThatThrownBy(() -> compiler.compile(withFlow("""
                    [ { "name": "calc",
                        "operations": [
                          {"type": "power", "target": "x", "value": 2},
                          {"type": "set", "target": "TaxableIncome", "value": 2}
                        ] } ]
                    """)))
                    .isInstanceOf(RuleValidationException.class)
                    .satisfies(e -> assertThat(((RuleValidationException) e).getIssues())
                            .extracting(ValidationIssue::path)
                            .containsExactly("/flow/0/operations/0/type", "/flow/0/operations/1/target"));
        }

        @Test
        @DisplayName("Should reject a lookup against an undefined table")
        void shouldRejectUndefinedTable() {
            ValidationIssue issue = singleError(withFlow("""
                    [ { "name": "tax",
                        "operations": [ {"type": "lookup", "target": "liability", "table": "state", "value": "$gross_income"} ] } ]
                    """));

            assertThat(issue.message()).isEqualTo("Undefined table: state");
        }

        @Test
        @DisplayName("Should reject value expressions that do not parse")
        void shouldRejectUnparseableExpression() {
            ValidationIssue issue = singleError(withFlow("""
                    [ { "name": "calc",
                        "operations": [ {"type": "set", "target": "x", "value": "sum($a, "} ] } ]
                    """));

            assertThat(issue.path()).isEqualTo("/flow/0/operations/0/value");
            assertThat(issue.message()).startsWith("Invalid expression:");
        }

        @Test
        @DisplayName("Should reject references to undefined constants")
        void shouldRejectUndefinedConstant() {
            ValidationIssue issue = singleError(withFlow("""
                    [ { "name": "calc",
                        "operations": [ {"type": "set", "target": "x", "value": "$$personal_allowance"} ] } ]
                    """));

            assertThat(issue.message()).isEqualTo("Undefined constant: $$personal_allowance");
        }

        @Test
        @DisplayName("Should only warn about unknown functions")
        void shouldWarnAboutUnknownFunction() {
            String json = withFlow("""
                    [ { "name": "calc",
                        "operations": [ {"type": "set", "target": "x", "value": "avg($gross_income, 1)"} ] } ]
                    """);

            assertThat(compiler.compile(json).flow()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Tables and conditions")
    class TablesAndConditions {

        @Test
        @DisplayName("Should reject a bracket whose min is not below its max")
        void shouldRejectInvertedBracket() {
            String json = withFlow("[{\"name\": \"s\", \"operations\": [{\"type\": \"set\", \"target\": \"x\", \"value\": 1}]}]")
                    .replace("{\"min\": 0, \"max\": null, \"rate\": 0.25, \"base_tax\": 0}",
                            "{\"min\": 0, \"max\": 100, \"rate\": 0.1}, {\"min\": 200, \"max\": 150, \"rate\": 0.2}");

            assertThatThrownBy(() -> compiler.compile(json))
                    .isInstanceOf(RuleValidationException.class)
                    .hasMessageContaining("Bracket min (200) must be less than max (150)");
        }

        @Test
        @DisplayName("Should reject unknown comparison operators")
        void shouldRejectUnknownComparisonOperator() {
            ValidationIssue issue = singleError(withFlow("""
                    [ { "name": "c",
                        "cases": [ { "when": {"$gross_income": {"between": 5}},
                                     "operations": [ {"type": "set", "target": "x", "value": 1} ] } ] } ]
                    """));

            assertThat(issue.path()).isEqualTo("/flow/0/cases/0/when/$gross_income/between");
        }

        @Test
        @DisplayName("Should reject an empty logical operator")
        void shouldRejectEmptyAnd() {
            ValidationIssue issue = singleError(withFlow("""
                    [ { "name": "c",
                        "cases": [ { "when": {"and": []},
                                     "operations": [ {"type": "set", "target": "x", "value": 1} ] } ] } ]
                    """));

            assertThat(issue.message()).isEqualTo("AND operator requires an array of conditions");
        }
    }

    @Test
    @DisplayName("QUICK mode should only check the structure")
    void quickModeShouldSkipSemantics() {
        RuleCompiler quick = new RuleCompiler(tracer, EngineConfig.builder()
                .validationMode(ValidationMode.QUICK).build());
        String json = withFlow("[{\"name\": \"s\", \"operations\": [{\"type\": \"set\", \"target\": \"x\", \"value\": 1}]}]")
                .replace("\"PH\"", "\"Philippines\"");

        assertThat(quick.compile(json).jurisdiction()).isEqualTo("Philippines");
    }
}
