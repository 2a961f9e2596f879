package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.levy.ruleengine.api.config.EngineConfig;
import com.levy.ruleengine.api.config.ValidationMode;
import com.levy.ruleengine.api.model.Severity;
import com.levy.ruleengine.api.model.ValidationIssue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RuleDocumentValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RuleDocumentValidator validator = new RuleDocumentValidator(
            EngineConfig.builder().validationMode(ValidationMode.WARNING).build());

    private List<ValidationIssue> validate(String json) throws Exception {
        JsonNode tree = mapper.readTree(json);
        return validator.validate(tree);
    }

    private static final String HEADER = """
            "$version": "1.0.0", "name": "r", "jurisdiction": "US", "taxpayer_type": "INDIVIDUAL",
            """;

    private static final String FLOW = """
            "flow": [ { "name": "s", "operations": [ {"type": "set", "target": "x", "value": 1} ] } ]
            """;

    @Test
    @DisplayName("Should accept a document with every optional section")
    void shouldAcceptCompleteDocument() throws Exception {
        List<ValidationIssue> issues = validate("{" + HEADER + """
                "effective_from": "2024-01-01", "effective_to": "2024-12-31",
                "references": ["NIRC Sec. 24"], "author": "BIR", "category": "income",
                "constants": { "filing_day": 15, "threshold": 250000, "vat_registered": false },
                "tables": [ { "name": "graduated", "brackets": [
                  {"min": 0, "max": "$$threshold", "rate": 0, "base_tax": 0},
                  {"min": "$$threshold", "max": "$$MAX_TAXABLE_INCOME", "rate": 0.15, "base_tax": 0}
                ] } ],
                "inputs": {
                  "status": { "type": "string", "enum": ["SINGLE", "MARRIED"] },
                  "spouse_income": { "type": "number", "minimum": 0, "when": {"$status": {"eq": "MARRIED"}} }
                },
                "outputs": { "liability": { "type": "number" } },
                "validate": [ { "when": {"$spouse_income": {"lt": 0}}, "error": "Negative spouse income" } ],
                "filing_schedules": [
                  { "name": "quarterly", "frequency": "quarterly", "filing_day": "$$filing_day",
                    "when": {"$$vat_registered": {"eq": false}},
                    "forms": { "primary": "2551Q", "attachments": ["SAWT"] } }
                ],
                """ + FLOW + "}");

        assertThat(issues).isEmpty();
    }

    @Test
    @DisplayName("Should flag naming and uniqueness problems across variable sections")
    void shouldCheckVariables() throws Exception {
        List<ValidationIssue> issues = validate("{" + HEADER + """
                "constants": { "rate": 0.1, "label": "VAT" },
                "inputs": { "rate": { "type": "number" }, "GrossIncome": { "type": "money" } },
                "outputs": { "due": { "type": "number", "minimum": 10, "maximum": 5, "pattern": "[" } },
                """ + FLOW + "}");

        assertThat(issues).extracting(ValidationIssue::path, ValidationIssue::message).containsExactly(
                tuple("/constants/label", "Constant label must be a number or boolean"),
                tuple("/inputs/rate", "Input 'rate' is already defined"),
                tuple("/inputs/GrossIncome", "Invalid input identifier: GrossIncome"),
                tuple("/inputs/GrossIncome/type", "Invalid type: \"money\""),
                tuple("/outputs/due/minimum", "Minimum must be less than maximum"),
                tuple("/outputs/due/pattern", "Invalid regular expression pattern: ["));
    }

    @Test
    @DisplayName("Should warn about bracket gaps and unusual rates")
    void shouldWarnAboutTables() throws Exception {
        List<ValidationIssue> issues = validate("{" + HEADER + """
                "tables": [ { "name": "t", "brackets": [
                  {"min": 100, "max": 200, "rate": 1.5},
                  {"min": 300, "max": null, "rate": 0.2}
                ] } ],
                """ + FLOW + "}");

        assertThat(issues).allMatch(issue -> issue.severity() == Severity.WARNING);
        assertThat(issues).extracting(ValidationIssue::message).containsExactly(
                "Tax rate greater than 100%: 1.5",
                "First bracket should start at 0, found: 100",
                "Gap or overlap between brackets: 200 to 300");
        assertThat(validator.refuses(issues)).isFalse();
    }

    @Test
    @DisplayName("Should check validation rules and filing schedules")
    void shouldCheckValidationRulesAndSchedules() throws Exception {
        List<ValidationIssue> issues = validate("{" + HEADER + """
                "validate": [ { "error": "" } ],
                "filing_schedules": [
                  { "name": "", "frequency": "weekly", "filing_day": 40, "forms": {} },
                  { "name": "annual", "frequency": "annual", "filing_day": "$$due", "forms": { "primary": "1700" } }
                ],
                """ + FLOW + "}");

        assertThat(issues).extracting(ValidationIssue::path).containsExactly(
                "/validate/0/when",
                "/validate/0/error",
                "/filing_schedules/0/name",
                "/filing_schedules/0/frequency",
                "/filing_schedules/0/filing_day",
                "/filing_schedules/0/forms/primary",
                "/filing_schedules/1/filing_day");
    }

    @Test
    @DisplayName("STRICT mode should refuse warnings")
    void strictModeShouldRefuseWarnings() {
        RuleDocumentValidator strict = new RuleDocumentValidator(
                EngineConfig.builder().validationMode(ValidationMode.STRICT).build());
        List<ValidationIssue> warnings = List.of(ValidationIssue.warning("/taxpayer_type", "Unknown taxpayer type"));

        assertThat(strict.refuses(warnings)).isTrue();
        assertThat(validator.refuses(warnings)).isFalse();
        assertThat(strict.refuses(List.of())).isFalse();
    }
}
