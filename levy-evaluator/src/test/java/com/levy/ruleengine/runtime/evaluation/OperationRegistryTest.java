package com.levy.ruleengine.runtime.evaluation;

import com.levy.ruleengine.api.exceptions.DivisionByZeroException;
import com.levy.ruleengine.api.exceptions.OperationTypeException;
import com.levy.ruleengine.api.exceptions.TableLookupException;
import com.levy.ruleengine.api.model.Operation;
import com.levy.ruleengine.api.model.OperationType;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.runtime.context.EvaluationContext;
import com.levy.ruleengine.runtime.table.BracketTable;
import com.levy.ruleengine.runtime.table.TaxBracket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationRegistryTest {

    private OperationRegistry registry;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        registry = new OperationRegistry(new ExpressionEvaluator());
        context = new EvaluationContext(
                Map.of("income", Value.of(500_000), "status", Value.of("SINGLE")),
                Map.of("exemption", Value.of(250_000)),
                Map.of("total", Value.of(10)),
                Map.of("progressive", new BracketTable("progressive", List.of(
                                new TaxBracket(0, 250_000d, 0, 0),
                                new TaxBracket(250_000, 400_000d, 0.20, 0),
                                new TaxBracket(400_000, null, 0.25, 30_000))),
                        "gapped", new BracketTable("gapped", List.of(
                                new TaxBracket(0, 100d, 0.1, 0),
                                new TaxBracket(200, null, 0.2, 10)))));
    }

    private Value valueOf(EvaluationContext ctx, String name) {
        return ctx.calculated().get(name);
    }

    @Test
    @DisplayName("set should write any scalar")
    void set() {
        EvaluationContext next = registry.apply(Operation.of(OperationType.SET, "label", "$status"), context);
        next = registry.apply(Operation.of(OperationType.SET, "flag", true), next);
        next = registry.apply(Operation.of(OperationType.SET, "base", "diff($income, $$exemption)"), next);

        assertThat(valueOf(next, "label")).isEqualTo(Value.of("SINGLE"));
        assertThat(valueOf(next, "flag")).isEqualTo(Value.of(true));
        assertThat(valueOf(next, "base")).isEqualTo(Value.of(250_000));
    }

    @Test
    @DisplayName("arithmetic operations should combine the target with the value")
    void arithmetic() {
        EvaluationContext next = registry.apply(Operation.of(OperationType.ADD, "total", 5), context);
        assertThat(valueOf(next, "total")).isEqualTo(Value.of(15));

        next = registry.apply(Operation.of(OperationType.SUBTRACT, "total", 3), next);
        assertThat(valueOf(next, "total")).isEqualTo(Value.of(12));

        next = registry.apply(Operation.of(OperationType.MULTIPLY, "total", 0.5), next);
        assertThat(valueOf(next, "total")).isEqualTo(Value.of(6));

        next = registry.apply(Operation.of(OperationType.DIVIDE, "total", 4), next);
        assertThat(valueOf(next, "total")).isEqualTo(Value.of(1.5));
    }

    @Test
    @DisplayName("min and max should clamp the target")
    void clamp() {
        assertThat(valueOf(registry.apply(Operation.of(OperationType.MAX, "total", 0), context), "total"))
                .isEqualTo(Value.of(10));
        assertThat(valueOf(registry.apply(Operation.of(OperationType.MAX, "total", 20), context), "total"))
                .isEqualTo(Value.of(20));
        assertThat(valueOf(registry.apply(Operation.of(OperationType.MIN, "total", 3), context), "total"))
                .isEqualTo(Value.of(3));
    }

    @Test
    @DisplayName("liability should accumulate from its built-in default of 0")
    void liabilityStartsAtZero() {
        EvaluationContext next = registry.apply(Operation.of(OperationType.ADD, "liability", 100), context);
        assertThat(valueOf(next, "liability")).isEqualTo(Value.of(100));
    }

    @Test
    @DisplayName("divide by zero should fail and leave the context unchanged")
    void divideByZero() {
        Operation divide = Operation.of(OperationType.DIVIDE, "total", 0);

        assertThatThrownBy(() -> registry.apply(divide, context))
                .isInstanceOf(DivisionByZeroException.class);
        assertThat(valueOf(context, "total")).isEqualTo(Value.of(10));
    }

    @Test
    @DisplayName("arithmetic should reject non-numbers and unset targets")
    void arithmeticTypeErrors() {
        assertThatThrownBy(() -> registry.apply(Operation.of(OperationType.ADD, "total", "$status"), context))
                .isInstanceOf(OperationTypeException.class)
                .hasMessageContaining("requires a number");
        assertThatThrownBy(() -> registry.apply(Operation.of(OperationType.ADD, "unset", 1), context))
                .isInstanceOf(OperationTypeException.class)
                .hasMessageContaining("has no value yet");

        EvaluationContext withString = context.withCalculated("total", Value.of("x"));
        assertThatThrownBy(() -> registry.apply(Operation.of(OperationType.MULTIPLY, "total", 2), withString))
                .isInstanceOf(OperationTypeException.class);
    }

    @Test
    @DisplayName("lookup should compute progressive tax")
    void lookup() {
        EvaluationContext next = registry.apply(Operation.lookup("tax", "progressive", "$income"), context);
        assertThat(valueOf(next, "tax")).isEqualTo(Value.of(55_000));

        next = registry.apply(Operation.lookup("tax", "progressive", 250_000), context);
        assertThat(valueOf(next, "tax")).isEqualTo(Value.of(0));
    }

    @Test
    @DisplayName("lookup should fail on a gap, a value below the floor or a missing table")
    void lookupErrors() {
        assertThatThrownBy(() -> registry.apply(Operation.lookup("tax", "gapped", 150), context))
                .isInstanceOf(TableLookupException.class)
                .hasMessageContaining("No bracket");
        assertThatThrownBy(() -> registry.apply(Operation.lookup("tax", "progressive", -1), context))
                .isInstanceOf(TableLookupException.class);
        assertThatThrownBy(() -> registry.apply(Operation.lookup("tax", "state", 1), context))
                .isInstanceOf(TableLookupException.class)
                .hasMessageContaining("Table 'state' not found");
        assertThatThrownBy(() -> registry.apply(Operation.lookup("tax", "progressive", "$status"), context))
                .isInstanceOf(OperationTypeException.class);
    }
}
