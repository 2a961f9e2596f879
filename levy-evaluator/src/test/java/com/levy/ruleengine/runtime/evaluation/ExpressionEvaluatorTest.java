package com.levy.ruleengine.runtime.evaluation;

import com.levy.ruleengine.api.exceptions.ArgumentMismatchException;
import com.levy.ruleengine.api.exceptions.EvaluationDepthException;
import com.levy.ruleengine.api.exceptions.ExpressionParseException;
import com.levy.ruleengine.api.exceptions.NonScalarReturnException;
import com.levy.ruleengine.api.exceptions.ReferenceDomain;
import com.levy.ruleengine.api.exceptions.SymbolConflictException;
import com.levy.ruleengine.api.exceptions.TableLookupException;
import com.levy.ruleengine.api.exceptions.UnknownFunctionException;
import com.levy.ruleengine.api.exceptions.UnresolvedReferenceException;
import com.levy.ruleengine.api.exceptions.WrongKindUsageException;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.api.model.ValueType;
import com.levy.ruleengine.runtime.context.EvaluationContext;
import com.levy.ruleengine.runtime.function.BuiltinFunction;
import com.levy.ruleengine.runtime.function.BuiltinLibrary;
import com.levy.ruleengine.runtime.function.FunctionSignature;
import com.levy.ruleengine.runtime.table.BracketTable;
import com.levy.ruleengine.runtime.table.TaxBracket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionEvaluatorTest {

    private ExpressionEvaluator evaluator;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator();
        context = new EvaluationContext(
                Map.of("income", Value.of(80_000), "status", Value.of("MARRIED"), "x", Value.of(1)),
                Map.of("rate", Value.of(0.2), "x", Value.of(2)),
                Map.of("taxable", Value.of(55_000), "x", Value.of(3)),
                Map.of("federal", new BracketTable("federal", List.of(
                        new TaxBracket(0, 250_000d, 0, 0),
                        new TaxBracket(250_000, 400_000d, 0.20, 0),
                        new TaxBracket(400_000, null, 0.25, 30_000)))));
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("Should keep the three reference domains isolated")
        void shouldIsolateDomains() {
            assertThat(evaluator.evaluate("$x", context)).isEqualTo(Value.of(1));
            assertThat(evaluator.evaluate("$$x", context)).isEqualTo(Value.of(2));
            assertThat(evaluator.evaluate("x", context)).isEqualTo(Value.of(3));
        }

        @Test
        @DisplayName("Should fall back to built-in constants and variables")
        void shouldFallBackToBuiltins() {
            assertThat(evaluator.evaluate("$$MAX_TAXABLE_INCOME", context))
                    .isEqualTo(Value.of(9_007_199_254_740_991d));
            assertThat(evaluator.evaluate("liability", context)).isEqualTo(Value.of(0));
        }

        @Test
        @DisplayName("Should let rule constants shadow built-in constants")
        void shouldShadowBuiltinConstant() {
            EvaluationContext shadowed = EvaluationContext.of(Map.of(), Map.of("MAX_TAXABLE_INCOME", Value.of(10)));
            assertThat(evaluator.evaluate("$$MAX_TAXABLE_INCOME", shadowed)).isEqualTo(Value.of(10));
            assertThat(evaluator.evaluate("$$MAX_TAXABLE_INCOME", EvaluationContext.empty()))
                    .isEqualTo(Value.of(BuiltinLibrary.MAX_TAXABLE_INCOME_VALUE));
        }

        @Test
        @DisplayName("Should never look for an input among calculated variables")
        void shouldNotCrossDomains() {
            assertThatThrownBy(() -> evaluator.evaluate("$taxable", context))
                    .isInstanceOfSatisfying(UnresolvedReferenceException.class,
                            e -> assertThat(e.getDomain()).isEqualTo(ReferenceDomain.INPUT))
                    .hasMessageContaining("Input variable 'taxable' not found");
            assertThatThrownBy(() -> evaluator.evaluate("income", context))
                    .isInstanceOfSatisfying(UnresolvedReferenceException.class,
                            e -> assertThat(e.getDomain()).isEqualTo(ReferenceDomain.CALCULATED));
            assertThatThrownBy(() -> evaluator.evaluate("$$missing", context))
                    .isInstanceOfSatisfying(UnresolvedReferenceException.class,
                            e -> assertThat(e.getDomain()).isEqualTo(ReferenceDomain.CONSTANT));
        }

        @Test
        @DisplayName("Should reject a function used as a variable")
        void shouldRejectFunctionAsVariable() {
            assertThatThrownBy(() -> evaluator.evaluate("sum", context))
                    .isInstanceOf(WrongKindUsageException.class);
        }

        @Test
        @DisplayName("Should reject calling a variable")
        void shouldRejectCallingVariable() {
            assertThatThrownBy(() -> evaluator.evaluate("taxable(1)", context))
                    .isInstanceOf(WrongKindUsageException.class);
        }

        @Test
        @DisplayName("Should reject context names that collide with built-in functions")
        void shouldRejectCollidingContextNames() {
            EvaluationContext colliding = EvaluationContext.of(Map.of("max", Value.of(1)), Map.of());
            assertThatThrownBy(() -> evaluator.evaluate("1", colliding))
                    .isInstanceOf(SymbolConflictException.class);
        }

        @Test
        @DisplayName("Should not leak symbols between evaluations")
        void shouldRebuildSymbolsPerCall() {
            evaluator.evaluate("$income", context);
            assertThat(evaluator.symbolRegistry().getSymbol("income")).isPresent();

            evaluator.evaluate("1", EvaluationContext.empty());
            assertThat(evaluator.symbolRegistry().getSymbol("income")).isEmpty();
        }

        @Test
        @DisplayName("Should propagate parse errors")
        void shouldPropagateParseErrors() {
            assertThatThrownBy(() -> evaluator.evaluate("max(", context))
                    .isInstanceOf(ExpressionParseException.class);
        }
    }

    @Nested
    @DisplayName("Built-in functions")
    class Functions {

        @Test
        @DisplayName("diff should return the absolute difference")
        void diff() {
            assertThat(evaluator.evaluate("diff(100, 250)", context)).isEqualTo(Value.of(150));
            assertThat(evaluator.evaluate("diff($income, taxable)", context)).isEqualTo(Value.of(25_000));
        }

        @Test
        @DisplayName("sum, max and min should be variadic and return 0 when empty")
        void variadic() {
            assertThat(evaluator.evaluate("sum(1, 2, 3.5)", context)).isEqualTo(Value.of(6.5));
            assertThat(evaluator.evaluate("max(0, -5, 12)", context)).isEqualTo(Value.of(12));
            assertThat(evaluator.evaluate("min(4, -5, 12)", context)).isEqualTo(Value.of(-5));
            assertThat(evaluator.evaluate("sum()", context)).isEqualTo(Value.of(0));
            assertThat(evaluator.evaluate("max()", context)).isEqualTo(Value.of(0));
            assertThat(evaluator.evaluate("min()", context)).isEqualTo(Value.of(0));
        }

        @Test
        @DisplayName("round should support default, positive and negative decimals")
        void round() {
            assertThat(evaluator.evaluate("round(2.5)", context)).isEqualTo(Value.of(3));
            assertThat(evaluator.evaluate("round(1234.5678, 2)", context)).isEqualTo(Value.of(1234.57));
            assertThat(evaluator.evaluate("round(1250, -2)", context)).isEqualTo(Value.of(1300));
            assertThat(evaluator.evaluate("round(-2.5)", context)).isEqualTo(Value.of(-2));
        }

        @Test
        @DisplayName("round should reject fractional decimals")
        void roundRejectsFractionalDecimals() {
            assertThatThrownBy(() -> evaluator.evaluate("round(1, 0.5)", context))
                    .isInstanceOf(ArgumentMismatchException.class);
        }

        @Test
        @DisplayName("lookup should apply the bracket formula")
        void lookup() {
            assertThat(evaluator.evaluate("lookup('federal', 500000)", context)).isEqualTo(Value.of(55_000));
            assertThat(evaluator.evaluate("lookup('federal', 300000)", context)).isEqualTo(Value.of(10_000));
        }

        @Test
        @DisplayName("lookup should fail on an unknown table")
        void lookupUnknownTable() {
            assertThatThrownBy(() -> evaluator.evaluate("lookup('state', 10)", context))
                    .isInstanceOf(TableLookupException.class)
                    .hasMessageContaining("Table 'state' not found");
        }

        @Test
        @DisplayName("Should reject unknown functions")
        void unknownFunction() {
            assertThatThrownBy(() -> evaluator.evaluate("avg(1, 2)", context))
                    .isInstanceOf(UnknownFunctionException.class)
                    .hasMessageContaining("Unknown function 'avg'");
        }

        @Test
        @DisplayName("Should check arity and argument types")
        void arityAndTypes() {
            assertThatThrownBy(() -> evaluator.evaluate("diff(1)", context))
                    .isInstanceOf(ArgumentMismatchException.class)
                    .hasMessageContaining("expects 2 argument(s) but got 1");
            assertThatThrownBy(() -> evaluator.evaluate("round(1, 2, 3)", context))
                    .isInstanceOf(ArgumentMismatchException.class)
                    .hasMessageContaining("expects 1 to 2 argument(s)");
            assertThatThrownBy(() -> evaluator.evaluate("sum(1, true)", context))
                    .isInstanceOf(ArgumentMismatchException.class);
            assertThatThrownBy(() -> evaluator.evaluate("max(1, $status)", context))
                    .isInstanceOf(ArgumentMismatchException.class);
            assertThatThrownBy(() -> evaluator.evaluate("lookup(1, 2)", context))
                    .isInstanceOf(ArgumentMismatchException.class);
        }

        @Test
        @DisplayName("Should evaluate arguments before checking the signature")
        void argumentsFirst() {
            assertThatThrownBy(() -> evaluator.evaluate("diff(1, $missing, 3)", context))
                    .isInstanceOf(UnresolvedReferenceException.class);
        }
    }

    @Nested
    @DisplayName("Custom library")
    class CustomLibrary {

        @Test
        @DisplayName("Should call a registered custom function")
        void customFunction() {
            BuiltinLibrary library = BuiltinLibrary.builder()
                    .function(BuiltinFunction.of("half",
                            FunctionSignature.fixed(FunctionSignature.required("value", ValueType.NUMBER)),
                            (args, ctx) -> Value.of(((Value.NumberValue) args.get(0)).value() / 2)))
                    .build();
            ExpressionEvaluator custom = new ExpressionEvaluator(library, 64);

            assertThat(custom.evaluate("half($income)", context)).isEqualTo(Value.of(40_000));
        }

        @Test
        @DisplayName("Should report a function that returns nothing")
        void nonScalarReturn() {
            BuiltinLibrary library = BuiltinLibrary.builder()
                    .function(BuiltinFunction.of("broken", FunctionSignature.variadic(ValueType.NUMBER),
                            (args, ctx) -> null))
                    .build();
            ExpressionEvaluator custom = new ExpressionEvaluator(library, 64);

            assertThatThrownBy(() -> custom.evaluate("broken()", context))
                    .isInstanceOf(NonScalarReturnException.class);
        }

        @Test
        @DisplayName("Should refuse to replace a standard function")
        void cannotReplaceStandard() {
            assertThatThrownBy(() -> BuiltinLibrary.builder()
                    .function(BuiltinFunction.of("sum", FunctionSignature.variadic(ValueType.NUMBER),
                            (args, ctx) -> Value.of(0))))
                    .isInstanceOf(SymbolConflictException.class);
        }

        @Test
        @DisplayName("Should stop at the configured call depth")
        void depthGuard() {
            ExpressionEvaluator shallow = new ExpressionEvaluator(BuiltinLibrary.standard(), 2);

            assertThat(shallow.evaluate("sum(sum(1))", context)).isEqualTo(Value.of(1));
            assertThatThrownBy(() -> shallow.evaluate(
                    new com.levy.ruleengine.runtime.expression.ExpressionParser(10).parse("sum(sum(sum(1)))"),
                    context))
                    .isInstanceOf(EvaluationDepthException.class);
        }
    }
}
