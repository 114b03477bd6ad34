package com.formcalc.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinFunctionsTest {

    private FunctionRegistry registry;
    private FormulaEvaluator evaluator;
    private FieldSnapshot snapshot;

    @BeforeEach
    public void setup() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC);
        registry = FunctionRegistry.withBuiltins(clock);
        evaluator = new FormulaEvaluator(registry);

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("a", 3);
        values.put("b", 1);
        values.put("c", 2);
        values.put("label", "  Site A ");
        values.put("missing_value", null);
        snapshot = FieldSnapshot.of(values);
    }

    private Outcome<FormulaValue> eval(String text) {
        return evaluator.evaluate(FormulaParser.parse(text), snapshot);
    }

    private FormulaValue value(String text) {
        Outcome<FormulaValue> result = eval(text);
        assertTrue(result.isSuccess(), () -> text + " failed: " + result.getError());
        return result.getValue();
    }

    private FormulaError error(String text) {
        Outcome<FormulaValue> result = eval(text);
        assertTrue(result.isFailure(), () -> text + " should fail");
        return result.getError();
    }

    @Test
    public void testAbs() {
        FormulaValue result = value("abs(-5)");
        assertEquals(FormulaValue.of(5L), result);
        assertEquals("5", result.render());
        assertEquals(FormulaValue.of(2.5), value("abs(-2.5)"));
        assertEquals(FormulaValue.NULL, value("abs(missing_value)"));
    }

    @Test
    public void testMinAndMax() {
        assertEquals(FormulaValue.of(1L), value("min(a, b, c)"));
        assertEquals(FormulaValue.of(3L), value("max(a, b, c)"));
        assertEquals(FormulaValue.of(1L), value("min(missing_value, b)"));
        assertEquals(FormulaValue.NULL, value("max(missing_value)"));
        assertEquals(FormulaValue.of("apple"), value("min('pear', 'apple')"));
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, error("max(1, 'a')").getKind());
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, error("min()").getKind());
    }

    @Test
    public void testRoundIsHalfEven() {
        assertEquals(FormulaValue.of(2L), value("round(2.5)"));
        assertEquals(FormulaValue.of(4L), value("round(3.5)"));
        assertEquals(FormulaValue.of(3.14), value("round(3.14159, 2)"));
        // 2.675 is stored just below the midpoint
        assertEquals(FormulaValue.of(2.67), value("round(2.675, 2)"));
        assertEquals(FormulaValue.of(7L), value("round(7, 1)"));
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, error("round(1.5, 0.5)").getKind());
    }

    @Test
    public void testRoundBeyondLongRange() {
        FormulaValue big = value("round(100000000000000000000.0)");
        assertFalse(big.isIntegral());
        assertEquals(1.0e20, big.asNumber());

        FormulaValue positive = value("round(12345678901234567890.5)");
        assertTrue(positive.asNumber() > 0);
        assertEquals(FormulaValue.of(-1.0e19), value("round(-10000000000000000000.0)"));
        assertEquals(FormulaValue.of(9223372036854775807L), value("round(9223372036854775807)"));
    }

    @Test
    public void testRoundDigitsRange() {
        assertEquals(FormulaValue.of(1200L), value("round(1234, -2)"));
        assertEquals(FormulaValue.of(1.5), value("round(1.5, 340)"));
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, error("round(1.5, 99999999)").getKind());
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, error("round(1.5, -341)").getKind());
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, error("round(1.5, 4294967296)").getKind());
    }

    @Test
    public void testSumAndPow() {
        assertEquals(FormulaValue.of(6L), value("sum(a, b, c, missing_value)"));
        assertEquals(FormulaValue.of(0L), value("sum()"));
        assertEquals(FormulaValue.of(8L), value("pow(2, 3)"));
        assertEquals(FormulaValue.of(8L), value("POWER(2, 3)"));
        assertEquals(ErrorKind.DIVISION_BY_ZERO, error("pow(0, -2)").getKind());
    }

    @Test
    public void testPowStaysExactInLongRange() {
        assertEquals(FormulaValue.of(1L << 62), value("pow(2, 62)"));
        assertEquals(FormulaValue.of(-9223372036854775807L - 1), value("pow(-2, 63)"));
        FormulaValue overflow = value("pow(2, 64)");
        assertFalse(overflow.isIntegral());
        assertEquals(Math.pow(2, 64), overflow.asNumber());
    }

    @Test
    public void testTextFunctions() {
        assertEquals(FormulaValue.of("SITE A"), value("upper(strip(label))"));
        assertEquals(FormulaValue.of("site a"), value("toLower(trim(label))"));
        assertEquals(FormulaValue.NULL, value("upper(missing_value)"));
        assertEquals(FormulaValue.of("3"), value("strip(a)"));
        assertEquals(FormulaValue.of("a=3, x=2.5"), value("concat('a=', a, ', x=', 2.5, missing_value)"));
        assertEquals(FormulaValue.of(9L), value("len(label)"));
        assertEquals(FormulaValue.of(0L), value("length(missing_value)"));
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, error("len(a)").getKind());
    }

    @Test
    public void testLogicalFunctions() {
        assertEquals(FormulaValue.of("big"), value("if_else(a > 2, 'big', 'small')"));
        assertEquals(FormulaValue.of("small"), value("if(b > 2, 'big', 'small')"));
        assertEquals(FormulaValue.TRUE, value("is_empty(missing_value)"));
        assertEquals(FormulaValue.TRUE, value("isEmpty('   ')"));
        assertEquals(FormulaValue.FALSE, value("is_empty(0)"));
        assertEquals(FormulaValue.of(3L), value("coalesce(missing_value, a, b)"));
        assertEquals(FormulaValue.NULL, value("coalesce()"));
    }

    @Test
    public void testEagerArgumentsMakeIfElseFailOnEitherBranch() {
        assertEquals(ErrorKind.DIVISION_BY_ZERO, error("if_else(true, 1, 1 / 0)").getKind());
    }

    @Test
    public void testNowAndTodayReadTheClock() {
        assertEquals(FormulaValue.of("2024-03-15T10:30"), value("now()"));
        assertEquals(FormulaValue.of("2024-03-15"), value("today()"));
    }

    @Test
    public void testArity() {
        FormulaError e = error("abs(1, 2)");
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, e.getKind());
        assertEquals("abs(): expects 1 argument(s), got 2", e.getMessage());
        assertEquals("round(): expects at most 2 argument(s), got 3", error("round(1, 2, 3)").getMessage());
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, error("now(1)").getKind());
    }

    @Test
    public void testCustomFunctionsAndAliases() {
        registry.register("double_it",
                new BaseFunction("double_it", ResultType.NUMBER, 1, 1,
                        args -> FormulaValue.of(args.get(0).asNumber() * 2)), "twice");
        assertEquals(FormulaValue.of(6.0), value("TWICE(a)"));
        assertTrue(registry.contains("Double_It"));
        assertFalse(registry.names().contains("twice"));
    }

    @Test
    public void testRegisteredNames() {
        assertEquals(List.of("abs", "coalesce", "concat", "if_else", "is_empty", "len", "lower", "max", "min",
                "now", "pow", "round", "strip", "sum", "today", "upper"), List.copyOf(registry.names()));
    }
}
