package com.formcalc.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaEvaluatorTest {

    private FormulaEvaluator evaluator;
    private Map<String, Object> values;

    @BeforeEach
    public void setup() {
        evaluator = new FormulaEvaluator(FunctionRegistry.withBuiltins());
        values = new HashMap<>();
        values.put("a", 1);
        values.put("b", 2);
        values.put("c", 3);
        values.put("depth_from", 5.0);
        values.put("depth_to", 10.0);
        values.put("name", "Borehole");
        values.put("empty", "");
        values.put("flag", true);
        values.put("nothing", null);
        values.put("big", 9007199254740993L);
        values.put("bmp_last", "\uFFFF");
        values.put("emoji", "\uD83D\uDE00");
    }

    private Outcome<FormulaValue> eval(String text) {
        return evaluator.evaluate(FormulaParser.parse(text), FieldSnapshot.of(values));
    }

    private FormulaValue value(String text) {
        Outcome<FormulaValue> result = eval(text);
        assertTrue(result.isSuccess(), () -> text + " failed: " + result.getError());
        return result.getValue();
    }

    private FormulaError error(String text) {
        Outcome<FormulaValue> result = eval(text);
        assertTrue(result.isFailure(), () -> text + " should fail but gave " + result.getValue());
        return result.getError();
    }

    @Test
    public void testArithmetic() {
        assertEquals(FormulaValue.of(7L), value("1 + 2 * 3"));
        assertEquals(FormulaValue.of(9L), value("(1 + 2) * 3"));
        assertEquals(FormulaValue.of(512L), value("2 ** 3 ** 2"));
        assertEquals(FormulaValue.of(15.0), value("depth_from + depth_to"));
        assertEquals(FormulaValue.of(2.5), value("5 / 2"));
        assertEquals(FormulaValue.of(-3L), value("-c"));
        assertEquals(FormulaValue.of(0.5), value("2 ** -1"));
    }

    @Test
    public void testDivisionAlwaysYieldsDecimal() {
        FormulaValue result = value("4 / 2");
        assertEquals(2.0, result.asNumber());
        assertFalse(result.isIntegral());
        assertEquals("2.0", result.render());
    }

    @Test
    public void testModuloFollowsTheSignOfTheDivisor() {
        assertEquals(FormulaValue.of(2L), value("-7 % 3"));
        assertEquals(FormulaValue.of(-2L), value("7 % -3"));
        assertEquals(FormulaValue.of(1.5), value("7.5 % 3"));
    }

    @Test
    public void testDivisionByZero() {
        FormulaError e = error("a / 0");
        assertEquals(ErrorKind.DIVISION_BY_ZERO, e.getKind());
        assertEquals(ErrorKind.DIVISION_BY_ZERO, error("a % 0").getKind());
        assertEquals(ErrorKind.DIVISION_BY_ZERO, error("0 ** -1").getKind());
    }

    @Test
    public void testUndefinedFieldIsNotNull() {
        FormulaError e = error("missing + 1");
        assertEquals(ErrorKind.UNDEFINED_FIELD, e.getKind());
        assertEquals(List.of("missing"), e.getFields());
        assertEquals("Undefined field 'missing'", e.getMessage());

        assertEquals(FormulaValue.NULL, value("nothing"));
    }

    @Test
    public void testOrShortCircuitsAndReturnsDecidingOperand() {
        values.remove("b");
        values.put("a", 7);
        assertEquals(FormulaValue.of(7L), value("a or b"));
        assertEquals(ErrorKind.UNDEFINED_FIELD, error("empty or b").getKind());
        assertEquals(FormulaValue.of("fallback"), value("empty or 'fallback'"));
    }

    @Test
    public void testAndShortCircuitsAndReturnsDecidingOperand() {
        values.remove("b");
        assertEquals(FormulaValue.of(""), value("empty and b"));
        assertEquals(FormulaValue.NULL, value("nothing and b"));
        assertEquals(FormulaValue.of("Borehole"), value("flag and name"));
    }

    @Test
    public void testNotUsesTruthiness() {
        assertEquals(FormulaValue.TRUE, value("not 0"));
        assertEquals(FormulaValue.TRUE, value("not empty"));
        assertEquals(FormulaValue.TRUE, value("not nothing"));
        assertEquals(FormulaValue.FALSE, value("not name"));
        assertEquals(FormulaValue.FALSE, value("not 0.5"));
    }

    @Test
    public void testEqualityAcrossTypes() {
        assertEquals(FormulaValue.FALSE, value("1 == '1'"));
        assertEquals(FormulaValue.TRUE, value("1 != '1'"));
        assertEquals(FormulaValue.TRUE, value("1 == 1.0"));
        assertEquals(FormulaValue.FALSE, value("true == 1"));
        assertEquals(FormulaValue.TRUE, value("nothing == null"));
    }

    @Test
    public void testOrderingComparisons() {
        assertEquals(FormulaValue.TRUE, value("a < b"));
        assertEquals(FormulaValue.TRUE, value("depth_to >= 10"));
        assertEquals(FormulaValue.TRUE, value("'apple' < 'banana'"));
        assertEquals(FormulaValue.FALSE, value("c <= 2"));
    }

    @Test
    public void testTypeMismatch() {
        FormulaError e = error("name + 1");
        assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
        assertEquals("Operator '+' cannot be applied to TEXT and NUMBER", e.getMessage());

        assertEquals(ErrorKind.TYPE_MISMATCH, error("name < 3").getKind());
        assertEquals(ErrorKind.TYPE_MISMATCH, error("-name").getKind());
        assertEquals(ErrorKind.TYPE_MISMATCH, error("flag * 2").getKind());
        assertEquals(ErrorKind.TYPE_MISMATCH, error("nothing + 1").getKind());
    }

    @Test
    public void testNonFiniteResult() {
        assertEquals(ErrorKind.ARITHMETIC, error("10.0 ** 400").getKind());
    }

    @Test
    public void testFunctionCalls() {
        assertEquals(FormulaValue.of(1L), value("min(a, b, c)"));
        assertEquals(FormulaValue.of(5L), value("ABS(-5)"));
        assertEquals(FormulaValue.of("BOREHOLE"), value("upper(name)"));
    }

    @Test
    public void testUnknownFunction() {
        FormulaError e = error("frobnicate(a)");
        assertEquals(ErrorKind.UNKNOWN_FUNCTION, e.getKind());
        assertEquals("Unknown function 'frobnicate'", e.getMessage());
    }

    @Test
    public void testArgumentErrorsAbortTheFormula() {
        assertEquals(ErrorKind.UNDEFINED_FIELD, error("abs(missing)").getKind());
        assertEquals(ErrorKind.FUNCTION_ARGUMENT, error("1 + abs(name)").getKind());
    }

    @Test
    public void testIntegersKeepFullPrecision() {
        assertEquals("9007199254740993", value("9007199254740993").render());
        assertEquals(FormulaValue.of(1L), value("9007199254740993 - 9007199254740992"));
        assertEquals(FormulaValue.of(9223372030926249001L), value("3037000499 * 3037000499"));
        assertEquals(FormulaValue.of(9007199254740993L), value("big + 0"));
        assertEquals(FormulaValue.FALSE, value("big == 9007199254740992"));
        assertEquals(FormulaValue.TRUE, value("big > 9007199254740992"));
    }

    @Test
    public void testIntegerOverflowFallsBackToDecimal() {
        FormulaValue sum = value("9223372036854775807 + 1");
        assertFalse(sum.isIntegral());
        assertEquals(9.223372036854775807e18, sum.asNumber());

        FormulaValue smallest = value("-9223372036854775807 - 1");
        assertEquals(FormulaValue.of(Long.MIN_VALUE), smallest);
        assertFalse(value("-(-9223372036854775807 - 1)").isIntegral());
    }

    @Test
    public void testTextOrdersByCodePoint() {
        assertEquals(FormulaValue.TRUE, value("bmp_last < emoji"));
        assertEquals(FormulaValue.FALSE, value("emoji <= bmp_last"));
        assertEquals(FormulaValue.of("\uD83D\uDE00"), value("max(bmp_last, emoji)"));
        assertEquals(FormulaValue.TRUE, value("'ab' < 'abc'"));
    }
}
