package com.formcalc.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class OutputMappingEvaluatorTest {

    private OutputMappingEvaluator outputs;
    private FieldSnapshot snapshot;

    @BeforeEach
    public void setup() {
        outputs = new OutputMappingEvaluator(new FormulaEvaluator(FunctionRegistry.withBuiltins()), new FormulaCache());
        snapshot = FieldSnapshot.of(Map.of("depth", 15.0, "name", "North", "active", true));
    }

    @Test
    public void testFirstSuccessfulMappingWins() {
        Outcome<OutputValue> result = outputs.evaluate("depth", List.of(
                new OutputMapping(OutputTarget.TEXT, "depth"),
                new OutputMapping(OutputTarget.NUMBER, "depth")), snapshot);
        assertEquals(new OutputValue(OutputTarget.TEXT, FormulaValue.of("15.0")), result.getValue());
    }

    @Test
    public void testFallsThroughToLaterMapping() {
        Outcome<OutputValue> result = outputs.evaluate("name", List.of(
                new OutputMapping(OutputTarget.NUMBER, "name"),
                new OutputMapping(OutputTarget.NUMBER, "missing * 2"),
                new OutputMapping(OutputTarget.TEXT, "upper(name)")), snapshot);
        assertTrue(result.isSuccess());
        assertEquals(OutputTarget.TEXT, result.getValue().getTarget());
        assertEquals(FormulaValue.of("NORTH"), result.getValue().getValue());
    }

    @Test
    public void testAllFailuresAreAggregated() {
        Outcome<OutputValue> result = outputs.evaluate("name", List.of(
                new OutputMapping(OutputTarget.NUMBER, "name"),
                new OutputMapping(OutputTarget.TEXT, "1 +"),
                new OutputMapping(OutputTarget.BOOLEAN, "name / 2")), snapshot);

        FormulaError error = result.getError();
        assertEquals(ErrorKind.COERCION, error.getKind());
        assertTrue(error.getMessage().startsWith("All output mappings failed: NUMBER: Cannot convert TEXT to NUMBER; TEXT: "),
                error.getMessage());
        assertEquals(3, error.getCauses().size());
        assertEquals(ErrorKind.COERCION, error.getCauses().get(0).getKind());
        assertEquals(ErrorKind.SYNTAX, error.getCauses().get(1).getKind());
        assertEquals(ErrorKind.TYPE_MISMATCH, error.getCauses().get(2).getKind());
    }

    @Test
    public void testNoMappings() {
        Outcome<OutputValue> result = outputs.evaluate("depth", List.of(), snapshot);
        assertEquals("No output mapping defined for field 'depth'", result.getError().getMessage());
    }

    @Test
    public void testEntityOutputsInDeclarationOrder() {
        EntityDefinition entity = new EntityDefinition("site", snapshot, List.of(
                new FieldDefinition("name", null, List.of(new OutputMapping(OutputTarget.TEXT, "name"))),
                new FieldDefinition("notes", null, List.of()),
                new FieldDefinition("active", null, List.of(new OutputMapping(OutputTarget.BOOLEAN, "active"))),
                new FieldDefinition("depth", null, List.of(new OutputMapping(OutputTarget.NUMBER, "depth")))));

        Map<String, OutputValue> values = outputs.evaluateEntity(entity, snapshot).getValue();
        assertEquals(List.of("name", "active", "depth"), List.copyOf(values.keySet()));
        assertEquals(FormulaValue.TRUE, values.get("active").getValue());
    }

    @Test
    public void testFailingFieldBlocksTheEntity() {
        EntityDefinition entity = new EntityDefinition("site", snapshot, List.of(
                new FieldDefinition("name", null, List.of(new OutputMapping(OutputTarget.TEXT, "name"))),
                new FieldDefinition("active", null, List.of(new OutputMapping(OutputTarget.NUMBER, "active")))));

        Outcome<Map<String, OutputValue>> result = outputs.evaluateEntity(entity, snapshot);
        assertTrue(result.isFailure());
        assertTrue(result.getError().getMessage().startsWith("Output mapping evaluation failed for field 'active'"));
    }

    @Test
    public void testEmptyMappingFormulaIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new OutputMapping(OutputTarget.TEXT, " "));
    }
}
