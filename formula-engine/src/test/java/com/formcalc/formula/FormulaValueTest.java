package com.formcalc.formula;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaValueTest {

    @Test
    public void testFromJavaValues() {
        assertEquals(FormulaValue.of(3L), FormulaValue.from(3));
        assertEquals(FormulaValue.of(3.0), FormulaValue.from(3.0f));
        assertEquals(FormulaValue.of(1.5), FormulaValue.from(new BigDecimal("1.5")));
        assertEquals(FormulaValue.NULL, FormulaValue.from(null));
        assertEquals(FormulaValue.of("x"), FormulaValue.from("x"));
        assertThrows(IllegalArgumentException.class, () -> FormulaValue.from(new Object()));
    }

    @Test
    public void testRendering() {
        assertEquals("15.0", FormulaValue.of(15.0).render());
        assertEquals("5", FormulaValue.of(5L).render());
        assertEquals("", FormulaValue.NULL.render());
        assertEquals("false", FormulaValue.FALSE.render());
    }

    @Test
    public void testLanguageEqualityIgnoresIntegralFlag() {
        assertTrue(FormulaValue.of(2L).sameAs(FormulaValue.of(2.0)));
        assertNotEquals(FormulaValue.of(2L), FormulaValue.of(2.0));
        assertFalse(FormulaValue.of(0L).sameAs(FormulaValue.FALSE));
        assertTrue(FormulaValue.NULL.sameAs(FormulaValue.of((String) null)));
    }

    @Test
    public void testToJava() {
        assertEquals(7L, FormulaValue.of(7L).toJava());
        assertEquals(7.0, FormulaValue.of(7.0).toJava());
        assertNull(FormulaValue.NULL.toJava());
    }

    @Test
    public void testSnapshotIsImmutable() {
        FieldSnapshot snapshot = FieldSnapshot.of(Map.of("a", 1));
        FieldSnapshot extended = snapshot.with("b", FormulaValue.TRUE);

        assertFalse(snapshot.contains("b"));
        assertTrue(extended.contains("b"));
        assertFalse(extended.without("a").contains("a"));
        assertTrue(extended.contains("a"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.asMap().put("c", FormulaValue.NULL));
    }

    @Test
    public void testOutcomeAccessors() {
        Outcome<Integer> ok = Outcome.success(1);
        Outcome<Integer> failed = Outcome.failure(ErrorKind.ARITHMETIC, "boom");

        assertEquals(Outcome.success(2), ok.map(v -> v + 1));
        assertSame(failed.getError(), failed.map(v -> v + 1).getError());
        assertThrows(NoSuchElementException.class, failed::getValue);
        assertThrows(NoSuchElementException.class, ok::getError);
        assertEquals("ARITHMETIC: boom", failed.getError().toString());
    }

    @Test
    public void testFormulaCache() {
        FormulaCache cache = new FormulaCache();
        Formula first = cache.get("a + 1");
        assertSame(first, cache.get("a + 1"));
        assertEquals(1, cache.size());
        assertThrows(FormulaException.class, () -> cache.get("a +"));
        assertEquals(1, cache.size());

        FormulaCache disabled = new FormulaCache(false);
        assertNotSame(disabled.get("a"), disabled.get("a"));
        assertEquals(0, disabled.size());
    }

    @Test
    public void testFormulaCacheEvictsLeastRecentlyUsed() {
        FormulaCache cache = new FormulaCache(true, 3);
        Formula a = cache.get("a");
        cache.get("b");
        cache.get("c");
        assertSame(a, cache.get("a"));
        cache.get("d");
        assertEquals(3, cache.size());
        assertSame(a, cache.get("a"));

        for (int i = 0; i < 5000; i++) {
            cache.get("x + " + i);
        }
        assertEquals(3, cache.getMaxEntries());
        assertEquals(3, cache.size());
        assertThrows(IllegalArgumentException.class, () -> new FormulaCache(true, 0));
    }

    @Test
    public void testIntegralValuesHoldLongs() {
        FormulaValue big = FormulaValue.of(9007199254740993L);
        assertEquals(9007199254740993L, big.asLong());
        assertEquals(9007199254740993L, big.toJava());
        assertEquals("9007199254740993", big.render());
        assertFalse(big.sameAs(FormulaValue.of(9007199254740992L)));
        assertTrue(FormulaValue.of(2L).sameAs(FormulaValue.of(2.0)));
        assertThrows(IllegalStateException.class, () -> FormulaValue.of(2.5).asLong());
    }

    @Test
    public void testLargeDecimalsRenderInScientificNotation() {
        assertEquals("1.0E20", FormulaValue.of(1e20).render());
        assertEquals("2.5", FormulaValue.of(2.5).render());
        assertEquals("1.0E-5", FormulaValue.of(0.00001).render());
    }
}
