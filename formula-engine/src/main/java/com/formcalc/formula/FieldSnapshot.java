package com.formcalc.formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of one entity's field values at the moment of evaluation.
 * A missing key means the field is undefined, which is different from a field holding null.
 */
public final class FieldSnapshot {

    private static final FieldSnapshot EMPTY = new FieldSnapshot(new LinkedHashMap<>());

    private final Map<String, FormulaValue> values;

    private FieldSnapshot(LinkedHashMap<String, FormulaValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static FieldSnapshot empty() {
        return EMPTY;
    }

    /**
     * Snapshot from plain Java values (Number, String, Boolean or null).
     *
     * @throws IllegalArgumentException for values of any other type
     */
    public static FieldSnapshot of(Map<String, ?> raw) {
        LinkedHashMap<String, FormulaValue> converted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            converted.put(entry.getKey(), FormulaValue.from(entry.getValue()));
        }
        return new FieldSnapshot(converted);
    }

    public boolean contains(String field) {
        return values.containsKey(field);
    }

    public Optional<FormulaValue> get(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public Set<String> fieldNames() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    /**
     * A new snapshot with the field set to the value; this snapshot is left untouched.
     */
    public FieldSnapshot with(String field, FormulaValue value) {
        LinkedHashMap<String, FormulaValue> copy = new LinkedHashMap<>(values);
        copy.put(field, value);
        return new FieldSnapshot(copy);
    }

    /**
     * A new snapshot without the field; this snapshot is left untouched.
     */
    public FieldSnapshot without(String field) {
        if (!values.containsKey(field)) {
            return this;
        }
        LinkedHashMap<String, FormulaValue> copy = new LinkedHashMap<>(values);
        copy.remove(field);
        return new FieldSnapshot(copy);
    }

    public Map<String, FormulaValue> asMap() {
        return values;
    }

    /**
     * Plain Java values, in insertion order.
     */
    public Map<String, Object> toJava() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, v.toJava()));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldSnapshot other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
