package com.formcalc.formula;

import java.util.List;
import java.util.Objects;

/**
 * One circular dependency: the fields on the cycle, starting at the smallest field id.
 */
public final class CycleReport {

    private final List<String> fields;

    public CycleReport(List<String> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("A cycle has at least one field");
        }
        this.fields = List.copyOf(fields);
    }

    public List<String> getFields() {
        return fields;
    }

    /**
     * Readable path closing back on the first field, e.g. {@code a -> b -> a}.
     */
    public String getPath() {
        return String.join(" -> ", fields) + " -> " + fields.get(0);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CycleReport other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return getPath();
    }
}
