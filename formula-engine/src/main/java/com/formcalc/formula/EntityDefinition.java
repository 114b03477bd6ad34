package com.formcalc.formula;

import java.util.*;

/**
 * One entity's field definitions plus the user-entered values they are evaluated against.
 */
public final class EntityDefinition {

    private final String id;
    private final FieldSnapshot values;
    private final List<FieldDefinition> fields;

    public EntityDefinition(String id, FieldSnapshot values, List<FieldDefinition> fields) {
        this.id = Objects.requireNonNull(id, "id");
        this.values = Objects.requireNonNull(values, "values");
        Set<String> seen = new HashSet<>();
        for (FieldDefinition field : fields) {
            if (!seen.add(field.getId())) {
                throw new IllegalArgumentException("Duplicate field '" + field.getId() + "' in entity '" + id + "'");
            }
        }
        this.fields = List.copyOf(fields);
    }

    public String getId() {
        return id;
    }

    public FieldSnapshot getValues() {
        return values;
    }

    public List<FieldDefinition> getFields() {
        return fields;
    }

    /**
     * Formula text of every calculated field, in declaration order.
     */
    public Map<String, String> getFormulas() {
        Map<String, String> formulas = new LinkedHashMap<>();
        for (FieldDefinition field : fields) {
            field.getFormula().ifPresent(f -> formulas.put(field.getId(), f));
        }
        return formulas;
    }
}
