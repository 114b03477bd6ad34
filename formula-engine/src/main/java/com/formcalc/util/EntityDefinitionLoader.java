package com.formcalc.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formcalc.formula.EntityDefinition;
import com.formcalc.formula.FieldDefinition;
import com.formcalc.formula.FieldSnapshot;
import com.formcalc.formula.OutputMapping;
import com.formcalc.formula.OutputTarget;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an entity definition from JSON:
 *
 * <pre>
 * {
 *   "entity": "borehole",
 *   "values": { "depth_from": 5, "depth_to": 10.0 },
 *   "fields": [
 *     { "id": "total_depth", "formula": "depth_from + depth_to",
 *       "outputs": [ { "target": "TEXT", "formula": "total_depth" } ] }
 *   ]
 * }
 * </pre>
 */
public class EntityDefinitionLoader {

    /**
     * @throws IllegalArgumentException when the document does not describe a valid entity
     */
    public static EntityDefinition fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Entity definition must be a JSON object");
        }
        String id = root.path("entity").asText("");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Entity definition has no 'entity' id");
        }

        Map<String, Object> values = new LinkedHashMap<>();
        JsonNode valuesNode = root.path("values");
        if (!valuesNode.isMissingNode() && !valuesNode.isObject()) {
            throw new IllegalArgumentException("'values' of entity '" + id + "' must be an object");
        }
        valuesNode.fields().forEachRemaining(entry -> values.put(entry.getKey(), parseLiteral(entry.getKey(), entry.getValue())));

        List<FieldDefinition> fields = new ArrayList<>();
        for (JsonNode fieldNode : root.path("fields")) {
            fields.add(parseField(fieldNode));
        }

        LoggingUtil.debug("Loaded entity '" + id + "' with " + values.size() + " values and " + fields.size() + " fields");
        return new EntityDefinition(id, FieldSnapshot.of(values), fields);
    }

    public static EntityDefinition loadFromFile(File file) throws IOException {
        if (!file.exists()) {
            throw new IOException("Entity definition file not found: " + file.getPath());
        }
        return fromJson(new ObjectMapper().readTree(file));
    }

    public static EntityDefinition loadFromResource(String resource) throws IOException {
        try (InputStream in = EntityDefinitionLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Entity definition resource not found: " + resource);
            }
            return fromJson(new ObjectMapper().readTree(in));
        }
    }

    private static FieldDefinition parseField(JsonNode fieldNode) {
        String fieldId = fieldNode.path("id").asText("");
        String formula = fieldNode.hasNonNull("formula") ? fieldNode.get("formula").asText() : null;

        List<OutputMapping> outputs = new ArrayList<>();
        for (JsonNode outputNode : fieldNode.path("outputs")) {
            OutputTarget target = OutputTarget.parse(outputNode.path("target").asText(null));
            outputs.add(new OutputMapping(target, outputNode.path("formula").asText("")));
        }
        return new FieldDefinition(fieldId, formula, outputs);
    }

    private static Object parseLiteral(String field, JsonNode node) {
        if (node.isNull()) return null;
        if (node.isIntegralNumber() && node.canConvertToLong()) return node.longValue();
        if (node.isNumber()) return node.doubleValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isTextual()) return node.asText();
        throw new IllegalArgumentException("Unsupported value for field '" + field + "': " + node);
    }
}
