package io.rulesir.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rulesir.core.ast.ExpNode;
import io.rulesir.core.symbols.FunctionDef;
import io.rulesir.core.symbols.PathRule;
import io.rulesir.core.symbols.SchemaDef;
import io.rulesir.core.symbols.Symbols;
import java.util.List;
import java.util.Map;

/**
 * Renders expression trees and symbol tables as Jackson {@link JsonNode} trees, for debugging
 * and golden-file comparison. This is not the target-language serializer.
 *
 * <p>
 * Node shapes:
 * <ul>
 * <li>{@code {"type":"var","name":"auth"}}</li>
 * <li>{@code {"type":"Null"}}</li>
 * <li>{@code {"type":"String","value":"x"}} (likewise {@code Number}, {@code Boolean},
 * {@code Array})</li>
 * <li>{@code {"type":"ref","base":...,"accessor":"uid"}}</li>
 * <li>{@code {"type":"call","ref":...,"args":[...]}}</li>
 * <li>{@code {"type":"op","op":"&&","args":[...]}}, plus {@code "valueType"} when set</li>
 * <li>{@code {"params":[...],"body":...}} for methods</li>
 * </ul>
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class AstJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AstJson() {}

    /** Renders a single expression tree. */
    public static JsonNode toJson(ExpNode node) {
        if (node instanceof ExpNode.Variable variable) {
            ObjectNode json = typed("var");
            json.put("name", variable.name());
            return json;
        }
        if (node instanceof ExpNode.NullLiteral) {
            return typed("Null");
        }
        if (node instanceof ExpNode.Literal literal) {
            ObjectNode json = typed(literal.kind().typeName());
            switch (literal.kind()) {
                case STRING -> json.put("value", (String) literal.value());
                case NUMBER -> json.put("value", (Double) literal.value());
                case BOOLEAN -> json.put("value", (Boolean) literal.value());
                case ARRAY -> json.set("value", toJson(literal.elements()));
            }
            return json;
        }
        if (node instanceof ExpNode.Reference reference) {
            ObjectNode json = typed("ref");
            json.set("base", toJson(reference.base()));
            json.put("accessor", reference.accessor());
            return json;
        }
        if (node instanceof ExpNode.Call call) {
            ObjectNode json = typed("call");
            json.set("ref", toJson(call.ref()));
            json.set("args", toJson(call.args()));
            return json;
        }
        if (node instanceof ExpNode.Operator operator) {
            ObjectNode json = typed("op");
            json.put("op", operator.op());
            json.set("args", toJson(operator.args()));
            if (operator.valueType() != null) {
                json.put("valueType", operator.valueType());
            }
            return json;
        }
        ExpNode.Method method = (ExpNode.Method) node;
        ObjectNode json = NODES.objectNode();
        json.set("params", strings(method.params()));
        json.set("body", toJson(method.body()));
        return json;
    }

    /**
     * Renders all three registries of a symbol table:
     * {@code {"functions":{...},"paths":{...},"schema":{...}}}.
     */
    public static JsonNode toJson(Symbols symbols) {
        ObjectNode json = NODES.objectNode();

        ObjectNode functions = json.putObject("functions");
        for (Map.Entry<String, FunctionDef> entry : symbols.functions().entrySet()) {
            ObjectNode fn = functions.putObject(entry.getKey());
            fn.set("params", strings(entry.getValue().params()));
            fn.set("body", toJson(entry.getValue().body()));
        }

        ObjectNode paths = json.putObject("paths");
        for (Map.Entry<String, PathRule> entry : symbols.paths().entrySet()) {
            PathRule rule = entry.getValue();
            ObjectNode path = paths.putObject(entry.getKey());
            path.set("parts", strings(rule.parts()));
            path.put("isType", rule.isType());
            path.set("methods", methods(rule.methods()));
        }

        ObjectNode schemas = json.putObject("schema");
        for (Map.Entry<String, SchemaDef> entry : symbols.schemas().entrySet()) {
            SchemaDef schema = entry.getValue();
            ObjectNode s = schemas.putObject(entry.getKey());
            s.put("derivedFrom", schema.derivedFrom());
            ObjectNode properties = s.putObject("properties");
            schema.properties().forEach(properties::put);
            s.set("methods", methods(schema.methods()));
        }
        return json;
    }

    /**
     * Pretty-prints a rendered tree.
     *
     * @throws IllegalArgumentException if Jackson fails to write the tree
     */
    public static String toJsonString(JsonNode json) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize AST to JSON", e);
        }
    }

    private static ObjectNode typed(String type) {
        ObjectNode json = NODES.objectNode();
        json.put("type", type);
        return json;
    }

    private static ArrayNode toJson(List<ExpNode> nodes) {
        ArrayNode array = NODES.arrayNode();
        for (ExpNode node : nodes) {
            array.add(toJson(node));
        }
        return array;
    }

    private static ArrayNode strings(List<String> values) {
        ArrayNode array = NODES.arrayNode();
        values.forEach(array::add);
        return array;
    }

    private static ObjectNode methods(Map<String, ExpNode.Method> methods) {
        ObjectNode json = NODES.objectNode();
        methods.forEach((name, method) -> json.set(name, toJson(method)));
        return json;
    }
}
