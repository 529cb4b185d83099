package org.kaleidoscope.compiler.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.kaleidoscope.compiler.api.SourceInfo;
import org.kaleidoscope.compiler.frontend.parser.ast.AstNode;
import org.kaleidoscope.compiler.frontend.parser.ast.BinaryExprNode;
import org.kaleidoscope.compiler.frontend.parser.ast.CallNode;
import org.kaleidoscope.compiler.frontend.parser.ast.ExprNode;
import org.kaleidoscope.compiler.frontend.parser.ast.FunctionNode;
import org.kaleidoscope.compiler.frontend.parser.ast.NumberLiteralNode;
import org.kaleidoscope.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleidoscope.compiler.frontend.parser.ast.TopLevelNode;
import org.kaleidoscope.compiler.frontend.parser.ast.VariableNode;

import java.util.List;

/**
 * Converts AST nodes into a Jackson tree. Every object has a {@code "kind"} field
 * naming the node type; positions are flattened into {@code "line"} and {@code "column"}.
 */
public class AstJsonWriter {

    private final ObjectMapper mapper;

    public AstJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    /**
     * @param mapper The mapper used to create nodes and to render text.
     */
    public AstJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Renders a list of top-level units as a JSON array.
     * @param units The units.
     * @return The JSON text.
     * @throws JsonProcessingException if rendering fails.
     */
    public String toJson(List<TopLevelNode> units) throws JsonProcessingException {
        ArrayNode array = mapper.createArrayNode();
        for (TopLevelNode unit : units) {
            array.add(toTree(unit));
        }
        return mapper.writeValueAsString(array);
    }

    /**
     * Converts one node and its subtree.
     * @param node The node.
     * @return The JSON object.
     */
    public ObjectNode toTree(AstNode node) {
        ObjectNode json = mapper.createObjectNode();
        if (node instanceof NumberLiteralNode number) {
            json.put("kind", "number");
            json.put("value", number.value());
            position(json, number.sourceInfo());
        } else if (node instanceof VariableNode variable) {
            json.put("kind", "variable");
            json.put("name", variable.name());
            position(json, variable.sourceInfo());
        } else if (node instanceof BinaryExprNode binary) {
            json.put("kind", "binary");
            json.put("operator", String.valueOf(binary.operator()));
            json.set("left", toTree(binary.left()));
            json.set("right", toTree(binary.right()));
            position(json, binary.sourceInfo());
        } else if (node instanceof CallNode call) {
            json.put("kind", "call");
            json.put("callee", call.callee());
            ArrayNode arguments = json.putArray("arguments");
            for (ExprNode argument : call.arguments()) {
                arguments.add(toTree(argument));
            }
            position(json, call.sourceInfo());
        } else if (node instanceof PrototypeNode prototype) {
            json.put("kind", "prototype");
            json.put("name", prototype.name());
            ArrayNode parameters = json.putArray("parameters");
            prototype.parameters().forEach(parameters::add);
            position(json, prototype.sourceInfo());
        } else if (node instanceof FunctionNode function) {
            json.put("kind", function.isTopLevelExpression() ? "expression" : "function");
            json.set("prototype", toTree(function.prototype()));
            json.set("body", toTree(function.body()));
        } else {
            throw new IllegalArgumentException("Unsupported AST node: " + node.getClass().getName());
        }
        return json;
    }

    private static void position(ObjectNode json, SourceInfo sourceInfo) {
        json.put("line", sourceInfo.lineNumber());
        json.put("column", sourceInfo.columnNumber());
    }
}
