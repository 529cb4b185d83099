package org.kaleidoscope.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A function definition: a prototype together with the body expression.
 * Top-level expressions are represented as functions with an anonymous prototype.
 *
 * @param prototype The signature of the function.
 * @param body The expression computing the result.
 */
public record FunctionNode(
        PrototypeNode prototype,
        ExprNode body
) implements TopLevelNode {

    public FunctionNode {
        Objects.requireNonNull(prototype, "prototype");
        Objects.requireNonNull(body, "body");
    }

    /**
     * @return true if this function wraps a bare top-level expression.
     */
    public boolean isTopLevelExpression() {
        return prototype.isAnonymous();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(prototype, body);
    }
}
