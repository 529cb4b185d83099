package org.kaleidoscope.compiler.frontend.parser.ast;

import org.kaleidoscope.compiler.api.SourceInfo;

/**
 * An AST node that represents a numeric literal like {@code 1.0}.
 *
 * @param value The value of the literal.
 * @param sourceInfo Where the literal was found.
 */
public record NumberLiteralNode(
        double value,
        SourceInfo sourceInfo
) implements ExprNode {
    // This node has no children and inherits the empty list from getChildren().
}
