package org.kaleidoscope.compiler.frontend.parser.ast;

import org.kaleidoscope.compiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * An AST node for a binary operator applied to two operands.
 *
 * @param operator The operator character, e.g. '+'.
 * @param left The left operand.
 * @param right The right operand.
 * @param sourceInfo The position of the left operand's first token.
 */
public record BinaryExprNode(
        char operator,
        ExprNode left,
        ExprNode right,
        SourceInfo sourceInfo
) implements ExprNode {

    public BinaryExprNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
