package org.kaleidoscope.compiler.frontend.parser.ast;

import org.kaleidoscope.compiler.api.SourceInfo;

import java.util.List;

/**
 * An AST node for a function call, like {@code foo(1, x)}.
 *
 * @param callee The name of the called function.
 * @param arguments The argument expressions, in source order.
 * @param sourceInfo Where the callee name was found.
 */
public record CallNode(
        String callee,
        List<ExprNode> arguments,
        SourceInfo sourceInfo
) implements ExprNode {

    /**
     * Compact constructor to ensure the argument list is never null and cannot be changed.
     */
    public CallNode {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }
}
