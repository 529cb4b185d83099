package org.kaleidoscope.compiler.frontend.parser.ast;

import org.kaleidoscope.compiler.api.SourceInfo;

/**
 * An AST node that references a variable, like {@code a}.
 *
 * @param name The name of the variable.
 * @param sourceInfo Where the reference was found.
 */
public record VariableNode(
        String name,
        SourceInfo sourceInfo
) implements ExprNode {
}
