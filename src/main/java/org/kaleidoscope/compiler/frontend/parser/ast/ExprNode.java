package org.kaleidoscope.compiler.frontend.parser.ast;

import org.kaleidoscope.compiler.api.SourceInfo;

/**
 * An AST node that produces a value: a literal, a variable reference,
 * a binary expression or a call.
 */
public interface ExprNode extends AstNode {

    /**
     * @return The position of the first token of the expression.
     */
    SourceInfo sourceInfo();
}
