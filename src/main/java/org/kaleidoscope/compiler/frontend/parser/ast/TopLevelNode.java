package org.kaleidoscope.compiler.frontend.parser.ast;

/**
 * A unit the top-level parser hands out: a {@link FunctionNode} for definitions and
 * bare expressions, a {@link PrototypeNode} for external declarations.
 */
public interface TopLevelNode extends AstNode {
}
