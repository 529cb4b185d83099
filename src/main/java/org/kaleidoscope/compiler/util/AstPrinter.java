package org.kaleidoscope.compiler.util;

import org.kaleidoscope.compiler.frontend.parser.ast.AstNode;
import org.kaleidoscope.compiler.frontend.parser.ast.BinaryExprNode;
import org.kaleidoscope.compiler.frontend.parser.ast.CallNode;
import org.kaleidoscope.compiler.frontend.parser.ast.ExprNode;
import org.kaleidoscope.compiler.frontend.parser.ast.FunctionNode;
import org.kaleidoscope.compiler.frontend.parser.ast.NumberLiteralNode;
import org.kaleidoscope.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleidoscope.compiler.frontend.parser.ast.TopLevelNode;
import org.kaleidoscope.compiler.frontend.parser.ast.VariableNode;

/**
 * Renders AST nodes as S-expressions, e.g. {@code (def (proto foo a b) (+ a b))}.
 * Used by the command line and handy in tests, where one string says more than
 * a chain of casts.
 */
public final class AstPrinter {

    private static final String ANONYMOUS = "<anonymous>";

    private AstPrinter() {}

    /**
     * Renders a top-level unit; a prototype on its own is rendered as an extern.
     * @param unit The unit to render.
     * @return The S-expression.
     */
    public static String printTopLevel(TopLevelNode unit) {
        if (unit instanceof PrototypeNode prototype) {
            return "(extern " + print(prototype) + ")";
        }
        return print(unit);
    }

    /**
     * Renders any node.
     * @param node The node to render.
     * @return The S-expression.
     */
    public static String print(AstNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    /**
     * Formats a literal value: integral values without a fraction, others as Java does.
     * @param value The value.
     * @return The formatted number.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static void append(StringBuilder sb, AstNode node) {
        if (node instanceof NumberLiteralNode number) {
            sb.append(formatNumber(number.value()));
        } else if (node instanceof VariableNode variable) {
            sb.append(variable.name());
        } else if (node instanceof BinaryExprNode binary) {
            sb.append('(').append(binary.operator()).append(' ');
            append(sb, binary.left());
            sb.append(' ');
            append(sb, binary.right());
            sb.append(')');
        } else if (node instanceof CallNode call) {
            sb.append("(call ").append(call.callee());
            for (ExprNode argument : call.arguments()) {
                sb.append(' ');
                append(sb, argument);
            }
            sb.append(')');
        } else if (node instanceof PrototypeNode prototype) {
            sb.append("(proto ").append(prototype.isAnonymous() ? ANONYMOUS : prototype.name());
            for (String parameter : prototype.parameters()) {
                sb.append(' ').append(parameter);
            }
            sb.append(')');
        } else if (node instanceof FunctionNode function) {
            sb.append("(def ");
            append(sb, function.prototype());
            sb.append(' ');
            append(sb, function.body());
            sb.append(')');
        } else {
            throw new IllegalArgumentException("Unsupported AST node: " + node.getClass().getName());
        }
    }
}
