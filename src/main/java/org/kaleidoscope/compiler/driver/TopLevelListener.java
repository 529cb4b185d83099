package org.kaleidoscope.compiler.driver;

import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.frontend.parser.ast.FunctionNode;
import org.kaleidoscope.compiler.frontend.parser.ast.PrototypeNode;

/**
 * Receives the outcome of every top-level construct the {@link TopLevelDriver} dispatches.
 * All methods default to doing nothing, so implementations only override what they need.
 */
public interface TopLevelListener {

    /**
     * Called before the driver looks at the next top-level construct.
     */
    default void onReady() {
    }

    /**
     * Called for a parsed {@code def}.
     * @param function The definition.
     */
    default void onDefinition(FunctionNode function) {
    }

    /**
     * Called for a parsed {@code extern}.
     * @param prototype The declared signature.
     */
    default void onExtern(PrototypeNode prototype) {
    }

    /**
     * Called for a parsed bare expression.
     * @param function The expression wrapped into an anonymous function.
     */
    default void onTopLevelExpression(FunctionNode function) {
    }

    /**
     * Called when a construct failed. The driver skips one token afterwards.
     * @param error The failure.
     */
    default void onError(ParseException error) {
    }
}
