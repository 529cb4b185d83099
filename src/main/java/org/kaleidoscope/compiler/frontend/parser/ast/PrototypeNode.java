package org.kaleidoscope.compiler.frontend.parser.ast;

import org.kaleidoscope.compiler.api.SourceInfo;

import java.util.List;

/**
 * The "prototype" of a function: its name and the names of its parameters
 * (thus implicitly the number of arguments it takes). Used for definitions and
 * for external declarations. Duplicate parameter names are not rejected.
 *
 * @param name The function name, empty for the prototype of a top-level expression.
 * @param parameters The parameter names, in source order.
 * @param sourceInfo Where the prototype starts.
 */
public record PrototypeNode(
        String name,
        List<String> parameters,
        SourceInfo sourceInfo
) implements TopLevelNode {

    public PrototypeNode {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * Creates the nameless, parameterless prototype that wraps a top-level expression.
     * @param sourceInfo The position of the wrapped expression.
     * @return The anonymous prototype.
     */
    public static PrototypeNode anonymous(SourceInfo sourceInfo) {
        return new PrototypeNode("", List.of(), sourceInfo);
    }

    /**
     * @return true if this is the prototype of a top-level expression.
     */
    public boolean isAnonymous() {
        return name.isEmpty();
    }

    /**
     * @return The number of parameters.
     */
    public int arity() {
        return parameters.size();
    }
}
