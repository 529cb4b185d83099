package org.kaleidoscope.compiler.driver;

import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.diagnostics.DiagnosticsEngine;
import org.kaleidoscope.compiler.frontend.parser.ast.FunctionNode;
import org.kaleidoscope.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleidoscope.compiler.frontend.parser.ast.TopLevelNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@link TopLevelListener} that keeps every parsed unit in source order and reports
 * every failure into a {@link DiagnosticsEngine}.
 */
public class CollectingListener implements TopLevelListener {

    private final List<TopLevelNode> units = new ArrayList<>();
    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics The engine receiving the errors.
     */
    public CollectingListener(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    @Override
    public void onDefinition(FunctionNode function) {
        units.add(function);
    }

    @Override
    public void onExtern(PrototypeNode prototype) {
        units.add(prototype);
    }

    @Override
    public void onTopLevelExpression(FunctionNode function) {
        units.add(function);
    }

    @Override
    public void onError(ParseException error) {
        diagnostics.report(error);
    }

    /**
     * @return The parsed units in source order.
     */
    public List<TopLevelNode> getUnits() {
        return Collections.unmodifiableList(units);
    }

    /**
     * @return The engine errors are reported to.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
