package org.kaleidoscope.compiler;

import com.typesafe.config.Config;
import org.kaleidoscope.compiler.api.CompilationException;
import org.kaleidoscope.compiler.api.IFrontend;
import org.kaleidoscope.compiler.diagnostics.CompilerLogger;
import org.kaleidoscope.compiler.diagnostics.DiagnosticsEngine;
import org.kaleidoscope.compiler.driver.CollectingListener;
import org.kaleidoscope.compiler.driver.TopLevelDriver;
import org.kaleidoscope.compiler.frontend.lexer.StringCharSource;
import org.kaleidoscope.compiler.frontend.parser.Parser;
import org.kaleidoscope.compiler.frontend.parser.PrecedenceTable;
import org.kaleidoscope.compiler.frontend.parser.ast.TopLevelNode;

import java.util.List;

/**
 * The main frontend implementation. It runs lexer, parser and top-level driver over a
 * whole source and turns the collected diagnostics into a {@link CompilationException}.
 * It is not thread-safe; every {@link #parse(String, String)} call starts a fresh
 * parse session, so separate instances may be used concurrently.
 */
public class Frontend implements IFrontend {

    private final PrecedenceTable precedence;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    /**
     * Creates a frontend for the standard operator set.
     */
    public Frontend() {
        this(PrecedenceTable.defaults());
    }

    /**
     * Creates a frontend whose operators are read from configuration.
     * @param config The configuration, see {@link PrecedenceTable#fromConfig(Config)}.
     */
    public Frontend(Config config) {
        this(PrecedenceTable.fromConfig(config));
    }

    /**
     * Creates a frontend for a custom operator set.
     * @param precedence The operator table. It is copied.
     */
    public Frontend(PrecedenceTable precedence) {
        this.precedence = precedence.copy();
    }

    @Override
    public List<TopLevelNode> parse(String source, String sourceName) throws CompilationException {
        diagnostics = new DiagnosticsEngine();
        CollectingListener listener = new CollectingListener(diagnostics);
        Parser parser = Parser.forSource(new StringCharSource(source), sourceName, precedence);

        new TopLevelDriver(parser, listener).run();

        if (diagnostics.hasErrors()) {
            CompilerLogger.debug("Parsing '{}' failed with {} error(s)", sourceName, diagnostics.errorCount());
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
        CompilerLogger.debug("Parsed {} top-level unit(s) from '{}'", listener.getUnits().size(), sourceName);
        return List.copyOf(listener.getUnits());
    }

    /**
     * @return The diagnostics of the most recent {@link #parse(String, String)} call.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
