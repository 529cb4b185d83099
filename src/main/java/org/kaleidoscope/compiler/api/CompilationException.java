package org.kaleidoscope.compiler.api;

import org.kaleidoscope.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur while parsing a whole source.
 * <p>
 * It is part of the public API. Unlike {@link ParseException}, which describes a single
 * failed construct, it summarizes every diagnostic reported during the run.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception carrying the diagnostics that caused it.
     * @param message The detail message, usually the diagnostics summary.
     * @param diagnostics The diagnostics reported during the run.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics reported during the run.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
