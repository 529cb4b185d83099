package org.kaleidoscope.compiler.diagnostics;

import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the errors reported while parsing a source.
 * <p>
 * This decouples error reporting from the parser: the parser throws, the driver
 * reports here, and the presentation layer decides how to print.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a parse failure as an error.
     *
     * @param error The failure to report.
     */
    public void report(ParseException error) {
        SourceInfo where = error.getSourceInfo();
        diagnostics.add(new Diagnostic(error.getCode(), error.getMessage(),
                where.fileName(), where.lineNumber(), where.columnNumber()));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return The number of reported errors.
     */
    public int errorCount() {
        return diagnostics.size();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
