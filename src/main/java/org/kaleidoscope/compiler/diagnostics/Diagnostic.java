package org.kaleidoscope.compiler.diagnostics;

import org.kaleidoscope.compiler.api.ParseErrorCode;

/**
 * Represents a single error reported while parsing a source.
 *
 * @param code The error code.
 * @param message The diagnostic message.
 * @param fileName The name of the source where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 */
public record Diagnostic(
        ParseErrorCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {

    @Override
    public String toString() {
        return String.format("%s:%d:%d: error: %s", fileName, lineNumber, columnNumber, message);
    }
}
