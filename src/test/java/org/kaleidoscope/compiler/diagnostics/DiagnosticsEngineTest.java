package org.kaleidoscope.compiler.diagnostics;

import org.kaleidoscope.compiler.api.ParseErrorCode;
import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.frontend.lexer.Token;
import org.kaleidoscope.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    void testReportsParseException() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Token token = new Token(TokenType.CHAR, ")", ')', 3, 7, "x.k");

        diagnostics.report(new ParseException(ParseErrorCode.UNKNOWN_TOKEN, token));

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::code, Diagnostic::lineNumber, Diagnostic::columnNumber)
                .containsExactly(ParseErrorCode.UNKNOWN_TOKEN, 3, 7);
        assertThat(diagnostics.summary()).isEqualTo("x.k:3:7: error: unknown token when expecting an expression");
    }

    @Test
    @Tag("unit")
    void testEmptyEngine() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.errorCount()).isZero();
        assertThat(diagnostics.summary()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testSummaryJoinsLines() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.report(new ParseException(ParseErrorCode.EXPECTED_CLOSING_PAREN,
                new Token(TokenType.END_OF_FILE, "", null, 1, 2, "a")));
        diagnostics.report(new ParseException(ParseErrorCode.MALFORMED_NUMBER, "malformed number literal '1..'",
                new Token(TokenType.UNEXPECTED, "1..", null, 3, 4, "a")));

        assertThat(diagnostics.errorCount()).isEqualTo(2);
        assertThat(diagnostics.summary())
                .isEqualTo("a:1:2: error: expected ')'\na:3:4: error: malformed number literal '1..'");
        assertThatThrownBy(() -> diagnostics.getDiagnostics().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
