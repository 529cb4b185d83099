package org.kaleidoscope.compiler.api;

/**
 * Defines unique, testable error codes for all errors the frontend can raise.
 * This decouples the test logic from the exact wording of the messages.
 */
public enum ParseErrorCode {
    // region Lexer Errors
    /** A numeric literal with more than one '.' or without any digit. */
    MALFORMED_NUMBER(Kind.LEXICAL, "malformed number literal"),
    // endregion

    // region Expression Errors
    /** A token that cannot start an expression. */
    UNKNOWN_TOKEN(Kind.SYNTAX, "unknown token when expecting an expression"),
    /** The input ended where an expression was required. */
    UNEXPECTED_END_OF_INPUT(Kind.SYNTAX, "unexpected end of input when expecting an expression"),
    /** A parenthesized expression was not closed. */
    EXPECTED_CLOSING_PAREN(Kind.SYNTAX, "expected ')'"),
    /** A call argument was followed by something other than ',' or ')'. */
    EXPECTED_ARGUMENT_SEPARATOR(Kind.SYNTAX, "expected ')' or ',' in argument list"),
    // endregion

    // region Prototype & Definition Errors
    /** A prototype did not start with an identifier. */
    EXPECTED_FUNCTION_NAME(Kind.SYNTAX, "expected function name in prototype"),
    /** The function name of a prototype was not followed by '('. */
    EXPECTED_PROTOTYPE_OPEN_PAREN(Kind.SYNTAX, "expected '(' in prototype"),
    /** The parameter list of a prototype was not closed by ')'. */
    EXPECTED_PROTOTYPE_CLOSE_PAREN(Kind.SYNTAX, "expected ')' in prototype"),
    /** A definition had a prototype but no body. */
    EXPECTED_FUNCTION_BODY(Kind.SYNTAX, "expected function body after prototype");
    // endregion

    /**
     * The broad category of an error.
     */
    public enum Kind {
        /** The character stream could not be turned into a token. */
        LEXICAL,
        /** A token appeared in a position the grammar does not allow. */
        SYNTAX
    }

    private final Kind kind;
    private final String defaultMessage;

    ParseErrorCode(Kind kind, String defaultMessage) {
        this.kind = kind;
        this.defaultMessage = defaultMessage;
    }

    /**
     * @return The category of this error.
     */
    public Kind kind() {
        return kind;
    }

    /**
     * @return The message used when no more specific one is given.
     */
    public String defaultMessage() {
        return defaultMessage;
    }
}
