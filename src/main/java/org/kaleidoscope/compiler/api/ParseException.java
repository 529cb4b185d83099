package org.kaleidoscope.compiler.api;

import org.kaleidoscope.compiler.frontend.lexer.Token;

/**
 * Thrown when the lexer or the parser cannot continue with the current construct.
 * <p>
 * Every parse operation either returns a complete node or throws this exception;
 * partially built subtrees are discarded. Recovery is the caller's business.
 */
public class ParseException extends Exception {

    private final ParseErrorCode code;
    private final transient Token token;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new parse exception with the default message of the code.
     * @param code The error code.
     * @param token The offending token.
     */
    public ParseException(ParseErrorCode code, Token token) {
        this(code, code.defaultMessage(), token);
    }

    /**
     * Constructs a new parse exception.
     * @param code The error code.
     * @param message The human-readable message.
     * @param token The offending token.
     */
    public ParseException(ParseErrorCode code, String message, Token token) {
        super(message);
        this.code = code;
        this.token = token;
        this.sourceInfo = token.sourceInfo();
    }

    /**
     * Creates the error of a numeric literal the lexer could not read.
     * @param token The {@link org.kaleidoscope.compiler.frontend.lexer.TokenType#UNEXPECTED} token holding the literal.
     * @return The exception.
     */
    public static ParseException malformedNumber(Token token) {
        return new ParseException(ParseErrorCode.MALFORMED_NUMBER,
                ParseErrorCode.MALFORMED_NUMBER.defaultMessage() + " '" + token.text() + "'", token);
    }

    /**
     * @return The error code.
     */
    public ParseErrorCode getCode() {
        return code;
    }

    /**
     * @return The category of the error.
     */
    public ParseErrorCode.Kind getKind() {
        return code.kind();
    }

    /**
     * @return The token that caused the error.
     */
    public Token getToken() {
        return token;
    }

    /**
     * @return Where the error occurred.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
