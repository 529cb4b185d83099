package org.kaleidoscope.compiler.frontend.parser;

import org.kaleidoscope.compiler.api.ParseException;
import org.kaleidoscope.compiler.frontend.lexer.Token;
import org.kaleidoscope.compiler.frontend.lexer.TokenType;

/**
 * An interface that encapsulates the token stream as the parser sees it: one
 * current token and an explicit step to the next one. There is never more than
 * one token of lookahead.
 */
public interface ParsingContext {

    /**
     * Returns the current token without consuming it.
     * @return The current token, or {@code null} before the first {@link #advance()}.
     */
    Token current();

    /**
     * Discards the current token and reads the next one.
     * @return The new current token.
     * @throws ParseException if the next token is lexically malformed.
     */
    Token advance() throws ParseException;

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    default boolean check(TokenType type) {
        Token token = current();
        return token != null && token.type() == type;
    }

    /**
     * Checks if the current token is the single-character token {@code c}.
     * @param c The character to check.
     * @return true if the current token is {@code c}.
     */
    default boolean checkChar(char c) {
        Token token = current();
        return token != null && token.isChar(c);
    }

    /**
     * Checks if the end of the input has been reached.
     * @return true if the current token is {@link TokenType#END_OF_FILE}.
     */
    default boolean isAtEnd() {
        return check(TokenType.END_OF_FILE);
    }
}
